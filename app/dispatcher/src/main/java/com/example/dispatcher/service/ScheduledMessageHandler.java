/*
 * どこで: Dispatcher サービス層 (SendScheduledMessages/SendMessage)
 * 何を: 予約メッセージを会社の既定チャネルから送信し、結果を schedules に記録する
 * なぜ: 送信失敗を ERRO として終端させ、同じ予約を自動で再送しないため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.ScheduleRecord;
import com.example.dispatcher.model.ScheduleStatus;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.NonRetryableJobException;
import com.example.dispatcher.queue.SendScheduledMessagePayload;
import com.example.dispatcher.repository.ScheduleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledMessageHandler implements JobHandler<SendScheduledMessagePayload> {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledMessageHandler.class);
  static final String ERROR_CONTEXT = "SendScheduledMessages -> SendMessage";

  private final ScheduleRepository scheduleRepository;
  private final ChannelResolver channelResolver;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  @Override
  public JobType jobType() {
    return JobType.SEND_SCHEDULED_MESSAGE;
  }

  @Override
  public Class<SendScheduledMessagePayload> payloadType() {
    return SendScheduledMessagePayload.class;
  }

  @Override
  public void handle(SendScheduledMessagePayload payload, JobContext context) {
    Optional<ScheduleRecord> current = reload(payload.scheduleId());
    if (current.isPresent() && current.get().status() == ScheduleStatus.ENVIADA) {
      // lease 回収で再実行された場合は送信済み
      logger.info("scheduled message already sent scheduleId={}", payload.scheduleId());
      return;
    }
    try {
      ChannelSession session = channelResolver.defaultSession(payload.companyId());
      session.sendText(ChatIds.forNumber(payload.contactNumber()), payload.body());
      scheduleRepository.markSent(payload.scheduleId(), Instant.now(clock));
      logger.info(
          "scheduled message sent scheduleId={} contact={}",
          payload.scheduleId(),
          payload.contactName());
    } catch (RuntimeException ex) {
      markError(payload.scheduleId(), ex);
      errorReporter.report(ERROR_CONTEXT, ex);
      throw new NonRetryableJobException(
          "scheduled message failed scheduleId=" + payload.scheduleId(), ex);
    }
  }

  // 再読込に失敗してもペイロードのスナップショットで送信は続ける
  private Optional<ScheduleRecord> reload(long scheduleId) {
    try {
      return scheduleRepository.findById(scheduleId);
    } catch (RuntimeException ex) {
      errorReporter.report(ERROR_CONTEXT, ex);
      logger.info("failed to reload schedule scheduleId={}", scheduleId);
      return Optional.empty();
    }
  }

  private void markError(long scheduleId, RuntimeException cause) {
    try {
      scheduleRepository.markError(scheduleId, Instant.now(clock));
    } catch (RuntimeException ex) {
      cause.addSuppressed(ex);
      logger.warn("failed to mark schedule as error scheduleId={}", scheduleId, ex);
    }
  }
}
