/*
 * どこで: Dispatcher サービス層 (ScheduleMonitor/Verify)
 * 何を: 送信時刻が近い予約メッセージを AGENDADA にし、遅延付き送信ジョブを投入する
 * なぜ: 検証と実送信の間の時計ずれを固定遅延で吸収しつつ二重予約を防ぐため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.ScheduleProperties;
import com.example.dispatcher.model.ScheduleRecord;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobQueue;
import com.example.dispatcher.queue.JobQueues;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.queue.SendScheduledMessagePayload;
import com.example.dispatcher.queue.VerifySchedulesPayload;
import com.example.dispatcher.repository.ScheduleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ScheduleVerifier implements JobHandler<VerifySchedulesPayload> {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleVerifier.class);
  static final String ERROR_CONTEXT = "ScheduleMonitor -> Verify";

  private final ScheduleRepository scheduleRepository;
  private final JobQueues jobQueues;
  private final ScheduleProperties properties;
  private final ErrorReporter errorReporter;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  @Override
  public JobType jobType() {
    return JobType.VERIFY_SCHEDULES;
  }

  @Override
  public Class<VerifySchedulesPayload> payloadType() {
    return VerifySchedulesPayload.class;
  }

  @Override
  public void handle(VerifySchedulesPayload payload, JobContext context) {
    Instant now = Instant.now(clock);
    List<ScheduleRecord> due = scheduleRepository.findDue(now, now.plus(properties.lookahead()));
    if (due.isEmpty()) {
      return;
    }
    TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    JobQueue sendQueue = jobQueues.get(QueueName.SEND_SCHEDULED_MESSAGES);
    for (ScheduleRecord schedule : due) {
      // 1 件の失敗でバッチ全体を止めない
      try {
        Boolean scheduled =
            transactionTemplate.execute(status -> scheduleOne(schedule, sendQueue, now));
        if (Boolean.TRUE.equals(scheduled)) {
          logger.info(
              "scheduled message queued scheduleId={} contact={} delay={}",
              schedule.id(),
              schedule.contactName(),
              properties.sendDelay());
        }
      } catch (RuntimeException ex) {
        errorReporter.report(ERROR_CONTEXT, ex);
      }
    }
  }

  private boolean scheduleOne(ScheduleRecord schedule, JobQueue sendQueue, Instant now) {
    // 他の tick が先に反転させた行は飛ばす
    if (scheduleRepository.markScheduled(schedule.id(), now) == 0) {
      return false;
    }
    sendQueue.enqueue(
        new SendScheduledMessagePayload(
            schedule.id(),
            schedule.companyId(),
            schedule.contactName(),
            schedule.contactNumber(),
            schedule.body()),
        EnqueueOptions.defaults().withDelay(properties.sendDelay()).removingOnComplete());
    return true;
  }
}
