/*
 * どこで: ジョブハンドラ登録のユニットテスト
 * 何を: 欠落/重複の起動時検出と種別ごとの振り分けを検証する
 * なぜ: 未知のジョブ種別が実行時に見つかる事態を防ぐため
 */
package com.example.dispatcher.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class JobHandlerRegistryTest {

  @Test
  void dispatchesToHandlerOfPayloadType() {
    final List<JobHandler<?>> handlers = allHandlers();
    final RecordingHandler<ProcessCampaignPayload> process =
        new RecordingHandler<>(JobType.PROCESS_CAMPAIGN, ProcessCampaignPayload.class);
    handlers.removeIf(handler -> handler.jobType() == JobType.PROCESS_CAMPAIGN);
    handlers.add(process);
    final JobHandlerRegistry registry = new JobHandlerRegistry(handlers);
    final ProcessCampaignPayload payload = new ProcessCampaignPayload(7L, 1000L);

    registry.dispatch(payload, context(JobType.PROCESS_CAMPAIGN));

    assertThat(process.received).containsExactly(payload);
  }

  @Test
  void failsWhenAJobTypeHasNoHandler() {
    final List<JobHandler<?>> handlers = allHandlers();
    handlers.removeIf(handler -> handler.jobType() == JobType.VERIFY_LOGIN_STATUS);

    assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("VerifyLoginStatus");
  }

  @Test
  void failsOnDuplicateHandler() {
    final List<JobHandler<?>> handlers = allHandlers();
    handlers.add(new RecordingHandler<>(JobType.DISPATCH_CAMPAIGN, DispatchCampaignPayload.class));

    assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate handler");
  }

  @Test
  void failsWhenHandlerPayloadDoesNotMatchJobType() {
    final List<JobHandler<?>> handlers = allHandlers();
    handlers.removeIf(handler -> handler.jobType() == JobType.PREPARE_CONTACT);
    handlers.add(new RecordingHandler<>(JobType.PREPARE_CONTACT, DispatchCampaignPayload.class));

    assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("payload mismatch");
  }

  @Test
  void sendMessageTypeIsDistinctPerQueue() {
    assertThat(JobType.of(QueueName.MESSAGE_QUEUE, "SendMessage")).isEqualTo(JobType.SEND_MESSAGE);
    assertThat(JobType.of(QueueName.SEND_SCHEDULED_MESSAGES, "SendMessage"))
        .isEqualTo(JobType.SEND_SCHEDULED_MESSAGE);
    assertThatThrownBy(() -> JobType.of(QueueName.USER_MONITOR, "SendMessage"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<JobHandler<?>> allHandlers() {
    final List<JobHandler<?>> handlers = new ArrayList<>();
    for (JobType type : JobType.values()) {
      handlers.add(recording(type, type.payloadClass()));
    }
    return handlers;
  }

  private static <P extends JobPayload> RecordingHandler<P> recording(
      JobType type, Class<P> payloadType) {
    return new RecordingHandler<>(type, payloadType);
  }

  private static JobContext context(JobType type) {
    return new JobContext(UUID.randomUUID(), type.queue(), type, 1, 3);
  }

  private static final class RecordingHandler<P extends JobPayload> implements JobHandler<P> {

    private final JobType type;
    private final Class<P> payloadType;
    private final List<P> received = new ArrayList<>();

    private RecordingHandler(JobType type, Class<P> payloadType) {
      this.type = type;
      this.payloadType = payloadType;
    }

    @Override
    public JobType jobType() {
      return type;
    }

    @Override
    public Class<P> payloadType() {
      return payloadType;
    }

    @Override
    public void handle(P payload, JobContext context) {
      received.add(payload);
    }
  }
}
