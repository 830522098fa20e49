/*
 * どこで: ジョブキュー基盤
 * 何を: 1 つの論理キューへの投入口 (遅延/重複排除/繰り返し登録)
 * なぜ: グローバルなキューシングルトンを使わず、起動時に作ったハンドルを明示的に渡すため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.model.QueueJobRecord;
import com.example.dispatcher.model.QueueJobStatus;
import com.example.dispatcher.model.RepeatingTriggerRecord;
import com.example.dispatcher.repository.QueueJobRepository;
import com.example.dispatcher.repository.RepeatingTriggerRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

public class JobQueue {

  private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);

  private final QueueName name;
  private final QueueJobRepository jobRepository;
  private final RepeatingTriggerRepository triggerRepository;
  private final JobPayloadCodec codec;
  private final Clock clock;
  private final int defaultAttempts;

  JobQueue(
      QueueName name,
      QueueJobRepository jobRepository,
      RepeatingTriggerRepository triggerRepository,
      JobPayloadCodec codec,
      Clock clock,
      int defaultAttempts) {
    this.name = name;
    this.jobRepository = jobRepository;
    this.triggerRepository = triggerRepository;
    this.codec = codec;
    this.clock = clock;
    this.defaultAttempts = defaultAttempts;
  }

  public QueueName name() {
    return name;
  }

  public UUID enqueue(JobPayload payload) {
    return enqueue(payload, EnqueueOptions.defaults());
  }

  public UUID enqueue(JobPayload payload, EnqueueOptions options) {
    QueueJobRecord record = toRecord(payload, options);
    jobRepository.insert(record);
    logger.debug(
        "job enqueued queue={} type={} jobId={} notBefore={}",
        name.value(),
        payload.jobType().value(),
        record.jobId(),
        record.notBefore());
    return record.jobId();
  }

  /** dedupKey を持つ未完了ジョブが既にあれば投入しない。 */
  public Optional<UUID> enqueueIfAbsent(JobPayload payload, EnqueueOptions options) {
    if (options.dedupKey() == null || options.dedupKey().isBlank()) {
      throw new IllegalArgumentException("dedupKey is required");
    }
    QueueJobRecord record = toRecord(payload, options);
    if (!jobRepository.insertIfAbsent(record)) {
      logger.debug(
          "job enqueue skipped by dedup queue={} type={} dedupKey={}",
          name.value(),
          payload.jobType().value(),
          options.dedupKey());
      return Optional.empty();
    }
    return Optional.of(record.jobId());
  }

  /** 6 フィールドの cron 式で繰り返し実行を登録する。同じ種別の再登録は上書き。 */
  public void repeat(JobPayload payload, String cron) {
    requireOwnType(payload);
    CronExpression expression = CronExpression.parse(cron);
    Instant now = Instant.now(clock);
    Instant nextRunAt = nextRun(expression, now);
    triggerRepository.upsert(
        new RepeatingTriggerRecord(
            triggerKey(payload.jobType()),
            payload.jobType(),
            codec.encode(payload),
            cron,
            nextRunAt,
            null),
        now);
    logger.info(
        "repeating job registered queue={} type={} cron={} nextRunAt={}",
        name.value(),
        payload.jobType().value(),
        cron,
        nextRunAt);
  }

  public int pendingCount() {
    return jobRepository.countPending(name);
  }

  static String triggerKey(JobType jobType) {
    return "repeat:" + jobType.queue().value() + ":" + jobType.value();
  }

  static Instant nextRun(CronExpression expression, Instant after) {
    ZonedDateTime next = expression.next(after.atZone(ZoneOffset.UTC));
    if (next == null) {
      throw new IllegalArgumentException("cron expression never fires: " + expression);
    }
    return next.toInstant();
  }

  private QueueJobRecord toRecord(JobPayload payload, EnqueueOptions options) {
    requireOwnType(payload);
    Instant now = Instant.now(clock);
    UUID jobId = options.jobId() != null ? options.jobId() : UUID.randomUUID();
    int attempts = options.attempts() != null ? options.attempts() : defaultAttempts;
    return new QueueJobRecord(
        jobId,
        name,
        payload.jobType(),
        codec.encode(payload),
        QueueJobStatus.PENDING,
        now.plus(options.delayOrZero()),
        0,
        Math.max(1, attempts),
        options.removeOnComplete(),
        options.dedupKey(),
        null,
        null,
        null,
        null,
        now,
        null);
  }

  private void requireOwnType(JobPayload payload) {
    if (payload.jobType().queue() != name) {
      throw new IllegalArgumentException(
          "job type "
              + payload.jobType().value()
              + " belongs to "
              + payload.jobType().queue().value()
              + ", not "
              + name.value());
    }
  }
}
