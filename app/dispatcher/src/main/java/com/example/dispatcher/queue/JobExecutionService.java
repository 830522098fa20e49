/*
 * どこで: ジョブキュー基盤
 * 何を: claim 済みジョブのハンドラ実行と完了/リトライ/FAILED 遷移を処理する
 * なぜ: 失敗をキュー側で吸収し、ワーカーを止めずに最終状態を制御するため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.config.JobQueueProperties;
import com.example.dispatcher.model.QueueJobRecord;
import com.example.dispatcher.repository.QueueJobRepository;
import com.example.dispatcher.service.DispatchMetrics;
import com.example.dispatcher.service.ErrorReporter;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobExecutionService {

  private static final Logger logger = LoggerFactory.getLogger(JobExecutionService.class);
  static final String RESULT_SUCCESS = "success";
  static final String RESULT_RETRY = "retry";
  static final String RESULT_FAILED = "failed";

  private final QueueJobRepository jobRepository;
  private final JobPayloadCodec codec;
  private final JobHandlerRegistry handlerRegistry;
  private final JobQueueProperties properties;
  private final DispatchMetrics metrics;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  public List<QueueJobRecord> claim(
      QueueName queue, Collection<JobType> types, int limit, String lockedBy) {
    Instant now = Instant.now(clock);
    // claim は単一 SQL で行い、ハンドラの IO を長期トランザクションに載せない
    return jobRepository.claim(queue, types, limit, now, now.plus(properties.lease()), lockedBy);
  }

  public void execute(QueueJobRecord job, String lockedBy) {
    try (JobMdc ignored = JobMdc.open(job)) {
      JobContext context =
          new JobContext(
              job.jobId(), job.queue(), job.jobType(), job.attemptCount(), job.maxAttempts());
      try {
        JobPayload payload = codec.decode(job.jobType(), job.payloadJson());
        handlerRegistry.dispatch(payload, context);
      } catch (NonRetryableJobException ex) {
        markFailed(job, ex, lockedBy);
        return;
      } catch (RuntimeException ex) {
        handleFailure(job, ex, lockedBy);
        return;
      }
      complete(job, lockedBy);
    }
  }

  private void complete(QueueJobRecord job, String lockedBy) {
    try {
      int updated =
          job.removeOnComplete()
              ? jobRepository.deleteCompleted(job.jobId(), lockedBy)
              : jobRepository.markCompleted(job.jobId(), Instant.now(clock), lockedBy);
      if (updated == 0) {
        logger.warn("job completed but lock was lost jobId={} type={}", job.jobId(), job.jobType());
      }
      metrics.recordJobResult(job.jobType(), RESULT_SUCCESS);
    } catch (DataAccessException ex) {
      // ハンドラは成功済み。lease 切れで再実行されうるため記録だけ残す
      logger.error(
          "failed to record job completion jobId={} type={}", job.jobId(), job.jobType(), ex);
    }
  }

  @VisibleForTesting
  void handleFailure(QueueJobRecord job, RuntimeException ex, String lockedBy) {
    if (job.attemptCount() >= job.maxAttempts()) {
      markFailed(job, ex, lockedBy);
      return;
    }
    Duration backoff = computeBackoffDuration(job.attemptCount());
    Instant notBefore = Instant.now(clock).plus(backoff);
    int updated =
        jobRepository.markRetry(job.jobId(), notBefore, truncateError(ex.getMessage()), lockedBy);
    if (updated == 0) {
      logger.warn(
          "job retry skipped because lock was lost jobId={} attempt={}",
          job.jobId(),
          job.attemptCount());
      return;
    }
    metrics.recordJobResult(job.jobType(), RESULT_RETRY);
    logger.warn(
        "job retry scheduled jobId={} type={} attempt={} notBefore={}",
        job.jobId(),
        job.jobType().value(),
        job.attemptCount(),
        notBefore,
        ex);
  }

  private void markFailed(QueueJobRecord job, RuntimeException ex, String lockedBy) {
    int updated =
        jobRepository.markFailed(
            job.jobId(), Instant.now(clock), truncateError(ex.getMessage()), lockedBy);
    if (updated == 0) {
      logger.warn("job failure skipped because lock was lost jobId={}", job.jobId());
      return;
    }
    metrics.recordJobResult(job.jobType(), RESULT_FAILED);
    metrics.recordJobExhausted(job.jobType());
    errorReporter.report(job.queue().value() + " -> " + job.jobType().value(), ex);
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    double baseMillis = properties.backoffBase().toMillis();
    double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    double capped = Math.min(exp, properties.backoffMax().toMillis());
    double jitterMin = properties.backoffJitterMin();
    double jitterMax = properties.backoffJitterMax();
    double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    long backoffMillis = (long) Math.ceil(capped * jitter);
    long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
