/*
 * どこで: ジョブキュー基盤
 * 何を: 各キューから実行可能ジョブを claim し、共有プールへ投入する
 * なぜ: キューごとの同時実行上限と送信レート制限を守りつつポーリングを止めないため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.config.JobQueueProperties;
import com.example.dispatcher.model.QueueJobRecord;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "dispatch.queue.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class JobQueueWorker {

  private static final Logger logger = LoggerFactory.getLogger(JobQueueWorker.class);

  private final JobExecutionService executionService;
  private final WindowRateLimiter rateLimiter;
  private final TaskExecutor jobExecutor;
  private final String lockedBy;
  private final Map<QueueName, Semaphore> slots = new EnumMap<>(QueueName.class);
  private final Map<QueueName, List<JobType>> unlimitedTypes = new EnumMap<>(QueueName.class);
  private final Map<QueueName, List<JobType>> rateLimitedTypes = new EnumMap<>(QueueName.class);

  public JobQueueWorker(
      JobExecutionService executionService,
      WindowRateLimiter rateLimiter,
      @Qualifier("jobExecutor") TaskExecutor jobExecutor,
      WorkerIdentity workerIdentity,
      JobQueueProperties properties) {
    this.executionService = executionService;
    this.rateLimiter = rateLimiter;
    this.jobExecutor = jobExecutor;
    this.lockedBy = workerIdentity.lockedBy();
    for (QueueName queue : QueueName.values()) {
      slots.put(queue, new Semaphore(Math.max(1, properties.concurrency())));
      unlimitedTypes.put(queue, new ArrayList<>());
      rateLimitedTypes.put(queue, new ArrayList<>());
    }
    for (JobType type : JobType.values()) {
      (type.rateLimited() ? rateLimitedTypes : unlimitedTypes).get(type.queue()).add(type);
    }
  }

  @Scheduled(fixedDelayString = "${dispatch.queue.poll-interval}")
  public void run() {
    for (QueueName queue : QueueName.values()) {
      try {
        poll(queue);
      } catch (RuntimeException ex) {
        logger.warn("job queue poll failed queue={}", queue.value(), ex);
      }
    }
  }

  private void poll(QueueName queue) {
    Semaphore semaphore = slots.get(queue);
    int free = semaphore.availablePermits();
    if (free == 0 || !semaphore.tryAcquire(free)) {
      return;
    }
    int reserved = free;
    try {
      List<JobType> unlimited = unlimitedTypes.get(queue);
      if (!unlimited.isEmpty()) {
        List<QueueJobRecord> claimed = executionService.claim(queue, unlimited, reserved, lockedBy);
        reserved -= submitAll(queue, claimed);
      }
      List<JobType> limited = rateLimitedTypes.get(queue);
      if (!limited.isEmpty() && reserved > 0) {
        int tokens = rateLimiter.tryAcquire(reserved);
        if (tokens > 0) {
          List<QueueJobRecord> claimed = claimLimited(queue, limited, tokens);
          // claim できなかった分の送信枠は他のキューへ回す
          rateLimiter.release(tokens - claimed.size());
          reserved -= submitAll(queue, claimed);
        }
      }
    } finally {
      semaphore.release(reserved);
    }
  }

  private List<QueueJobRecord> claimLimited(QueueName queue, List<JobType> limited, int tokens) {
    try {
      return executionService.claim(queue, limited, tokens, lockedBy);
    } catch (RuntimeException ex) {
      rateLimiter.release(tokens);
      throw ex;
    }
  }

  // 投入できた件数を返す。実行スロットは各タスクの終了時に返却される
  private int submitAll(QueueName queue, List<QueueJobRecord> jobs) {
    int submitted = 0;
    for (QueueJobRecord job : jobs) {
      try {
        jobExecutor.execute(() -> runJob(queue, job));
        submitted++;
      } catch (TaskRejectedException ex) {
        // claim 済みジョブは lease 切れ後に再取得される
        logger.warn(
            "job submission rejected queue={} jobId={} type={}",
            queue.value(),
            job.jobId(),
            job.jobType().value(),
            ex);
      }
    }
    return submitted;
  }

  private void runJob(QueueName queue, QueueJobRecord job) {
    try {
      executionService.execute(job, lockedBy);
    } catch (RuntimeException ex) {
      logger.error(
          "job execution aborted queue={} jobId={} type={}",
          queue.value(),
          job.jobId(),
          job.jobType().value(),
          ex);
    } finally {
      slots.get(queue).release();
    }
  }
}
