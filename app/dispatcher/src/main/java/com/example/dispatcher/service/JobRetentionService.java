/*
 * Where: Dispatcher service layer
 * What: Applies retention policy to queue_jobs and refreshes backlog gauges
 * Why: Prevent unbounded growth of job history while surfacing abandoned jobs
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.JobRetentionProperties;
import com.example.dispatcher.model.QueueJobRecord;
import com.example.dispatcher.model.QueueJobStatus;
import com.example.dispatcher.queue.NonRetryableJobException;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.repository.QueueJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobRetentionService.class);
  static final String ABANDONED_ERROR = "lease expired with no attempts left";

  private final QueueJobRepository jobRepository;
  private final JobRetentionProperties properties;
  private final DispatchMetrics metrics;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final List<QueueJobRecord> abandoned = jobRepository.failAbandoned(now, ABANDONED_ERROR);
    for (QueueJobRecord job : abandoned) {
      metrics.recordJobExhausted(job.jobType());
      errorReporter.report(
          job.queue().value() + " -> " + job.jobType().value(),
          new NonRetryableJobException(ABANDONED_ERROR + " jobId=" + job.jobId()));
    }
    final int deletedCompleted =
        jobRepository.deleteFinishedOlderThan(
            QueueJobStatus.COMPLETED, now.minus(properties.completedRetention()));
    final int deletedFailed =
        jobRepository.deleteFinishedOlderThan(
            QueueJobStatus.FAILED, now.minus(properties.failedRetention()));
    logger.info(
        "job retention cleanup abandoned={} deletedCompleted={} deletedFailed={}",
        abandoned.size(),
        deletedCompleted,
        deletedFailed);
    refreshBacklog();
  }

  public void refreshBacklog() {
    final Map<QueueName, Integer> pending = jobRepository.countPendingByQueue();
    for (QueueName queue : QueueName.values()) {
      metrics.updateBacklog(queue, pending.getOrDefault(queue, 0));
    }
  }
}
