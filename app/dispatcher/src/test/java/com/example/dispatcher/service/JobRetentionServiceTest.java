/*
 * Where: Dispatcher job retention unit test
 * What: Verifies abandoned job reporting, history deletion windows and backlog refresh
 * Why: Keep queue history bounded without touching live jobs
 */
package com.example.dispatcher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatcher.config.JobRetentionProperties;
import com.example.dispatcher.model.QueueJobRecord;
import com.example.dispatcher.model.QueueJobStatus;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.NonRetryableJobException;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.repository.QueueJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private QueueJobRepository jobRepository;
  @Mock private DispatchMetrics metrics;
  @Mock private ErrorReporter errorReporter;

  @Test
  void cleanupReportsAbandonedJobsAndDeletesOldHistory() {
    final JobRetentionService service =
        new JobRetentionService(
            jobRepository,
            new JobRetentionProperties(
                true, Duration.ofHours(1), Duration.ofDays(7), Duration.ofMinutes(1)),
            metrics,
            errorReporter,
            Clock.fixed(NOW, ZoneOffset.UTC));
    final QueueJobRecord abandoned =
        new QueueJobRecord(
            UUID.randomUUID(),
            QueueName.CAMPAIGN_QUEUE,
            JobType.DISPATCH_CAMPAIGN,
            "{}",
            QueueJobStatus.FAILED,
            NOW.minusSeconds(600),
            3,
            3,
            false,
            null,
            "worker-1:100",
            NOW.minusSeconds(600),
            NOW.minusSeconds(300),
            JobRetentionService.ABANDONED_ERROR,
            NOW.minusSeconds(900),
            NOW);
    when(jobRepository.failAbandoned(NOW, JobRetentionService.ABANDONED_ERROR))
        .thenReturn(List.of(abandoned));
    when(jobRepository.countPendingByQueue()).thenReturn(Map.of(QueueName.CAMPAIGN_QUEUE, 4));

    service.cleanup();

    verify(metrics).recordJobExhausted(JobType.DISPATCH_CAMPAIGN);
    final ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
    verify(errorReporter).report(eq("CampaignQueue -> DispatchCampaign"), error.capture());
    assertThat(error.getValue()).isInstanceOf(NonRetryableJobException.class);
    verify(jobRepository)
        .deleteFinishedOlderThan(QueueJobStatus.COMPLETED, NOW.minus(Duration.ofHours(1)));
    verify(jobRepository)
        .deleteFinishedOlderThan(QueueJobStatus.FAILED, NOW.minus(Duration.ofDays(7)));
    verify(metrics).updateBacklog(QueueName.CAMPAIGN_QUEUE, 4);
    // 未投入のキューは 0 に戻す
    verify(metrics).updateBacklog(QueueName.MESSAGE_QUEUE, 0);
    verify(metrics, never()).recordError(any());
  }
}
