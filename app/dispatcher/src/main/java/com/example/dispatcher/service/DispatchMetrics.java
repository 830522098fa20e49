/*
 * どこで: Dispatcher サービス層
 * 何を: ジョブ結果/リトライ枯渇/キャンペーン終了/エラー報告/キュー滞留のメトリクスを記録する
 * なぜ: 送信パイプラインの詰まりと失敗を Prometheus から直接観測できるようにするため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.QueueName;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DispatchMetrics {

  static final String METRIC_JOB_TOTAL = "dispatch.job.total";
  static final String METRIC_JOB_EXHAUSTED_TOTAL = "dispatch.job.exhausted.total";
  static final String METRIC_CAMPAIGN_FINALIZED_TOTAL = "dispatch.campaign.finalized.total";
  static final String METRIC_ERROR_TOTAL = "dispatch.error.total";
  static final String METRIC_QUEUE_BACKLOG = "dispatch.queue.backlog";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<QueueName, AtomicInteger> backlog = new EnumMap<>(QueueName.class);

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    for (QueueName queue : QueueName.values()) {
      AtomicInteger value = new AtomicInteger(0);
      backlog.put(queue, value);
      Gauge.builder(METRIC_QUEUE_BACKLOG, value, AtomicInteger::get)
          .description("Pending jobs per queue")
          .tags(Tags.of("queue", queue.value()))
          .register(meterRegistry);
    }
  }

  public void recordJobResult(JobType jobType, String result) {
    counter(
            METRIC_JOB_TOTAL,
            "Job execution outcomes",
            Tags.of("queue", jobType.queue().value(), "job_type", jobType.value(), "result", result))
        .increment();
  }

  public void recordJobExhausted(JobType jobType) {
    counter(
            METRIC_JOB_EXHAUSTED_TOTAL,
            "Jobs that failed terminally",
            Tags.of("queue", jobType.queue().value(), "job_type", jobType.value()))
        .increment();
  }

  public void recordCampaignFinalized(String status) {
    counter(
            METRIC_CAMPAIGN_FINALIZED_TOTAL,
            "Campaigns reaching a terminal status",
            Tags.of("status", status))
        .increment();
  }

  public void recordError(String context) {
    counter(METRIC_ERROR_TOTAL, "Errors reported to the error sink", Tags.of("context", context))
        .increment();
  }

  public void updateBacklog(QueueName queue, int pending) {
    backlog.get(queue).set(Math.max(pending, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
