/*
 * どこで: ジョブキュー基盤
 * 何を: ジョブ実行中の MDC を設定し、終了時に消去する
 * なぜ: ワーカースレッドが再利用されてもログ相関キーが漏れないようにするため
 */
package com.example.dispatcher.queue;

import com.example.common.TraceIds;
import com.example.dispatcher.model.QueueJobRecord;
import org.slf4j.MDC;

public final class JobMdc implements AutoCloseable {

  static final String JOB_ID = "job_id";
  static final String QUEUE = "queue";
  static final String JOB_TYPE = "job_type";
  static final String TRACE_ID = "trace_id";

  private JobMdc() {}

  public static JobMdc open(QueueJobRecord job) {
    MDC.put(JOB_ID, job.jobId().toString());
    MDC.put(QUEUE, job.queue().value());
    MDC.put(JOB_TYPE, job.jobType().value());
    MDC.put(TRACE_ID, TraceIds.newTraceId());
    return new JobMdc();
  }

  @Override
  public void close() {
    MDC.remove(JOB_ID);
    MDC.remove(QUEUE);
    MDC.remove(JOB_TYPE);
    MDC.remove(TRACE_ID);
  }
}
