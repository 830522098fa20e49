package com.example.dispatcher.queue;

import java.util.UUID;

/** ハンドラに渡す実行中ジョブのメタ情報。attempt は 1 始まり。 */
public record JobContext(
    UUID jobId, QueueName queue, JobType jobType, int attempt, int maxAttempts) {

  public boolean lastAttempt() {
    return attempt >= maxAttempts;
  }
}
