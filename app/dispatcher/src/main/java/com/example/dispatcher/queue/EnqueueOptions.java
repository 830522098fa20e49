/*
 * どこで: ジョブキュー基盤
 * 何を: 投入時の遅延/試行回数/完了時削除/重複排除キー/事前採番 ID をまとめる
 * なぜ: 呼び出し側が必要なオプションだけを指定できるようにするため
 */
package com.example.dispatcher.queue;

import java.time.Duration;
import java.util.UUID;

public record EnqueueOptions(
    Duration delay, Integer attempts, boolean removeOnComplete, String dedupKey, UUID jobId) {

  public static EnqueueOptions defaults() {
    return new EnqueueOptions(Duration.ZERO, null, false, null, null);
  }

  public EnqueueOptions withDelay(Duration delay) {
    return new EnqueueOptions(delay, attempts, removeOnComplete, dedupKey, jobId);
  }

  public EnqueueOptions withDelayMillis(long delayMillis) {
    return withDelay(Duration.ofMillis(Math.max(0L, delayMillis)));
  }

  public EnqueueOptions withAttempts(int attempts) {
    return new EnqueueOptions(delay, attempts, removeOnComplete, dedupKey, jobId);
  }

  public EnqueueOptions removingOnComplete() {
    return new EnqueueOptions(delay, attempts, true, dedupKey, jobId);
  }

  public EnqueueOptions withDedupKey(String dedupKey) {
    return new EnqueueOptions(delay, attempts, removeOnComplete, dedupKey, jobId);
  }

  public EnqueueOptions withJobId(UUID jobId) {
    return new EnqueueOptions(delay, attempts, removeOnComplete, dedupKey, jobId);
  }

  public Duration delayOrZero() {
    if (delay == null || delay.isNegative()) {
      return Duration.ZERO;
    }
    return delay;
  }
}
