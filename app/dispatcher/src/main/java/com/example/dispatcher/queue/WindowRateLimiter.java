/*
 * どこで: ジョブキュー基盤
 * 何を: スライディングウィンドウで送信開始数を制限する
 * なぜ: メッセージングプロバイダのレート制約を全送信種別で共有して守るため
 */
package com.example.dispatcher.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

public class WindowRateLimiter {

  private final int max;
  private final Duration window;
  private final Clock clock;
  private final Deque<Instant> grants = new ArrayDeque<>();

  public WindowRateLimiter(int max, Duration window, Clock clock) {
    if (max <= 0) {
      throw new IllegalArgumentException("max must be positive: " + max);
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
    this.max = max;
    this.window = window;
    this.clock = clock;
  }

  /** 最大 requested 個の実行枠を取得し、実際に得られた数を返す。 */
  public synchronized int tryAcquire(int requested) {
    if (requested <= 0) {
      return 0;
    }
    Instant now = Instant.now(clock);
    evictExpired(now);
    int granted = Math.min(requested, max - grants.size());
    for (int i = 0; i < granted; i++) {
      grants.addLast(now);
    }
    return granted;
  }

  public boolean tryAcquire() {
    return tryAcquire(1) == 1;
  }

  /** claim できなかった分の枠を返却する (新しいものから)。 */
  public synchronized void release(int count) {
    for (int i = 0; i < count && !grants.isEmpty(); i++) {
      grants.removeLast();
    }
  }

  public synchronized int available() {
    evictExpired(Instant.now(clock));
    return max - grants.size();
  }

  private void evictExpired(Instant now) {
    Instant threshold = now.minus(window);
    while (!grants.isEmpty() && !grants.peekFirst().isAfter(threshold)) {
      grants.removeFirst();
    }
  }
}
