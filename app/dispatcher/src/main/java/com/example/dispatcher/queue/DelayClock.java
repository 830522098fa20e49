/*
 * どこで: ジョブキュー基盤
 * 何を: 遅延値の単位変換
 * なぜ: 設定 (秒) とペイロード (ミリ秒) の単位混在をここに閉じ込めるため
 */
package com.example.dispatcher.queue;

import java.time.Duration;

public final class DelayClock {

  private DelayClock() {}

  public static long secondsToMillis(long seconds) {
    return seconds * 1000L;
  }

  public static long toMillis(Duration duration) {
    return duration == null ? 0L : duration.toMillis();
  }
}
