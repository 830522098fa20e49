/*
 * どこで: Dispatcher サービス層
 * 何を: 受信者ごとの送信遅延を位置と会社設定から進める
 * なぜ: 一定件数ごとの休止とランダム間隔で送信を人間的なペースに保つため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.PacingSettings;
import com.example.dispatcher.queue.DelayClock;
import java.util.random.RandomGenerator;

public final class CampaignPacer {

  static final int FALLBACK_GREATER_INTERVAL = 60;
  static final int FALLBACK_RANDOM_INTERVAL = 20;

  private CampaignPacer() {}

  /**
   * position 番目 (1 始まり) の受信者を投入した後の遅延を返す。
   *
   * <p>longerIntervalAfter の倍数位置では greaterInterval 秒の休止を加える。それ以外は固定間隔
   * (0 以外なら優先) か [0, randomMessageInterval) 秒の乱数を加える。0 以下の longerIntervalAfter
   * は休止なし。
   */
  public static long advance(
      long delayMillis, int position, PacingSettings settings, RandomGenerator random) {
    int longerAfter = settings.longerIntervalAfter();
    if (longerAfter > 0 && position % longerAfter == 0) {
      int greater =
          settings.greaterInterval() != 0 ? settings.greaterInterval() : FALLBACK_GREATER_INTERVAL;
      return delayMillis + DelayClock.secondsToMillis(greater);
    }
    if (settings.fixedMessageInterval() > 0) {
      return delayMillis + DelayClock.secondsToMillis(settings.fixedMessageInterval());
    }
    int bound =
        settings.messageInterval() > 0 ? settings.messageInterval() : FALLBACK_RANDOM_INTERVAL;
    return delayMillis + DelayClock.secondsToMillis(random.nextInt(bound));
  }
}
