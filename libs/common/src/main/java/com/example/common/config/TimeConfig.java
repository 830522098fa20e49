/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: ジョブの遅延計算と検証ウィンドウを同一の時刻源で扱うため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    // DB には UTC で保存するためアプリ側も UTC に固定する
    return Clock.systemUTC();
  }
}
