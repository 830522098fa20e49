/*
 * どこで: Dispatcher アプリの設定バインド
 * 何を: 予約メッセージ検証の周期/先読み幅/送信遅延を保持する
 * なぜ: 検証と実送信の間の時計ずれ吸収量を環境ごとに調整するため
 */
package com.example.dispatcher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.schedule")
public record ScheduleProperties(String verifyCron, Duration lookahead, Duration sendDelay) {}
