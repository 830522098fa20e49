/*
 * どこで: Dispatcher アプリの設定バインド
 * 何を: キャンペーン検証の周期/先読み幅/メディア配置/送信間隔の既定値を保持する
 * なぜ: 会社設定が無い場合の送信ペースを外部化するため
 */
package com.example.dispatcher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.campaign")
public record CampaignProperties(
    String verifyCron,
    Duration lookahead,
    String mediaRoot,
    int randomMessageInterval,
    int longerIntervalAfter,
    int greaterInterval,
    int fixedMessageInterval) {}
