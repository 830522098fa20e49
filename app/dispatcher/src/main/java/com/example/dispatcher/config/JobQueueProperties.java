/*
 * どこで: Dispatcher アプリの設定バインド
 * 何を: ジョブキューのポーリング/リース/リトライ/送信レート設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.dispatcher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.queue")
public record JobQueueProperties(
    boolean workerEnabled,
    Duration pollInterval,
    Duration triggerPollInterval,
    Duration lease,
    int concurrency,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    int sendLimiterMax,
    Duration sendLimiterDuration) {}
