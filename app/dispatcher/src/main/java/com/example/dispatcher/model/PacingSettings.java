/*
 * どこで: キャンペーンのドメインモデル
 * 何を: 会社ごとの送信間隔設定 (秒)
 * なぜ: ペーシング計算を設定の読み出し元から切り離すため
 */
package com.example.dispatcher.model;

public record PacingSettings(
    int messageInterval,
    int longerIntervalAfter,
    int greaterInterval,
    int fixedMessageInterval) {}
