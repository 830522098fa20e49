/*
 * どこで: キャンペーンのドメインモデル
 * 何を: campaign_shipping テーブルのスナップショット
 * なぜ: 受信者ごとの送信進捗 (確認依頼/確認/配信) を 1 レコードで追うため
 */
package com.example.dispatcher.model;

import java.time.Instant;
import java.util.UUID;

// contactId は受信者リスト項目 (contact_list_items.id) を指す
public record CampaignShippingRecord(
    long id,
    long campaignId,
    long contactId,
    String number,
    String message,
    String confirmationMessage,
    boolean confirmation,
    Instant confirmedAt,
    Instant confirmationRequestedAt,
    Instant deliveredAt,
    UUID jobId,
    Instant createdAt) {

  public boolean delivered() {
    return deliveredAt != null;
  }

  // 確認依頼済みなら受信者の返信待ちであり、内容を差し替えてはならない
  public boolean isPending() {
    return deliveredAt == null && confirmationRequestedAt == null;
  }
}
