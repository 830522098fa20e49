/*
 * どこで: キャンペーンのドメインモデル
 * 何を: campaigns テーブルのスナップショット
 * なぜ: 展開/送信/完了判定で同じ読み取り結果を扱うため
 */
package com.example.dispatcher.model;

import java.time.Instant;
import java.util.List;

public record CampaignRecord(
    long id,
    long companyId,
    String name,
    Long contactListId,
    Long whatsappId,
    List<String> messages,
    boolean confirmation,
    List<String> confirmationMessages,
    String mediaPath,
    String mediaName,
    Long queueId,
    Long userId,
    CampaignStatus status,
    Instant scheduledAt,
    Instant completedAt,
    Integer recipientCount) {

  public CampaignRecord {
    messages = messages == null ? List.of() : List.copyOf(messages);
    confirmationMessages =
        confirmationMessages == null ? List.of() : List.copyOf(confirmationMessages);
  }

  public boolean hasMedia() {
    return mediaPath != null && !mediaPath.isBlank();
  }
}
