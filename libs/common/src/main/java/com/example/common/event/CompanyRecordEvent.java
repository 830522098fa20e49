/*
 * どこで: 共通イベント定義
 * 何を: 会社スコープのレコード更新通知ペイロード
 * なぜ: 画面側がキャンペーン状態をリアルタイムに再描画できるようにするため
 */
package com.example.common.event;

import java.util.Map;

public record CompanyRecordEvent(
    String eventId,
    String action,
    String recordType,
    long companyId,
    Map<String, Object> record,
    String occurredAt,
    String traceId) {}
