/*
 * どこで: 予約メッセージのドメインモデル
 * 何を: schedules と宛先 contacts を結合したスナップショット
 * なぜ: 検証時点の本文と宛先をそのままジョブへ載せるため
 */
package com.example.dispatcher.model;

import java.time.Instant;

public record ScheduleRecord(
    long id,
    long companyId,
    long contactId,
    String contactName,
    String contactNumber,
    String body,
    Instant sendAt,
    Instant sentAt,
    ScheduleStatus status) {}
