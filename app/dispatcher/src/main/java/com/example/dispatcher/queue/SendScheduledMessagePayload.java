package com.example.dispatcher.queue;

/** 予約メッセージ 1 件の送信。本文と宛先は検証時点のスナップショット。 */
public record SendScheduledMessagePayload(
    long scheduleId, long companyId, String contactName, String contactNumber, String body)
    implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.SEND_SCHEDULED_MESSAGE;
  }
}
