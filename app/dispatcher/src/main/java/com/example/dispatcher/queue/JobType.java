/*
 * どこで: ジョブキュー基盤
 * 何を: ジョブ種別ごとの所属キュー/ペイロード型/レート制限有無を定義する
 * なぜ: 文字列ディスパッチをやめ、未知の種別を起動時に検出するため
 */
package com.example.dispatcher.queue;

public enum JobType {
  SEND_MESSAGE(QueueName.MESSAGE_QUEUE, "SendMessage", SendMessagePayload.class, true),
  VERIFY_SCHEDULES(QueueName.SCHEDULE_MONITOR, "Verify", VerifySchedulesPayload.class, false),
  SEND_SCHEDULED_MESSAGE(
      QueueName.SEND_SCHEDULED_MESSAGES, "SendMessage", SendScheduledMessagePayload.class, true),
  VERIFY_CAMPAIGNS(
      QueueName.CAMPAIGN_QUEUE, "VerifyCampaignsDatabase", VerifyCampaignsPayload.class, false),
  PROCESS_CAMPAIGN(
      QueueName.CAMPAIGN_QUEUE, "ProcessCampaign", ProcessCampaignPayload.class, false),
  PREPARE_CONTACT(QueueName.CAMPAIGN_QUEUE, "PrepareContact", PrepareContactPayload.class, false),
  DISPATCH_CAMPAIGN(
      QueueName.CAMPAIGN_QUEUE, "DispatchCampaign", DispatchCampaignPayload.class, true),
  VERIFY_LOGIN_STATUS(
      QueueName.USER_MONITOR, "VerifyLoginStatus", VerifyLoginStatusPayload.class, false);

  private final QueueName queue;
  private final String value;
  private final Class<? extends JobPayload> payloadClass;
  private final boolean rateLimited;

  JobType(
      QueueName queue,
      String value,
      Class<? extends JobPayload> payloadClass,
      boolean rateLimited) {
    this.queue = queue;
    this.value = value;
    this.payloadClass = payloadClass;
    this.rateLimited = rateLimited;
  }

  public QueueName queue() {
    return queue;
  }

  public String value() {
    return value;
  }

  public Class<? extends JobPayload> payloadClass() {
    return payloadClass;
  }

  public boolean rateLimited() {
    return rateLimited;
  }

  // 種別名はキュー内でのみ一意 (SendMessage は 2 キューに存在する)
  public static JobType of(QueueName queue, String value) {
    for (JobType type : values()) {
      if (type.queue == queue && type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        "unknown job type queue=" + queue.value() + " type=" + value);
  }
}
