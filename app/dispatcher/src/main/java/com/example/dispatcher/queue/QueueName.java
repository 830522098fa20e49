/*
 * どこで: ジョブキュー基盤
 * 何を: 論理キュー名の閉じた集合
 * なぜ: queue_jobs.queue_name の値と Java 側の型を一対一に保つため
 */
package com.example.dispatcher.queue;

public enum QueueName {
  MESSAGE_QUEUE("MessageQueue"),
  SCHEDULE_MONITOR("ScheduleMonitor"),
  SEND_SCHEDULED_MESSAGES("SendScheduledMessages"),
  CAMPAIGN_QUEUE("CampaignQueue"),
  USER_MONITOR("UserMonitor");

  private final String value;

  QueueName(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static QueueName fromValue(String value) {
    for (QueueName queue : values()) {
      if (queue.value.equals(value)) {
        return queue;
      }
    }
    throw new IllegalArgumentException("unknown queue: " + value);
  }
}
