package com.example.dispatcher.queue;

/** delay はこの受信者の送信を遅らせるミリ秒 (ペーシング済み)。 */
public record PrepareContactPayload(long contactListItemId, long campaignId, long delay)
    implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.PREPARE_CONTACT;
  }
}
