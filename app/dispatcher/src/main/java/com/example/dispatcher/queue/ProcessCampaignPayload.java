package com.example.dispatcher.queue;

/** delay はキャンペーン予定時刻までのミリ秒。 */
public record ProcessCampaignPayload(long campaignId, long delay) implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.PROCESS_CAMPAIGN;
  }
}
