package com.example.dispatcher.queue;

public record VerifyCampaignsPayload() implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.VERIFY_CAMPAIGNS;
  }
}
