package com.example.dispatcher.queue;

public record DispatchCampaignPayload(long campaignShippingId, long campaignId, long contactId)
    implements JobPayload {

  @Override
  public JobType jobType() {
    return JobType.DISPATCH_CAMPAIGN;
  }
}
