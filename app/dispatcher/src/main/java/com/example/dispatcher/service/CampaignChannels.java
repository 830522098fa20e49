package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;

final class CampaignChannels {

  private CampaignChannels() {}

  // キャンペーンにチャネル指定が無ければ会社の既定チャネルを使う
  static ChannelSession sessionFor(CampaignRecord campaign, ChannelResolver channelResolver) {
    if (campaign.whatsappId() != null) {
      return channelResolver.session(campaign.whatsappId());
    }
    return channelResolver.defaultSession(campaign.companyId());
  }
}
