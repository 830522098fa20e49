/*
 * どこで: Dispatcher サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカルテストで NATS なしでもアプリを起動可能にするため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopCompanyEventPublisher implements CompanyEventPublisher {

  @Override
  public void publishCampaignUpdate(CampaignRecord campaign) {
    // no-op
  }
}
