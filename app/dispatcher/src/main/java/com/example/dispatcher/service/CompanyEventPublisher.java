package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;

/** 会社スコープの画面向け状態変更通知。送信失敗で呼び出し側を止めてはならない。 */
public interface CompanyEventPublisher {

  void publishCampaignUpdate(CampaignRecord campaign);
}
