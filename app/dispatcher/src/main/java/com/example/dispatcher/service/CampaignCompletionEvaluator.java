/*
 * どこで: Dispatcher サービス層
 * 何を: 配信済み件数と受信者数を比べてキャンペーンを終了させ、状態変更を通知する
 * なぜ: 配信順序に関係なく最後の 1 件で FINALIZADA に遷移させるため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignStatus;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CampaignCompletionEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(CampaignCompletionEvaluator.class);

  private final CampaignRepository campaignRepository;
  private final CampaignShippingRepository shippingRepository;
  private final CompanyEventPublisher eventPublisher;
  private final DispatchMetrics metrics;
  private final Clock clock;

  /** 完了していれば FINALIZADA にする。結果にかかわらず最新状態を通知する。 */
  public void evaluate(long campaignId) {
    CampaignRecord campaign =
        campaignRepository
            .findById(campaignId)
            .orElseThrow(() -> new JobNotFoundException("campaign", campaignId));
    Integer expected = campaign.recipientCount();
    if (!campaign.status().isTerminal() && expected != null) {
      int delivered = shippingRepository.countDelivered(campaignId);
      if (delivered == expected
          && campaignRepository.markFinished(campaignId, Instant.now(clock)) > 0) {
        metrics.recordCampaignFinalized(CampaignStatus.FINALIZADA.name());
        logger.info("campaign finished campaignId={} delivered={}", campaignId, delivered);
      }
    }
    publishLatest(campaignId);
  }

  /** 終端でなければ FINALIZADA_COM_ERROS にする。 */
  public void fail(long campaignId) {
    if (campaignRepository.markFailed(campaignId, Instant.now(clock)) > 0) {
      metrics.recordCampaignFinalized(CampaignStatus.FINALIZADA_COM_ERROS.name());
      logger.warn("campaign finished with errors campaignId={}", campaignId);
    }
    publishLatest(campaignId);
  }

  private void publishLatest(long campaignId) {
    campaignRepository.findById(campaignId).ifPresent(eventPublisher::publishCampaignUpdate);
  }
}
