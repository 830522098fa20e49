/*
 * どこで: Dispatcher サービス層
 * 何を: 受信者の確認返信を記録し、本送信ジョブを投入する
 * なぜ: 確認フロー付きキャンペーンで返信後に 1 度だけ本文を送るため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.queue.DispatchCampaignPayload;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobQueues;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CampaignConfirmationService {

  private static final Logger logger = LoggerFactory.getLogger(CampaignConfirmationService.class);

  private final CampaignRepository campaignRepository;
  private final CampaignShippingRepository shippingRepository;
  private final JobQueues jobQueues;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 確認返信を受け付ける。
   *
   * @param shippingId 確認依頼を送った送信記録
   * @param contactId 返信してきた CRM 連絡先 (チケット用)
   * @return 本送信ジョブを投入したら true。確認済み・未依頼・終端キャンペーンなら false
   */
  public boolean confirm(long shippingId, long contactId) {
    CampaignShippingRecord shipping =
        shippingRepository
            .findById(shippingId)
            .orElseThrow(
                () -> new IllegalArgumentException("campaign shipping not found id=" + shippingId));
    CampaignRecord campaign =
        campaignRepository
            .findById(shipping.campaignId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "campaign not found id=" + shipping.campaignId()));
    if (campaign.status().isTerminal()) {
      logger.info(
          "confirmation ignored for finished campaign campaignId={} shippingId={}",
          campaign.id(),
          shippingId);
      return false;
    }
    TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    Boolean enqueued =
        transactionTemplate.execute(
            status -> {
              UUID jobId = UUID.randomUUID();
              if (shippingRepository.markConfirmed(shippingId, jobId, Instant.now(clock)) == 0) {
                return false;
              }
              jobQueues
                  .get(QueueName.CAMPAIGN_QUEUE)
                  .enqueue(
                      new DispatchCampaignPayload(shippingId, campaign.id(), contactId),
                      EnqueueOptions.defaults().withAttempts(1).withJobId(jobId));
              return true;
            });
    boolean result = Boolean.TRUE.equals(enqueued);
    logger.info(
        "campaign confirmation received campaignId={} shippingId={} dispatched={}",
        campaign.id(),
        shippingId,
        result);
    return result;
  }
}
