/*
 * どこで: Dispatcher サービス層 (CampaignQueue/VerifyCampaignsDatabase)
 * 何を: 1 時間以内に開始予定の PROGRAMADA キャンペーンを展開ジョブへ送り、確認返信済みの送信記録の本送信を予約する
 * なぜ: 開始時刻までの残り時間を初期遅延として後段へ引き継ぐため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.CampaignProperties;
import com.example.dispatcher.model.ConfirmedShipping;
import com.example.dispatcher.model.DueCampaign;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobQueue;
import com.example.dispatcher.queue.JobQueues;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.ProcessCampaignPayload;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.queue.VerifyCampaignsPayload;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CampaignVerifier implements JobHandler<VerifyCampaignsPayload> {

  private static final Logger logger = LoggerFactory.getLogger(CampaignVerifier.class);
  static final String ERROR_CONTEXT = "CampaignQueue -> VerifyCampaignsDatabase";
  static final int CONFIRMATION_BATCH_SIZE = 100;

  private final CampaignRepository campaignRepository;
  private final CampaignShippingRepository shippingRepository;
  private final CampaignConfirmationService confirmationService;
  private final JobQueues jobQueues;
  private final CampaignProperties properties;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  @Override
  public JobType jobType() {
    return JobType.VERIFY_CAMPAIGNS;
  }

  @Override
  public Class<VerifyCampaignsPayload> payloadType() {
    return VerifyCampaignsPayload.class;
  }

  @Override
  public void handle(VerifyCampaignsPayload payload, JobContext context) {
    Instant now = Instant.now(clock);
    List<DueCampaign> due =
        campaignRepository.findDueScheduled(now, now.plus(properties.lookahead()));
    logger.info("due campaigns found count={}", due.size());
    JobQueue campaignQueue = jobQueues.get(QueueName.CAMPAIGN_QUEUE);
    for (DueCampaign campaign : due) {
      try {
        long delay = initialDelay(campaign.scheduledAt(), now);
        // 次の tick で同じキャンペーンを拾っても未完了ジョブがあれば積まない
        campaignQueue
            .enqueueIfAbsent(
                new ProcessCampaignPayload(campaign.id(), delay),
                EnqueueOptions.defaults()
                    .removingOnComplete()
                    .withDedupKey(processDedupKey(campaign.id())))
            .ifPresent(
                jobId ->
                    logger.info(
                        "campaign queued for processing campaignId={} initialDelay={} jobId={}",
                        campaign.id(),
                        delay,
                        jobId));
      } catch (RuntimeException ex) {
        errorReporter.report(ERROR_CONTEXT, ex);
      }
    }
    dispatchConfirmed();
  }

  // 確認返信は CRM が campaign_shipping.confirmation に書き込む
  void dispatchConfirmed() {
    List<ConfirmedShipping> confirmed =
        shippingRepository.findConfirmedAwaitingDispatch(CONFIRMATION_BATCH_SIZE);
    for (ConfirmedShipping shipping : confirmed) {
      try {
        confirmationService.confirm(shipping.shippingId(), shipping.contactId());
      } catch (RuntimeException ex) {
        errorReporter.report(ERROR_CONTEXT, ex);
      }
    }
  }

  static long initialDelay(Instant scheduledAt, Instant now) {
    return Math.max(0L, Duration.between(now, scheduledAt).toMillis());
  }

  static String processDedupKey(long campaignId) {
    return "process-campaign:" + campaignId;
  }
}
