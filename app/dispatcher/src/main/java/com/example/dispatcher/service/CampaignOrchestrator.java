/*
 * どこで: Dispatcher サービス層 (CampaignQueue/ProcessCampaign)
 * 何を: キャンペーンの受信者を固定順に展開し、受信者ごとの準備ジョブを遅延付きで投入する
 * なぜ: 送信ペースを遅延値だけで制御し、実行順序に依存しないようにするため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignStatus;
import com.example.dispatcher.model.ContactListItemRecord;
import com.example.dispatcher.model.PacingSettings;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.queue.JobQueue;
import com.example.dispatcher.queue.JobQueues;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.PrepareContactPayload;
import com.example.dispatcher.queue.ProcessCampaignPayload;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.ContactListItemRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CampaignOrchestrator implements JobHandler<ProcessCampaignPayload> {

  private static final Logger logger = LoggerFactory.getLogger(CampaignOrchestrator.class);
  static final String ERROR_CONTEXT = "CampaignQueue -> ProcessCampaign";

  private final CampaignRepository campaignRepository;
  private final ContactListItemRepository contactListItemRepository;
  private final PacingSettingsResolver pacingSettingsResolver;
  private final CampaignCompletionEvaluator completionEvaluator;
  private final JobQueues jobQueues;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  @Override
  public JobType jobType() {
    return JobType.PROCESS_CAMPAIGN;
  }

  @Override
  public Class<ProcessCampaignPayload> payloadType() {
    return ProcessCampaignPayload.class;
  }

  @Override
  public void handle(ProcessCampaignPayload payload, JobContext context) {
    CampaignRecord campaign =
        campaignRepository
            .findById(payload.campaignId())
            .orElseThrow(() -> new JobNotFoundException("campaign", payload.campaignId()));
    if (campaign.status() != CampaignStatus.PROGRAMADA) {
      logger.info(
          "campaign processing skipped campaignId={} status={}", campaign.id(), campaign.status());
      return;
    }
    try {
      fanOut(campaign, payload.delay(), ThreadLocalRandom.current());
    } catch (RuntimeException ex) {
      // 投入済みの準備ジョブはそのまま走る (終端状態を見て何もしない)
      completionEvaluator.fail(campaign.id());
      errorReporter.report(ERROR_CONTEXT, ex);
    }
  }

  void fanOut(CampaignRecord campaign, long initialDelay, RandomGenerator random) {
    if (campaign.contactListId() == null) {
      throw new IllegalStateException("invalid contact list campaignId=" + campaign.id());
    }
    List<ContactListItemRecord> recipients =
        contactListItemRepository.findValidByContactListId(campaign.contactListId());
    PacingSettings settings = pacingSettingsResolver.resolve(campaign.companyId());
    Instant now = Instant.now(clock);
    // 受信者数は展開時点のスナップショットで固定する
    campaignRepository.updateRecipientCount(campaign.id(), recipients.size(), now);

    JobQueue campaignQueue = jobQueues.get(QueueName.CAMPAIGN_QUEUE);
    long delay = Math.max(0L, initialDelay);
    int position = 0;
    for (ContactListItemRecord recipient : recipients) {
      campaignQueue.enqueueIfAbsent(
          new PrepareContactPayload(recipient.id(), campaign.id(), delay),
          EnqueueOptions.defaults()
              .removingOnComplete()
              .withDedupKey("prepare-contact:" + campaign.id() + ":" + recipient.id()));
      logger.info(
          "recipient queued for preparation campaignId={} contact={} delay={}",
          campaign.id(),
          recipient.name(),
          delay);
      position++;
      delay = CampaignPacer.advance(delay, position, settings, random);
    }
    campaignRepository.markInProgress(campaign.id(), now);
    // 受信者 0 件ならここで終了する
    completionEvaluator.evaluate(campaign.id());
  }
}
