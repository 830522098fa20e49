/*
 * どこで: Dispatcher サービス層 (CampaignQueue/PrepareContact)
 * 何を: 受信者の宛先を検証して送信内容を作り、送信記録を find-or-create して送信ジョブを 1 件だけ予約する
 * なぜ: 準備ジョブが再実行されても送信記録と送信ジョブを二重に作らないため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.model.ContactListItemRecord;
import com.example.dispatcher.model.ResolvedContact;
import com.example.dispatcher.model.ShippingDraft;
import com.example.dispatcher.queue.DispatchCampaignPayload;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.queue.JobQueues;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.NonRetryableJobException;
import com.example.dispatcher.queue.PrepareContactPayload;
import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import com.example.dispatcher.repository.ContactListItemRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ContactPreparer implements JobHandler<PrepareContactPayload> {

  private static final Logger logger = LoggerFactory.getLogger(ContactPreparer.class);
  static final String ERROR_CONTEXT = "CampaignQueue -> PrepareContact";

  private final CampaignRepository campaignRepository;
  private final ContactListItemRepository contactListItemRepository;
  private final CampaignShippingRepository shippingRepository;
  private final ChannelResolver channelResolver;
  private final CampaignMessageRenderer renderer;
  private final CampaignCompletionEvaluator completionEvaluator;
  private final JobQueues jobQueues;
  private final ErrorReporter errorReporter;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  @Override
  public JobType jobType() {
    return JobType.PREPARE_CONTACT;
  }

  @Override
  public Class<PrepareContactPayload> payloadType() {
    return PrepareContactPayload.class;
  }

  @Override
  public void handle(PrepareContactPayload payload, JobContext context) {
    CampaignRecord campaign =
        campaignRepository
            .findById(payload.campaignId())
            .orElseThrow(() -> new JobNotFoundException("campaign", payload.campaignId()));
    if (campaign.status().isTerminal()) {
      logger.info(
          "contact preparation skipped campaignId={} status={} contactListItemId={}",
          campaign.id(),
          campaign.status(),
          payload.contactListItemId());
      return;
    }
    try {
      ContactListItemRecord item =
          contactListItemRepository
              .findById(payload.contactListItemId())
              .orElseThrow(
                  () -> new JobNotFoundException("contact list item", payload.contactListItemId()));
      ChannelSession session = CampaignChannels.sessionFor(campaign, channelResolver);
      ResolvedContact contact =
          session.resolveContact(campaign.companyId(), item.name(), item.number(), item.email());
      ShippingDraft draft = buildDraft(campaign, item, contact, ThreadLocalRandom.current());

      TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
      Optional<UUID> jobId =
          transactionTemplate.execute(
              status -> reserveDispatch(draft, contact, payload.delay()));
      if (jobId != null && jobId.isPresent()) {
        logger.info(
            "campaign dispatch reserved campaignId={} contactListItemId={} jobId={} delay={}",
            campaign.id(),
            item.id(),
            jobId.get(),
            payload.delay());
      } else {
        logger.info(
            "campaign dispatch already reserved or sent campaignId={} contactListItemId={}",
            campaign.id(),
            item.id());
      }
      completionEvaluator.evaluate(campaign.id());
    } catch (RuntimeException ex) {
      // 1 件の不正な受信者でキャンペーン全体を失敗扱いにする
      errorReporter.report(ERROR_CONTEXT, ex);
      completionEvaluator.fail(campaign.id());
      throw new NonRetryableJobException(
          "invalid contact campaignId="
              + campaign.id()
              + " contactListItemId="
              + payload.contactListItemId(),
          ex);
    }
  }

  ShippingDraft buildDraft(
      CampaignRecord campaign,
      ContactListItemRecord item,
      ResolvedContact contact,
      RandomGenerator random) {
    String message =
        renderer.render(campaign.messages(), contact.name(), item.email(), contact.number(), random);
    String confirmationMessage =
        campaign.confirmation()
            ? renderer.render(
                campaign.confirmationMessages(),
                contact.name(),
                item.email(),
                contact.number(),
                random)
            : null;
    return new ShippingDraft(
        campaign.id(), item.id(), contact.number(), message, confirmationMessage);
  }

  private Optional<UUID> reserveDispatch(ShippingDraft draft, ResolvedContact contact, long delay) {
    Instant now = Instant.now(clock);
    boolean created = shippingRepository.insertIfAbsent(draft, now);
    CampaignShippingRecord record =
        shippingRepository
            .findForUpdate(draft.campaignId(), draft.contactId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "shipping missing after upsert campaignId="
                            + draft.campaignId()
                            + " contactId="
                            + draft.contactId()));
    if (!record.isPending()) {
      return Optional.empty();
    }
    if (!created) {
      shippingRepository.refreshContent(record.id(), draft, now);
    }
    // job_id の条件付き更新に勝った 1 件だけが送信ジョブを投入する
    UUID jobId = UUID.randomUUID();
    if (record.jobId() != null || shippingRepository.assignJob(record.id(), jobId, now) == 0) {
      return Optional.empty();
    }
    // lease 切れで再取得されると送信が二重に走るため 1 回きりにする
    jobQueues
        .get(QueueName.CAMPAIGN_QUEUE)
        .enqueue(
            new DispatchCampaignPayload(record.id(), draft.campaignId(), contact.contactId()),
            EnqueueOptions.defaults().withDelayMillis(delay).withAttempts(1).withJobId(jobId));
    return Optional.of(jobId);
  }
}
