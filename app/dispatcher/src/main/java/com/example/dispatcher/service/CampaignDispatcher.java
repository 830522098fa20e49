/*
 * どこで: Dispatcher サービス層 (CampaignQueue/DispatchCampaign)
 * 何を: 送信記録 1 件分の確認依頼または本送信 (メディア付き) を行い、結果を記録する
 * なぜ: 確認依頼と配信完了を別々の時刻で記録し、完了判定を最新化するため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.CampaignProperties;
import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.queue.DispatchCampaignPayload;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.NonRetryableJobException;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CampaignDispatcher implements JobHandler<DispatchCampaignPayload> {

  private static final Logger logger = LoggerFactory.getLogger(CampaignDispatcher.class);
  static final String ERROR_CONTEXT = "CampaignQueue -> DispatchCampaign";

  private final CampaignRepository campaignRepository;
  private final CampaignShippingRepository shippingRepository;
  private final ChannelResolver channelResolver;
  private final TicketService ticketService;
  private final CampaignCompletionEvaluator completionEvaluator;
  private final CampaignProperties properties;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  @Override
  public JobType jobType() {
    return JobType.DISPATCH_CAMPAIGN;
  }

  @Override
  public Class<DispatchCampaignPayload> payloadType() {
    return DispatchCampaignPayload.class;
  }

  @Override
  public void handle(DispatchCampaignPayload payload, JobContext context) {
    CampaignRecord campaign =
        campaignRepository
            .findById(payload.campaignId())
            .orElseThrow(() -> new JobNotFoundException("campaign", payload.campaignId()));
    if (campaign.status().isTerminal()) {
      // 終端キャンペーンには新たな送信を始めない
      logger.info(
          "campaign dispatch skipped campaignId={} status={} shippingId={}",
          campaign.id(),
          campaign.status(),
          payload.campaignShippingId());
      return;
    }
    logger.info(
        "campaign dispatch requested campaignId={} shippingId={}",
        campaign.id(),
        payload.campaignShippingId());

    TicketRequest ticket =
        new TicketRequest(
            campaign.companyId(),
            payload.contactId(),
            campaign.whatsappId(),
            campaign.queueId(),
            campaign.userId(),
            TicketRequest.STATUS_CAMPAIGN);
    try {
      TicketResult result = ticketService.findOrCreate(ticket);
      if (!result.created()) {
        ticketService.update(result.ticketId(), ticket);
      }
    } catch (RuntimeException ex) {
      completionEvaluator.fail(campaign.id());
      errorReporter.report(ERROR_CONTEXT, ex);
      throw new NonRetryableJobException(
          "campaign ticket failed campaignId=" + campaign.id(), ex);
    }

    try {
      send(campaign, payload.campaignShippingId());
    } catch (RuntimeException ex) {
      completionEvaluator.fail(campaign.id());
      closeTicket(ticket, ex);
      errorReporter.report(ERROR_CONTEXT, ex);
      throw new NonRetryableJobException(
          "campaign dispatch failed campaignId="
              + campaign.id()
              + " shippingId="
              + payload.campaignShippingId(),
          ex);
    }
  }

  private void send(CampaignRecord campaign, long shippingId) {
    CampaignShippingRecord shipping =
        shippingRepository
            .findById(shippingId)
            .orElseThrow(() -> new JobNotFoundException("campaign shipping", shippingId));
    if (shipping.delivered()) {
      logger.info("campaign shipping already delivered shippingId={}", shippingId);
      return;
    }
    ChannelSession session = CampaignChannels.sessionFor(campaign, channelResolver);
    String chatId = ChatIds.forNumber(shipping.number());
    boolean confirmationStep =
        campaign.confirmation() && shipping.confirmationRequestedAt() == null;

    if (!confirmationStep && campaign.hasMedia()) {
      Path file = resolveMedia(campaign.mediaPath());
      session.sendMedia(
          chatId,
          file,
          campaign.mediaName(),
          CampaignMessageRenderer.AUTOMATED_MARKER + campaign.mediaName());
    }
    String text = confirmationStep ? shipping.confirmationMessage() : shipping.message();
    if (text == null || text.isBlank()) {
      throw new IllegalStateException(
          "campaign shipping has no message shippingId="
              + shippingId
              + " confirmationStep="
              + confirmationStep);
    }
    session.sendText(chatId, text);

    // 送信中に別ジョブがキャンペーンを終端にした場合は記録しない (UPDATE 側でも同じ条件を見る)
    if (finishedMeanwhile(campaign.id())) {
      logger.warn(
          "campaign finished during send, shipping left unrecorded campaignId={} shippingId={}",
          campaign.id(),
          shippingId);
      return;
    }
    Instant now = Instant.now(clock);
    int recorded =
        confirmationStep
            ? shippingRepository.markConfirmationRequested(shippingId, now)
            : shippingRepository.markDelivered(shippingId, now);
    if (recorded == 0) {
      logger.warn(
          "campaign shipping not recorded campaignId={} shippingId={} confirmationStep={}",
          campaign.id(),
          shippingId,
          confirmationStep);
    }
    completionEvaluator.evaluate(campaign.id());
    logger.info(
        "campaign message sent campaignId={} shippingId={} confirmationStep={}",
        campaign.id(),
        shippingId,
        confirmationStep);
  }

  private boolean finishedMeanwhile(long campaignId) {
    return campaignRepository
        .findById(campaignId)
        .map(latest -> latest.status().isTerminal())
        .orElse(true);
  }

  Path resolveMedia(String mediaPath) {
    Path root = Path.of(properties.mediaRoot()).toAbsolutePath().normalize();
    Path file = root.resolve(mediaPath).normalize();
    if (!file.startsWith(root)) {
      throw new IllegalArgumentException("media path escapes media root: " + mediaPath);
    }
    return file;
  }

  private void closeTicket(TicketRequest ticket, RuntimeException cause) {
    try {
      TicketResult result = ticketService.findOrCreate(ticket);
      ticketService.update(result.ticketId(), ticket.closing());
    } catch (RuntimeException ex) {
      cause.addSuppressed(ex);
      logger.warn("failed to close campaign ticket contactId={}", ticket.contactId(), ex);
    }
  }
}
