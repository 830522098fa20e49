/*
 * どこで: 受信者準備のユニットテスト
 * 何を: 送信記録の find-or-create と送信ジョブ予約が再実行で重複しないことを検証する
 * なぜ: 準備ジョブのリトライで同じ受信者に二重送信しないことを保証するため
 */
package com.example.dispatcher.service;

import static com.example.dispatcher.service.CampaignFixtures.CAMPAIGN_ID;
import static com.example.dispatcher.service.CampaignFixtures.COMPANY_ID;
import static com.example.dispatcher.service.CampaignFixtures.WHATSAPP_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.dispatcher.NoOpTransactionManager;
import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.model.CampaignStatus;
import com.example.dispatcher.model.ContactListItemRecord;
import com.example.dispatcher.model.ResolvedContact;
import com.example.dispatcher.model.ShippingDraft;
import com.example.dispatcher.queue.DispatchCampaignPayload;
import com.example.dispatcher.queue.EnqueueOptions;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobQueue;
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
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContactPreparerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final long ITEM_ID = 101L;
  private static final long SHIPPING_ID = 900L;
  private static final PrepareContactPayload PAYLOAD =
      new PrepareContactPayload(ITEM_ID, CAMPAIGN_ID, 45_000L);
  private static final ContactListItemRecord ITEM =
      CampaignFixtures.item(ITEM_ID, "Ana", "5511999990000");
  private static final ResolvedContact CONTACT =
      new ResolvedContact(55L, "Ana", "5511999990000", "5511999990000@s.whatsapp.net");

  @Mock private CampaignRepository campaignRepository;
  @Mock private ContactListItemRepository contactListItemRepository;
  @Mock private CampaignShippingRepository shippingRepository;
  @Mock private ChannelResolver channelResolver;
  @Mock private ChannelSession session;
  @Mock private CampaignCompletionEvaluator completionEvaluator;
  @Mock private JobQueues jobQueues;
  @Mock private JobQueue campaignQueue;
  @Mock private ErrorReporter errorReporter;

  private ContactPreparer preparer;

  @BeforeEach
  void setUp() {
    preparer =
        new ContactPreparer(
            campaignRepository,
            contactListItemRepository,
            shippingRepository,
            channelResolver,
            new CampaignMessageRenderer(),
            completionEvaluator,
            jobQueues,
            errorReporter,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void runningTwiceReservesExactlyOneDispatch() {
    stubCampaignAndContact(CampaignStatus.EM_ANDAMENTO);
    when(jobQueues.get(QueueName.CAMPAIGN_QUEUE)).thenReturn(campaignQueue);
    final UUID[] assigned = new UUID[1];
    when(shippingRepository.insertIfAbsent(any(), eq(NOW))).thenReturn(true, false);
    when(shippingRepository.assignJob(eq(SHIPPING_ID), any(), eq(NOW)))
        .thenAnswer(
            invocation -> {
              assigned[0] = invocation.getArgument(1);
              return 1;
            });
    when(shippingRepository.findForUpdate(CAMPAIGN_ID, ITEM_ID))
        .thenAnswer(invocation -> Optional.of(shipping(assigned[0])));

    preparer.handle(PAYLOAD, context());
    // 2 回目は job_id が既に割り当て済み
    preparer.handle(PAYLOAD, context());

    final ArgumentCaptor<EnqueueOptions> options = ArgumentCaptor.forClass(EnqueueOptions.class);
    verify(campaignQueue, times(1))
        .enqueue(
            eq(new DispatchCampaignPayload(SHIPPING_ID, CAMPAIGN_ID, 55L)), options.capture());
    assertThat(options.getValue().jobId()).isEqualTo(assigned[0]);
    assertThat(options.getValue().delayOrZero().toMillis()).isEqualTo(45_000L);
    // lease 切れの再取得で二重送信しないよう送信ジョブは 1 回きり
    assertThat(options.getValue().attempts()).isEqualTo(1);
    verify(shippingRepository, times(1)).assignJob(eq(SHIPPING_ID), any(), eq(NOW));
    // 既存の送信記録は最新の文面で上書きされる
    verify(shippingRepository).refreshContent(eq(SHIPPING_ID), any(), eq(NOW));
    verify(completionEvaluator, times(2)).evaluate(CAMPAIGN_ID);
  }

  @Test
  void losingTheAssignRaceDoesNotEnqueue() {
    stubCampaignAndContact(CampaignStatus.EM_ANDAMENTO);
    when(shippingRepository.insertIfAbsent(any(), eq(NOW))).thenReturn(true);
    when(shippingRepository.findForUpdate(CAMPAIGN_ID, ITEM_ID))
        .thenReturn(Optional.of(shipping(null)));
    when(shippingRepository.assignJob(eq(SHIPPING_ID), any(), eq(NOW))).thenReturn(0);

    preparer.handle(PAYLOAD, context());

    verifyNoInteractions(jobQueues);
  }

  @Test
  void awaitingConfirmationIsNotTouched() {
    stubCampaignAndContact(CampaignStatus.EM_ANDAMENTO);
    when(shippingRepository.insertIfAbsent(any(), eq(NOW))).thenReturn(false);
    final CampaignShippingRecord requested =
        new CampaignShippingRecord(
            SHIPPING_ID, CAMPAIGN_ID, ITEM_ID, "5511999990000", "m", "c", true, null, NOW, null,
            UUID.randomUUID(), NOW);
    when(shippingRepository.findForUpdate(CAMPAIGN_ID, ITEM_ID)).thenReturn(Optional.of(requested));

    preparer.handle(PAYLOAD, context());

    verify(shippingRepository, never()).refreshContent(anyLong(), any(), any());
    verifyNoInteractions(jobQueues);
  }

  @Test
  void terminalCampaignIsSkipped() {
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(Optional.of(CampaignFixtures.campaign(CampaignStatus.FINALIZADA_COM_ERROS)));

    preparer.handle(PAYLOAD, context());

    verifyNoInteractions(contactListItemRepository, channelResolver, shippingRepository);
  }

  @Test
  void invalidContactFailsTheCampaign() {
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(Optional.of(CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO)));
    when(contactListItemRepository.findById(ITEM_ID)).thenReturn(Optional.of(ITEM));
    when(channelResolver.session(WHATSAPP_ID)).thenReturn(session);
    final IllegalArgumentException invalid = new IllegalArgumentException("invalid number");
    when(session.resolveContact(COMPANY_ID, "Ana", "5511999990000", "ana@example.com"))
        .thenThrow(invalid);

    assertThatThrownBy(() -> preparer.handle(PAYLOAD, context()))
        .isInstanceOf(NonRetryableJobException.class)
        .hasCause(invalid);

    verify(errorReporter).report(ContactPreparer.ERROR_CONTEXT, invalid);
    verify(completionEvaluator).fail(CAMPAIGN_ID);
    verifyNoInteractions(shippingRepository);
  }

  @Test
  void draftRendersConfirmationOnlyWhenEnabled() {
    final CampaignRecord withConfirmation =
        CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, true, 1);
    final CampaignRecord withoutConfirmation =
        CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, false, 1);

    final ShippingDraft confirmed =
        preparer.buildDraft(withConfirmation, ITEM, CONTACT, new Random(1L));
    final ShippingDraft plain =
        preparer.buildDraft(withoutConfirmation, ITEM, CONTACT, new Random(1L));

    assertThat(confirmed.message()).isEqualTo(CampaignMessageRenderer.AUTOMATED_MARKER + "Olá Ana");
    assertThat(confirmed.confirmationMessage())
        .isEqualTo(CampaignMessageRenderer.AUTOMATED_MARKER + "Confirma, Ana?");
    assertThat(plain.confirmationMessage()).isNull();
    assertThat(plain.contactId()).isEqualTo(ITEM_ID);
    assertThat(plain.number()).isEqualTo("5511999990000");
  }

  private void stubCampaignAndContact(CampaignStatus status) {
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(Optional.of(CampaignFixtures.campaign(status)));
    when(contactListItemRepository.findById(ITEM_ID)).thenReturn(Optional.of(ITEM));
    when(channelResolver.session(WHATSAPP_ID)).thenReturn(session);
    when(session.resolveContact(COMPANY_ID, "Ana", "5511999990000", "ana@example.com"))
        .thenReturn(CONTACT);
  }

  private static CampaignShippingRecord shipping(UUID jobId) {
    return new CampaignShippingRecord(
        SHIPPING_ID,
        CAMPAIGN_ID,
        ITEM_ID,
        "5511999990000",
        "m",
        null,
        false,
        null,
        null,
        null,
        jobId,
        NOW);
  }

  private static JobContext context() {
    return new JobContext(
        UUID.randomUUID(), QueueName.CAMPAIGN_QUEUE, JobType.PREPARE_CONTACT, 1, 3);
  }
}
