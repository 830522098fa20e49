/*
 * どこで: キャンペーン完了判定のユニットテスト
 * 何を: 配信済み件数が受信者数に達した時だけ FINALIZADA になることを検証する
 * なぜ: 配信順序に関係なく最後の 1 件でキャンペーンが終了することを保証するため
 */
package com.example.dispatcher.service;

import static com.example.dispatcher.service.CampaignFixtures.CAMPAIGN_ID;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignStatus;
import com.example.dispatcher.queue.JobNotFoundException;
import com.example.dispatcher.repository.CampaignRepository;
import com.example.dispatcher.repository.CampaignShippingRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CampaignCompletionEvaluatorTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private CampaignRepository campaignRepository;
  @Mock private CampaignShippingRepository shippingRepository;
  @Mock private CompanyEventPublisher eventPublisher;
  @Mock private DispatchMetrics metrics;

  private CampaignCompletionEvaluator evaluator;

  @BeforeEach
  void setUp() {
    evaluator =
        new CampaignCompletionEvaluator(
            campaignRepository,
            shippingRepository,
            eventPublisher,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void notFinishedWhileDeliveriesRemain() {
    final CampaignRecord campaign = CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, false, 3);
    when(campaignRepository.findById(CAMPAIGN_ID)).thenReturn(Optional.of(campaign));
    when(shippingRepository.countDelivered(CAMPAIGN_ID)).thenReturn(2);

    evaluator.evaluate(CAMPAIGN_ID);

    verify(campaignRepository, never()).markFinished(anyLong(), any());
    // 進捗の通知は毎回行う
    verify(eventPublisher).publishCampaignUpdate(campaign);
  }

  @Test
  void lastDeliveryFinishesCampaign() {
    final CampaignRecord running = CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, false, 3);
    final CampaignRecord finished = CampaignFixtures.campaign(CampaignStatus.FINALIZADA, false, 3);
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(Optional.of(running), Optional.of(finished));
    when(shippingRepository.countDelivered(CAMPAIGN_ID)).thenReturn(3);
    when(campaignRepository.markFinished(CAMPAIGN_ID, NOW)).thenReturn(1);

    evaluator.evaluate(CAMPAIGN_ID);

    verify(metrics).recordCampaignFinalized("FINALIZADA");
    verify(eventPublisher).publishCampaignUpdate(finished);
  }

  @Test
  void concurrentFinishIsCountedOnce() {
    final CampaignRecord running = CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, false, 3);
    when(campaignRepository.findById(CAMPAIGN_ID)).thenReturn(Optional.of(running));
    when(shippingRepository.countDelivered(CAMPAIGN_ID)).thenReturn(3);
    when(campaignRepository.markFinished(CAMPAIGN_ID, NOW)).thenReturn(0);

    evaluator.evaluate(CAMPAIGN_ID);

    verify(metrics, never()).recordCampaignFinalized(any());
  }

  @Test
  void zeroRecipientsFinishImmediately() {
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(Optional.of(CampaignFixtures.campaign(CampaignStatus.EM_ANDAMENTO, false, 0)));
    when(shippingRepository.countDelivered(CAMPAIGN_ID)).thenReturn(0);
    when(campaignRepository.markFinished(CAMPAIGN_ID, NOW)).thenReturn(1);

    evaluator.evaluate(CAMPAIGN_ID);

    verify(metrics).recordCampaignFinalized("FINALIZADA");
  }

  @Test
  void terminalCampaignIsNotReevaluated() {
    when(campaignRepository.findById(CAMPAIGN_ID))
        .thenReturn(
            Optional.of(
                CampaignFixtures.campaign(CampaignStatus.FINALIZADA_COM_ERROS, false, 3)));

    evaluator.evaluate(CAMPAIGN_ID);

    verify(shippingRepository, never()).countDelivered(anyLong());
  }

  @Test
  void missingCampaignIsNotFound() {
    when(campaignRepository.findById(CAMPAIGN_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> evaluator.evaluate(CAMPAIGN_ID))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void failMarksFinishedWithErrors() {
    final CampaignRecord failed =
        CampaignFixtures.campaign(CampaignStatus.FINALIZADA_COM_ERROS, false, 3);
    when(campaignRepository.markFailed(CAMPAIGN_ID, NOW)).thenReturn(1);
    when(campaignRepository.findById(CAMPAIGN_ID)).thenReturn(Optional.of(failed));

    evaluator.fail(CAMPAIGN_ID);

    verify(metrics).recordCampaignFinalized("FINALIZADA_COM_ERROS");
    verify(eventPublisher).publishCampaignUpdate(failed);
  }
}
