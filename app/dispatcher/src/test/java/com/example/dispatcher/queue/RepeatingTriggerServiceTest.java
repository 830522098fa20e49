/*
 * どこで: 繰り返しトリガー発火のユニットテスト
 * 何を: 期限到来トリガーの投入と次回時刻の再設定、重複抑止時の挙動を検証する
 * なぜ: 前回実行中の検証ジョブを多重に積まないことを保証するため
 */
package com.example.dispatcher.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatcher.NoOpTransactionManager;
import com.example.dispatcher.model.RepeatingTriggerRecord;
import com.example.dispatcher.repository.RepeatingTriggerRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RepeatingTriggerServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:05Z");

  @Mock private RepeatingTriggerRepository triggerRepository;
  @Mock private JobQueues jobQueues;
  @Mock private JobPayloadCodec codec;
  @Mock private JobQueue scheduleQueue;

  private RepeatingTriggerService service;

  @BeforeEach
  void setUp() {
    service =
        new RepeatingTriggerService(
            triggerRepository,
            jobQueues,
            codec,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void firesDueTriggerAndRearms() {
    final RepeatingTriggerRecord trigger = verifySchedulesTrigger();
    final VerifySchedulesPayload payload = new VerifySchedulesPayload();
    when(triggerRepository.lockDue(NOW)).thenReturn(List.of(trigger));
    when(codec.decode(JobType.VERIFY_SCHEDULES, "{}")).thenReturn(payload);
    when(jobQueues.of(JobType.VERIFY_SCHEDULES)).thenReturn(scheduleQueue);
    when(scheduleQueue.enqueueIfAbsent(eq(payload), any()))
        .thenReturn(Optional.of(UUID.randomUUID()));

    final int fired = service.fireDueTriggers();

    assertThat(fired).isEqualTo(1);
    final ArgumentCaptor<EnqueueOptions> options = ArgumentCaptor.forClass(EnqueueOptions.class);
    verify(scheduleQueue).enqueueIfAbsent(eq(payload), options.capture());
    // 検証ジョブは 1 回きりで、完了後は履歴を残さない
    assertThat(options.getValue().attempts()).isEqualTo(1);
    assertThat(options.getValue().removeOnComplete()).isTrue();
    assertThat(options.getValue().dedupKey()).isEqualTo(trigger.triggerKey());
    verify(triggerRepository)
        .rearm(trigger.triggerKey(), NOW, Instant.parse("2026-01-17T00:00:10Z"));
  }

  @Test
  void rearmsEvenWhenPreviousRunIsUnfinished() {
    final RepeatingTriggerRecord trigger = verifySchedulesTrigger();
    when(triggerRepository.lockDue(NOW)).thenReturn(List.of(trigger));
    when(codec.decode(JobType.VERIFY_SCHEDULES, "{}")).thenReturn(new VerifySchedulesPayload());
    when(jobQueues.of(JobType.VERIFY_SCHEDULES)).thenReturn(scheduleQueue);
    when(scheduleQueue.enqueueIfAbsent(any(), any())).thenReturn(Optional.empty());

    service.fireDueTriggers();

    verify(triggerRepository)
        .rearm(trigger.triggerKey(), NOW, Instant.parse("2026-01-17T00:00:10Z"));
  }

  @Test
  void noDueTriggersDoesNothing() {
    when(triggerRepository.lockDue(NOW)).thenReturn(List.of());

    assertThat(service.fireDueTriggers()).isZero();
    verify(triggerRepository, never()).rearm(any(), any(), any());
  }

  private static RepeatingTriggerRecord verifySchedulesTrigger() {
    return new RepeatingTriggerRecord(
        JobQueue.triggerKey(JobType.VERIFY_SCHEDULES),
        JobType.VERIFY_SCHEDULES,
        "{}",
        "*/5 * * * * *",
        NOW,
        null);
  }
}
