/*
 * どこで: ジョブキュー基盤
 * 何を: 期限到来した繰り返しトリガーからジョブを投入し、次回時刻を再設定する
 * なぜ: 再起動をまたいでも繰り返しジョブが欠落・多重化しないようにするため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.model.RepeatingTriggerRecord;
import com.example.dispatcher.repository.RepeatingTriggerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class RepeatingTriggerService {

  private static final Logger logger = LoggerFactory.getLogger(RepeatingTriggerService.class);

  private final RepeatingTriggerRepository triggerRepository;
  private final JobQueues jobQueues;
  private final JobPayloadCodec codec;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /** 発火したトリガー数を返す。 */
  public int fireDueTriggers() {
    TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    Integer fired =
        transactionTemplate.execute(
            status -> {
              Instant now = Instant.now(clock);
              // 複数インスタンスでも同じトリガーを同時に発火しないよう行ロックを取る
              List<RepeatingTriggerRecord> due = triggerRepository.lockDue(now);
              for (RepeatingTriggerRecord trigger : due) {
                fire(trigger, now);
              }
              return due.size();
            });
    return fired == null ? 0 : fired;
  }

  private void fire(RepeatingTriggerRecord trigger, Instant now) {
    JobType jobType = trigger.jobType();
    JobPayload payload = codec.decode(jobType, trigger.payloadJson());
    // 前回の実行が終わっていなければ今回分は積まない
    EnqueueOptions options =
        EnqueueOptions.defaults()
            .withAttempts(1)
            .removingOnComplete()
            .withDedupKey(trigger.triggerKey());
    Optional<UUID> jobId = jobQueues.of(jobType).enqueueIfAbsent(payload, options);
    Instant nextRunAt = JobQueue.nextRun(CronExpression.parse(trigger.cron()), now);
    triggerRepository.rearm(trigger.triggerKey(), now, nextRunAt);
    if (jobId.isPresent()) {
      logger.debug(
          "repeating job fired key={} jobId={} nextRunAt={}",
          trigger.triggerKey(),
          jobId.get(),
          nextRunAt);
    } else {
      logger.debug(
          "repeating job skipped because previous run is unfinished key={} nextRunAt={}",
          trigger.triggerKey(),
          nextRunAt);
    }
  }
}
