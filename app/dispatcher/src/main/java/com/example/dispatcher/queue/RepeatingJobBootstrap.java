/*
 * どこで: ジョブキュー基盤
 * 何を: 起動時に検証系の繰り返しジョブ (予約/キャンペーン/ログイン状態) を登録する
 * なぜ: 周期を設定ファイルから変更できるようにし、再起動で二重登録しないため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.config.CampaignProperties;
import com.example.dispatcher.config.ScheduleProperties;
import com.example.dispatcher.config.SessionMonitorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.queue.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RepeatingJobBootstrap implements ApplicationRunner {

  private final JobQueues jobQueues;
  private final ScheduleProperties scheduleProperties;
  private final CampaignProperties campaignProperties;
  private final SessionMonitorProperties sessionMonitorProperties;

  @Override
  public void run(ApplicationArguments args) {
    jobQueues
        .get(QueueName.SCHEDULE_MONITOR)
        .repeat(new VerifySchedulesPayload(), scheduleProperties.verifyCron());
    jobQueues
        .get(QueueName.CAMPAIGN_QUEUE)
        .repeat(new VerifyCampaignsPayload(), campaignProperties.verifyCron());
    jobQueues
        .get(QueueName.USER_MONITOR)
        .repeat(new VerifyLoginStatusPayload(), sessionMonitorProperties.verifyCron());
  }
}
