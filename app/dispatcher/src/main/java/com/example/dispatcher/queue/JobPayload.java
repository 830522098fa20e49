/*
 * どこで: ジョブキュー基盤
 * 何を: ジョブペイロードの閉じた型階層
 * なぜ: 種別とペイロード形状の対応をコンパイル時に固定するため
 */
package com.example.dispatcher.queue;

public sealed interface JobPayload
    permits SendMessagePayload,
        VerifySchedulesPayload,
        SendScheduledMessagePayload,
        VerifyCampaignsPayload,
        ProcessCampaignPayload,
        PrepareContactPayload,
        DispatchCampaignPayload,
        VerifyLoginStatusPayload {

  JobType jobType();
}
