/*
 * どこで: ジョブキュー基盤
 * 何を: ジョブ種別ごとの処理の契約
 * なぜ: ワーカーが種別を知らずに処理を委譲できるようにするため
 */
package com.example.dispatcher.queue;

public interface JobHandler<P extends JobPayload> {

  JobType jobType();

  /** jobType の payloadClass と一致させる。 */
  Class<P> payloadType();

  /**
   * ジョブを処理する。
   *
   * <p>RuntimeException はリトライ対象、{@link NonRetryableJobException} は即時 FAILED になる。
   */
  void handle(P payload, JobContext context);
}
