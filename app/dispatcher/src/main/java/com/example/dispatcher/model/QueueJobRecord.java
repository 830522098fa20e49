/*
 * どこで: ジョブキューのドメインモデル
 * 何を: queue_jobs テーブルのスナップショット
 * なぜ: claim 結果をワーカーと実行サービスで共有するため
 */
package com.example.dispatcher.model;

import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.QueueName;
import java.time.Instant;
import java.util.UUID;

public record QueueJobRecord(
    UUID jobId,
    QueueName queue,
    JobType jobType,
    String payloadJson,
    QueueJobStatus status,
    Instant notBefore,
    int attemptCount,
    int maxAttempts,
    boolean removeOnComplete,
    String dedupKey,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    String lastError,
    Instant createdAt,
    Instant completedAt) {}
