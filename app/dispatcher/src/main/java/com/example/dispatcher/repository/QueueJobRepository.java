/*
 * どこで: ジョブキューのデータアクセス
 * 何を: queue_jobs の投入/claim/完了/リトライ/掃除を担う
 * なぜ: 遅延・重複排除・lease 回収を DB の原子的更新で実現するため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatcher.model.QueueJobRecord;
import com.example.dispatcher.model.QueueJobStatus;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.QueueName;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QueueJobRepository {

  private static final String COLUMNS =
      """
      job_id, queue_name, job_type, payload_json::text AS payload_json_text, status, not_before,
      attempt_count, max_attempts, remove_on_complete, dedup_key, locked_by, locked_at,
      lease_until, last_error, created_at, completed_at
      """;

  private static final Comparator<QueueJobRecord> CLAIM_ORDER =
      Comparator.comparing(QueueJobRecord::notBefore).thenComparing(QueueJobRecord::createdAt);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(QueueJobRecord record) {
    final String sql =
        """
        INSERT INTO queue_jobs (
          job_id, queue_name, job_type, payload_json, status, not_before, attempt_count,
          max_attempts, remove_on_complete, dedup_key, created_at
        ) VALUES (
          :jobId, :queueName, :jobType, :payloadJson::jsonb, 'PENDING', :notBefore, 0,
          :maxAttempts, :removeOnComplete, :dedupKey, :createdAt
        )
        """;
    jdbcTemplate.update(sql, insertParams(record));
  }

  /** 同じ dedup_key の未完了ジョブがあれば何もしない。挿入できたら true。 */
  public boolean insertIfAbsent(QueueJobRecord record) {
    final String sql =
        """
        INSERT INTO queue_jobs (
          job_id, queue_name, job_type, payload_json, status, not_before, attempt_count,
          max_attempts, remove_on_complete, dedup_key, created_at
        ) VALUES (
          :jobId, :queueName, :jobType, :payloadJson::jsonb, 'PENDING', :notBefore, 0,
          :maxAttempts, :removeOnComplete, :dedupKey, :createdAt
        )
        ON CONFLICT (dedup_key) WHERE status IN ('PENDING', 'PROCESSING') DO NOTHING
        """;
    return jdbcTemplate.update(sql, insertParams(record)) == 1;
  }

  public List<QueueJobRecord> claim(
      QueueName queue,
      Collection<JobType> types,
      int limit,
      Instant now,
      Instant leaseUntil,
      String lockedBy) {
    if (types.isEmpty() || limit <= 0) {
      return List.of();
    }
    // 適格時刻 (not_before) 順に claim し、lease 切れの PROCESSING も試行回数が残る限り回収する
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM queue_jobs
          WHERE queue_name = :queueName
            AND job_type IN (:jobTypes)
            AND (
              (status = 'PENDING' AND not_before <= :now)
              OR (
                status = 'PROCESSING'
                AND lease_until <= :now
                AND attempt_count < max_attempts
              )
            )
          ORDER BY not_before, created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE queue_jobs j
        SET status = 'PROCESSING',
            attempt_count = j.attempt_count + 1,
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.queue_name, j.job_type, j.payload_json::text AS payload_json_text,
                  j.status, j.not_before, j.attempt_count, j.max_attempts, j.remove_on_complete,
                  j.dedup_key, j.locked_by, j.locked_at, j.lease_until, j.last_error,
                  j.created_at, j.completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queue.value())
            .addValue("jobTypes", types.stream().map(JobType::value).toList())
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    // RETURNING は順序を保証しないため claim 順に並べ直す
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .sorted(CLAIM_ORDER)
        .toList();
  }

  public int markCompleted(UUID jobId, Instant completedAt, String lockedBy) {
    final String sql =
        """
        UPDATE queue_jobs
        SET status = 'COMPLETED',
            completed_at = :completedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteCompleted(UUID jobId, String lockedBy) {
    final String sql =
        """
        DELETE FROM queue_jobs
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(UUID jobId, Instant notBefore, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE queue_jobs
        SET status = 'PENDING',
            not_before = :notBefore,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notBefore", toTimestamp(notBefore))
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID jobId, Instant failedAt, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE queue_jobs
        SET status = 'FAILED',
            completed_at = :failedAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("failedAt", toTimestamp(failedAt))
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** lease が切れたまま試行回数を使い切ったジョブを FAILED にして返す。 */
  public List<QueueJobRecord> failAbandoned(Instant now, String lastError) {
    final String sql =
        """
        UPDATE queue_jobs
        SET status = 'FAILED',
            completed_at = :now,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE status = 'PROCESSING'
          AND lease_until <= :now
          AND attempt_count >= max_attempts
        RETURNING job_id, queue_name, job_type, payload_json::text AS payload_json_text, status,
                  not_before, attempt_count, max_attempts, remove_on_complete, dedup_key,
                  locked_by, locked_at, lease_until, last_error, created_at, completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("lastError", lastError);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteFinishedOlderThan(QueueJobStatus status, Instant threshold) {
    final String sql =
        """
        DELETE FROM queue_jobs
        WHERE status = :status
          AND completed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public Map<QueueName, Integer> countPendingByQueue() {
    final String sql =
        """
        SELECT queue_name, COUNT(*) AS pending
        FROM queue_jobs
        WHERE status = 'PENDING'
        GROUP BY queue_name
        """;
    final Map<QueueName, Integer> counts = new HashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(QueueName.fromValue(rs.getString("queue_name")), rs.getInt("pending"));
        });
    return counts;
  }

  public int countPending(QueueName queue) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM queue_jobs
        WHERE queue_name = :queueName
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queue.value());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<QueueJobRecord> findByQueue(QueueName queue) {
    final String sql =
        "SELECT " + COLUMNS + " FROM queue_jobs WHERE queue_name = :queueName"
            + " ORDER BY not_before, created_at";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queue.value());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource insertParams(QueueJobRecord record) {
    return new MapSqlParameterSource()
        .addValue("jobId", record.jobId())
        .addValue("queueName", record.queue().value())
        .addValue("jobType", record.jobType().value())
        .addValue("payloadJson", record.payloadJson())
        .addValue("notBefore", toTimestamp(record.notBefore()))
        .addValue("maxAttempts", record.maxAttempts())
        .addValue("removeOnComplete", record.removeOnComplete())
        .addValue("dedupKey", record.dedupKey())
        .addValue("createdAt", toTimestamp(record.createdAt()));
  }

  private QueueJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final QueueName queue = QueueName.fromValue(rs.getString("queue_name"));
    return new QueueJobRecord(
        UUID.fromString(rs.getString("job_id")),
        queue,
        JobType.of(queue, rs.getString("job_type")),
        rs.getString("payload_json_text"),
        QueueJobStatus.valueOf(rs.getString("status")),
        getInstant(rs, "not_before"),
        rs.getInt("attempt_count"),
        rs.getInt("max_attempts"),
        rs.getBoolean("remove_on_complete"),
        rs.getString("dedup_key"),
        rs.getString("locked_by"),
        getInstant(rs, "locked_at"),
        getInstant(rs, "lease_until"),
        rs.getString("last_error"),
        getInstant(rs, "created_at"),
        getInstant(rs, "completed_at"));
  }
}
