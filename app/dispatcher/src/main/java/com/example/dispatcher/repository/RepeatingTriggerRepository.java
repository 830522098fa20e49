/*
 * どこで: ジョブキューのデータアクセス
 * 何を: repeating_triggers (永続タイマー) の登録/期限到来分のロック取得/再設定を担う
 * なぜ: 再起動後も繰り返しジョブを自己再投入なしで継続するため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatcher.model.RepeatingTriggerRecord;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.QueueName;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RepeatingTriggerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // cron が変わったときだけ次回時刻を取り直す
  public void upsert(RepeatingTriggerRecord record, Instant now) {
    final String sql =
        """
        INSERT INTO repeating_triggers (
          trigger_key, queue_name, job_type, payload_json, cron, next_run_at, last_run_at, updated_at
        ) VALUES (
          :triggerKey, :queueName, :jobType, :payloadJson::jsonb, :cron, :nextRunAt, NULL, :now
        )
        ON CONFLICT (trigger_key) DO UPDATE
        SET payload_json = EXCLUDED.payload_json,
            cron = EXCLUDED.cron,
            next_run_at = CASE
              WHEN repeating_triggers.cron = EXCLUDED.cron THEN repeating_triggers.next_run_at
              ELSE EXCLUDED.next_run_at
            END,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("triggerKey", record.triggerKey())
            .addValue("queueName", record.jobType().queue().value())
            .addValue("jobType", record.jobType().value())
            .addValue("payloadJson", record.payloadJson())
            .addValue("cron", record.cron())
            .addValue("nextRunAt", toTimestamp(record.nextRunAt()))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** 呼び出し側のトランザクション内で使う。他インスタンスが処理中の行は飛ばす。 */
  public List<RepeatingTriggerRecord> lockDue(Instant now) {
    final String sql =
        """
        SELECT trigger_key, queue_name, job_type, payload_json::text AS payload_json_text, cron,
               next_run_at, last_run_at
        FROM repeating_triggers
        WHERE next_run_at <= :now
        ORDER BY next_run_at
        FOR UPDATE SKIP LOCKED
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int rearm(String triggerKey, Instant lastRunAt, Instant nextRunAt) {
    final String sql =
        """
        UPDATE repeating_triggers
        SET last_run_at = :lastRunAt,
            next_run_at = :nextRunAt,
            updated_at = :lastRunAt
        WHERE trigger_key = :triggerKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("triggerKey", triggerKey);
    return jdbcTemplate.update(sql, params);
  }

  public List<RepeatingTriggerRecord> findAll() {
    final String sql =
        """
        SELECT trigger_key, queue_name, job_type, payload_json::text AS payload_json_text, cron,
               next_run_at, last_run_at
        FROM repeating_triggers
        ORDER BY trigger_key
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private RepeatingTriggerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final QueueName queue = QueueName.fromValue(rs.getString("queue_name"));
    return new RepeatingTriggerRecord(
        rs.getString("trigger_key"),
        JobType.of(queue, rs.getString("job_type")),
        rs.getString("payload_json_text"),
        rs.getString("cron"),
        getInstant(rs, "next_run_at"),
        getInstant(rs, "last_run_at"));
  }
}
