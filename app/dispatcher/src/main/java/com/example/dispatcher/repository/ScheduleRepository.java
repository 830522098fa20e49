/*
 * どこで: 予約メッセージのデータアクセス
 * 何を: schedules の期限到来分の取得と状態遷移を担う
 * なぜ: PENDENTE→AGENDADA の反転を条件付き UPDATE にして二重予約を防ぐため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatcher.model.ScheduleRecord;
import com.example.dispatcher.model.ScheduleStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleRepository {

  private static final String SELECT_WITH_CONTACT =
      """
      SELECT s.id, s.company_id, s.contact_id, c.name AS contact_name, c.number AS contact_number,
             s.body, s.send_at, s.sent_at, s.status
      FROM schedules s
      JOIN contacts c ON c.id = s.contact_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<ScheduleRecord> findDue(Instant from, Instant to) {
    final String sql =
        SELECT_WITH_CONTACT
            + """
            WHERE s.status = 'PENDENTE'
              AND s.sent_at IS NULL
              AND s.send_at BETWEEN :from AND :to
            ORDER BY s.send_at, s.id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ScheduleRecord> findById(long scheduleId) {
    final String sql = SELECT_WITH_CONTACT + " WHERE s.id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markScheduled(long scheduleId, Instant now) {
    final String sql =
        """
        UPDATE schedules
        SET status = 'AGENDADA',
            updated_at = :now
        WHERE id = :id
          AND status = 'PENDENTE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", scheduleId);
    return jdbcTemplate.update(sql, params);
  }

  public int markSent(long scheduleId, Instant sentAt) {
    final String sql =
        """
        UPDATE schedules
        SET status = 'ENVIADA',
            sent_at = :sentAt,
            updated_at = :sentAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", scheduleId);
    return jdbcTemplate.update(sql, params);
  }

  public int markError(long scheduleId, Instant now) {
    final String sql =
        """
        UPDATE schedules
        SET status = 'ERRO',
            updated_at = :now
        WHERE id = :id
          AND status <> 'ENVIADA'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", scheduleId);
    return jdbcTemplate.update(sql, params);
  }

  private ScheduleRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleRecord(
        rs.getLong("id"),
        rs.getLong("company_id"),
        rs.getLong("contact_id"),
        rs.getString("contact_name"),
        rs.getString("contact_number"),
        rs.getString("body"),
        getInstant(rs, "send_at"),
        getInstant(rs, "sent_at"),
        ScheduleStatus.valueOf(rs.getString("status")));
  }
}
