/*
 * どこで: キャンペーンのデータアクセス
 * 何を: campaigns の取得と状態遷移 (条件付き UPDATE) を担う
 * なぜ: 終端状態からの巻き戻りを SQL の WHERE 句で防ぐため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.model.CampaignStatus;
import com.example.dispatcher.model.DueCampaign;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CampaignRepository {

  private static final int TEMPLATE_SLOTS = 5;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CampaignRecord> findById(long campaignId) {
    final String sql =
        """
        SELECT id, company_id, name, contact_list_id, whatsapp_id,
               message1, message2, message3, message4, message5,
               confirmation,
               confirmation_message1, confirmation_message2, confirmation_message3,
               confirmation_message4, confirmation_message5,
               media_path, media_name, queue_id, user_id, status, scheduled_at, completed_at,
               recipient_count
        FROM campaigns
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", campaignId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<DueCampaign> findDueScheduled(Instant from, Instant to) {
    final String sql =
        """
        SELECT id, company_id, scheduled_at
        FROM campaigns
        WHERE status = 'PROGRAMADA'
          AND scheduled_at BETWEEN :from AND :to
        ORDER BY scheduled_at, id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new DueCampaign(
                rs.getLong("id"), rs.getLong("company_id"), getInstant(rs, "scheduled_at")));
  }

  public int updateRecipientCount(long campaignId, int recipientCount, Instant now) {
    final String sql =
        """
        UPDATE campaigns
        SET recipient_count = :recipientCount,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientCount", recipientCount)
            .addValue("now", toTimestamp(now))
            .addValue("id", campaignId);
    return jdbcTemplate.update(sql, params);
  }

  public int markInProgress(long campaignId, Instant now) {
    final String sql =
        """
        UPDATE campaigns
        SET status = 'EM_ANDAMENTO',
            updated_at = :now
        WHERE id = :id
          AND status = 'PROGRAMADA'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", campaignId);
    return jdbcTemplate.update(sql, params);
  }

  public int markFinished(long campaignId, Instant completedAt) {
    return finish(campaignId, CampaignStatus.FINALIZADA, completedAt);
  }

  public int markFailed(long campaignId, Instant completedAt) {
    return finish(campaignId, CampaignStatus.FINALIZADA_COM_ERROS, completedAt);
  }

  private int finish(long campaignId, CampaignStatus status, Instant completedAt) {
    // 終端状態は上書きしない
    final String sql =
        """
        UPDATE campaigns
        SET status = :status,
            completed_at = :completedAt,
            updated_at = :completedAt
        WHERE id = :id
          AND status IN ('PROGRAMADA', 'EM_ANDAMENTO')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("id", campaignId);
    return jdbcTemplate.update(sql, params);
  }

  private CampaignRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CampaignRecord(
        rs.getLong("id"),
        rs.getLong("company_id"),
        rs.getString("name"),
        rs.getObject("contact_list_id", Long.class),
        rs.getObject("whatsapp_id", Long.class),
        readTemplates(rs, "message"),
        rs.getBoolean("confirmation"),
        readTemplates(rs, "confirmation_message"),
        rs.getString("media_path"),
        rs.getString("media_name"),
        rs.getObject("queue_id", Long.class),
        rs.getObject("user_id", Long.class),
        CampaignStatus.valueOf(rs.getString("status")),
        getInstant(rs, "scheduled_at"),
        getInstant(rs, "completed_at"),
        rs.getObject("recipient_count", Integer.class));
  }

  // 空欄のテンプレート枠は候補から外す
  private List<String> readTemplates(ResultSet rs, String prefix) throws SQLException {
    final List<String> templates = new ArrayList<>();
    for (int slot = 1; slot <= TEMPLATE_SLOTS; slot++) {
      final String value = rs.getString(prefix + slot);
      if (value != null && !value.isBlank()) {
        templates.add(value);
      }
    }
    return templates;
  }
}
