/*
 * どこで: チケットのデータアクセス
 * 何を: 連絡先ごとの未クローズチケットの find-or-create と更新を担う
 * なぜ: キャンペーン送信を受信者のチケットとして追跡するため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TicketRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Long> findOpenId(long companyId, long contactId, Long whatsappId) {
    final String sql =
        """
        SELECT id
        FROM tickets
        WHERE company_id = :companyId
          AND contact_id = :contactId
          AND whatsapp_id IS NOT DISTINCT FROM :whatsappId
          AND status <> 'closed'
        ORDER BY id DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("contactId", contactId)
            .addValue("whatsappId", whatsappId);
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  /** 未クローズのチケットが無ければ作成する。作成できたら ID を返す。 */
  public Optional<Long> insertIfAbsent(
      long companyId,
      long contactId,
      Long whatsappId,
      Long queueId,
      Long userId,
      String status,
      Instant now) {
    final String sql =
        """
        INSERT INTO tickets (
          company_id, contact_id, whatsapp_id, queue_id, user_id, status, created_at, updated_at
        ) VALUES (
          :companyId, :contactId, :whatsappId, :queueId, :userId, :status, :now, :now
        )
        ON CONFLICT (company_id, contact_id, whatsapp_id) WHERE status <> 'closed' DO NOTHING
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("contactId", contactId)
            .addValue("whatsappId", whatsappId)
            .addValue("queueId", queueId)
            .addValue("userId", userId)
            .addValue("status", status)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  public int update(long ticketId, Long queueId, Long userId, String status, Instant now) {
    final String sql =
        """
        UPDATE tickets
        SET queue_id = :queueId,
            user_id = :userId,
            status = :status,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueId", queueId)
            .addValue("userId", userId)
            .addValue("status", status)
            .addValue("now", toTimestamp(now))
            .addValue("id", ticketId);
    return jdbcTemplate.update(sql, params);
  }
}
