/*
 * どこで: CRM ユーザーのデータアクセス
 * 何を: オンライン状態の取得/更新を担う
 * なぜ: 古いオンラインセッションを定期的に落とすため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Long> findStaleOnlineUserIds(Instant threshold) {
    final String sql =
        """
        SELECT id
        FROM users
        WHERE online = TRUE
          AND updated_at < :threshold
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  public int markOffline(long userId, Instant now) {
    final String sql =
        """
        UPDATE users
        SET online = FALSE,
            updated_at = :now
        WHERE id = :id
          AND online = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("id", userId);
    return jdbcTemplate.update(sql, params);
  }
}
