/*
 * どこで: CRM 連絡先のデータアクセス
 * 何を: contacts の find-or-create を担う
 * なぜ: チャネルで検証した宛先を会社内で一意な連絡先に結び付けるため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ContactRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** (company_id, number) で連絡先を取得し、無ければ作成してその ID を返す。 */
  public long findOrCreate(long companyId, String name, String number, String email, Instant now) {
    // DO UPDATE にして既存行でも RETURNING で ID を得る
    final String sql =
        """
        INSERT INTO contacts (company_id, name, number, email, created_at, updated_at)
        VALUES (:companyId, :name, :number, :email, :now, :now)
        ON CONFLICT (company_id, number) DO UPDATE
        SET updated_at = EXCLUDED.updated_at
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("name", name)
            .addValue("number", number)
            .addValue("email", email)
            .addValue("now", toTimestamp(now));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("contact upsert returned no id number=" + number);
    }
    return id;
  }
}
