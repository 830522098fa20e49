/*
 * どこで: 送信チャネルのデータアクセス
 * 何を: whatsapps テーブルからチャネル定義を取得する
 * なぜ: 会社の既定チャネルと ID 指定のチャネルを解決するため
 */
package com.example.dispatcher.repository;

import com.example.dispatcher.model.ChannelRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ChannelRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ChannelRecord> findById(long channelId) {
    final String sql =
        """
        SELECT id, company_id, name, status, is_default
        FROM whatsapps
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", channelId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ChannelRecord> findDefaultByCompanyId(long companyId) {
    final String sql =
        """
        SELECT id, company_id, name, status, is_default
        FROM whatsapps
        WHERE company_id = :companyId
          AND is_default = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("companyId", companyId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ChannelRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ChannelRecord(
        rs.getLong("id"),
        rs.getLong("company_id"),
        rs.getString("name"),
        rs.getString("status"),
        rs.getBoolean("is_default"));
  }
}
