package com.example.dispatcher.repository;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** 会社ごとの key/value 設定 (settings) を読む。 */
@Repository
@RequiredArgsConstructor
public class SettingRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<String, String> findByCompanyId(long companyId) {
    final String sql =
        """
        SELECT key, value
        FROM settings
        WHERE company_id = :companyId
        ORDER BY key
        """;
    final Map<String, String> settings = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("companyId", companyId),
        rs -> {
          settings.put(rs.getString("key"), rs.getString("value"));
        });
    return settings;
  }
}
