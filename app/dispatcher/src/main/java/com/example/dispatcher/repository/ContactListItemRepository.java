/*
 * どこで: 受信者リストのデータアクセス
 * 何を: contact_list_items の取得を担う
 * なぜ: キャンペーン展開時の受信者スナップショットを固定順で得るため
 */
package com.example.dispatcher.repository;

import com.example.dispatcher.model.ContactListItemRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ContactListItemRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<ContactListItemRecord> findValidByContactListId(long contactListId) {
    final String sql =
        """
        SELECT id, contact_list_id, company_id, name, number, email, is_whatsapp_valid
        FROM contact_list_items
        WHERE contact_list_id = :contactListId
          AND is_whatsapp_valid = TRUE
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("contactListId", contactListId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ContactListItemRecord> findById(long id) {
    final String sql =
        """
        SELECT id, contact_list_id, company_id, name, number, email, is_whatsapp_valid
        FROM contact_list_items
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ContactListItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ContactListItemRecord(
        rs.getLong("id"),
        rs.getLong("contact_list_id"),
        rs.getLong("company_id"),
        rs.getString("name"),
        rs.getString("number"),
        rs.getString("email"),
        rs.getBoolean("is_whatsapp_valid"));
  }
}
