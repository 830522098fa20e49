/*
 * どこで: キャンペーン送信記録のデータアクセス
 * 何を: campaign_shipping の find-or-create と条件付き状態更新を担う
 * なぜ: (campaign_id, contact_id) の一意制約を重複送信防止の根拠にするため
 */
package com.example.dispatcher.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.model.ConfirmedShipping;
import com.example.dispatcher.model.ShippingDraft;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CampaignShippingRepository {

  // 終端キャンペーンの送信記録には送信済み系の時刻を書かない
  private static final String CAMPAIGN_ACTIVE =
      """
        AND EXISTS (
          SELECT 1 FROM campaigns c
          WHERE c.id = campaign_shipping.campaign_id
            AND c.status IN ('PROGRAMADA', 'EM_ANDAMENTO')
        )
      """;

  private static final String SELECT_COLUMNS =
      """
      SELECT id, campaign_id, contact_id, number, message, confirmation_message, confirmation,
             confirmed_at, confirmation_requested_at, delivered_at, job_id, created_at
      FROM campaign_shipping
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 新規作成できたら true。既存行があれば何も変えない。 */
  public boolean insertIfAbsent(ShippingDraft draft, Instant now) {
    final String sql =
        """
        INSERT INTO campaign_shipping (
          campaign_id, contact_id, number, message, confirmation_message, created_at, updated_at
        ) VALUES (
          :campaignId, :contactId, :number, :message, :confirmationMessage, :now, :now
        )
        ON CONFLICT (campaign_id, contact_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("campaignId", draft.campaignId())
            .addValue("contactId", draft.contactId())
            .addValue("number", draft.number())
            .addValue("message", draft.message())
            .addValue("confirmationMessage", draft.confirmationMessage())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  // 同一受信者の準備ジョブが並走しても行ロックで直列化する
  public Optional<CampaignShippingRecord> findForUpdate(long campaignId, long contactId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE campaign_id = :campaignId
              AND contact_id = :contactId
            FOR UPDATE
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("campaignId", campaignId)
            .addValue("contactId", contactId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CampaignShippingRecord> findById(long shippingId) {
    final String sql = SELECT_COLUMNS + " WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", shippingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int refreshContent(long shippingId, ShippingDraft draft, Instant now) {
    final String sql =
        """
        UPDATE campaign_shipping
        SET number = :number,
            message = :message,
            confirmation_message = :confirmationMessage,
            updated_at = :now
        WHERE id = :id
          AND delivered_at IS NULL
          AND confirmation_requested_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("number", draft.number())
            .addValue("message", draft.message())
            .addValue("confirmationMessage", draft.confirmationMessage())
            .addValue("now", toTimestamp(now))
            .addValue("id", shippingId);
    return jdbcTemplate.update(sql, params);
  }

  /** 送信ジョブ ID を未割り当ての行にだけ記録する。1 なら呼び出し側がジョブを投入してよい。 */
  public int assignJob(long shippingId, UUID jobId, Instant now) {
    final String sql =
        """
        UPDATE campaign_shipping
        SET job_id = :jobId,
            updated_at = :now
        WHERE id = :id
          AND job_id IS NULL
          AND delivered_at IS NULL
          AND confirmation_requested_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now))
            .addValue("id", shippingId);
    return jdbcTemplate.update(sql, params);
  }

  public int markConfirmationRequested(long shippingId, Instant requestedAt) {
    final String sql =
        """
        UPDATE campaign_shipping
        SET confirmation_requested_at = :requestedAt,
            updated_at = :requestedAt
        WHERE id = :id
          AND confirmation_requested_at IS NULL
          AND delivered_at IS NULL
        """
            + CAMPAIGN_ACTIVE;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestedAt", toTimestamp(requestedAt))
            .addValue("id", shippingId);
    return jdbcTemplate.update(sql, params);
  }

  public int markDelivered(long shippingId, Instant deliveredAt) {
    final String sql =
        """
        UPDATE campaign_shipping
        SET delivered_at = :deliveredAt,
            updated_at = :deliveredAt
        WHERE id = :id
          AND delivered_at IS NULL
        """
            + CAMPAIGN_ACTIVE;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveredAt", toTimestamp(deliveredAt))
            .addValue("id", shippingId);
    return jdbcTemplate.update(sql, params);
  }

  /** 確認返信を記録し、後続の本送信ジョブ ID を割り当てる。確認依頼済みかつ未確認の行のみ対象。 */
  public int markConfirmed(long shippingId, UUID jobId, Instant confirmedAt) {
    final String sql =
        """
        UPDATE campaign_shipping
        SET confirmation = TRUE,
            confirmed_at = :confirmedAt,
            job_id = :jobId,
            updated_at = :confirmedAt
        WHERE id = :id
          AND confirmation_requested_at IS NOT NULL
          AND confirmed_at IS NULL
          AND delivered_at IS NULL
        """
            + CAMPAIGN_ACTIVE;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("confirmedAt", toTimestamp(confirmedAt))
            .addValue("jobId", jobId)
            .addValue("id", shippingId);
    return jdbcTemplate.update(sql, params);
  }

  /** CRM が確認返信 (confirmation = TRUE) を書き込んだが、本送信がまだ予約されていない行。 */
  public List<ConfirmedShipping> findConfirmedAwaitingDispatch(int limit) {
    final String sql =
        """
        SELECT s.id, s.campaign_id, ct.id AS crm_contact_id
        FROM campaign_shipping s
        JOIN campaigns c ON c.id = s.campaign_id
        JOIN contacts ct ON ct.company_id = c.company_id AND ct.number = s.number
        WHERE s.confirmation = TRUE
          AND s.confirmation_requested_at IS NOT NULL
          AND s.confirmed_at IS NULL
          AND s.delivered_at IS NULL
          AND c.status IN ('PROGRAMADA', 'EM_ANDAMENTO')
        ORDER BY s.confirmation_requested_at, s.id
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new ConfirmedShipping(
                rs.getLong("id"), rs.getLong("campaign_id"), rs.getLong("crm_contact_id")));
  }

  public int countDelivered(long campaignId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM campaign_shipping
        WHERE campaign_id = :campaignId
          AND delivered_at IS NOT NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("campaignId", campaignId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private CampaignShippingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String jobId = rs.getString("job_id");
    return new CampaignShippingRecord(
        rs.getLong("id"),
        rs.getLong("campaign_id"),
        rs.getLong("contact_id"),
        rs.getString("number"),
        rs.getString("message"),
        rs.getString("confirmation_message"),
        rs.getBoolean("confirmation"),
        getInstant(rs, "confirmed_at"),
        getInstant(rs, "confirmation_requested_at"),
        getInstant(rs, "delivered_at"),
        jobId == null ? null : UUID.fromString(jobId),
        getInstant(rs, "created_at"));
  }
}
