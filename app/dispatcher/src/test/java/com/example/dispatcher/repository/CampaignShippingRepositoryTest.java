/*
 * どこで: Dispatcher テスト
 * 何を: 送信記録の find-or-create と job_id/確認/配信の条件付き更新、確認返信の拾い上げを検証する
 * なぜ: 一意制約と条件付き UPDATE が二重送信防止と終端キャンペーン保護の根拠になっていることを確認するため
 */
package com.example.dispatcher.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatcher.AbstractPostgresContainerTest;
import com.example.dispatcher.model.CampaignShippingRecord;
import com.example.dispatcher.model.ConfirmedShipping;
import com.example.dispatcher.model.ShippingDraft;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CampaignShippingRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

    @Autowired
    private CampaignShippingRepository shippingRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM campaign_shipping", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM campaigns", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM contacts", new MapSqlParameterSource());
        insertCampaign(7L, "EM_ANDAMENTO");
    }

    @Test
    void insertIfAbsentCreatesOneRowPerRecipient() {
        ShippingDraft draft = new ShippingDraft(7L, 101L, "5511999990000", "hello", null);

        assertThat(shippingRepository.insertIfAbsent(draft, NOW)).isTrue();
        assertThat(shippingRepository.insertIfAbsent(draft, NOW.plusSeconds(1))).isFalse();

        CampaignShippingRecord record = shippingRepository.findForUpdate(7L, 101L).orElseThrow();
        assertThat(record.message()).isEqualTo("hello");
        assertThat(record.isPending()).isTrue();
        assertThat(record.jobId()).isNull();
    }

    @Test
    void jobIsAssignedOnlyOnce() {
        shippingRepository.insertIfAbsent(new ShippingDraft(7L, 101L, "55", "hello", null), NOW);
        long id = shippingRepository.findForUpdate(7L, 101L).orElseThrow().id();
        UUID first = UUID.randomUUID();

        assertThat(shippingRepository.assignJob(id, first, NOW)).isEqualTo(1);
        assertThat(shippingRepository.assignJob(id, UUID.randomUUID(), NOW)).isZero();
        assertThat(shippingRepository.findById(id).orElseThrow().jobId()).isEqualTo(first);
    }

    @Test
    void confirmationFlowMovesThroughRequestConfirmAndDelivery() {
        shippingRepository.insertIfAbsent(
                new ShippingDraft(7L, 101L, "55", "hello", "confirm?"), NOW);
        long id = shippingRepository.findForUpdate(7L, 101L).orElseThrow().id();
        shippingRepository.assignJob(id, UUID.randomUUID(), NOW);

        // 確認依頼前の返信は受け付けない
        assertThat(shippingRepository.markConfirmed(id, UUID.randomUUID(), NOW)).isZero();

        assertThat(shippingRepository.markConfirmationRequested(id, NOW.plusSeconds(1))).isEqualTo(1);
        assertThat(shippingRepository.refreshContent(
                id, new ShippingDraft(7L, 101L, "55", "changed", null), NOW)).isZero();

        UUID finalJob = UUID.randomUUID();
        assertThat(shippingRepository.markConfirmed(id, finalJob, NOW.plusSeconds(2))).isEqualTo(1);
        assertThat(shippingRepository.markConfirmed(id, UUID.randomUUID(), NOW.plusSeconds(3)))
                .isZero();

        assertThat(shippingRepository.markDelivered(id, NOW.plusSeconds(4))).isEqualTo(1);
        assertThat(shippingRepository.markDelivered(id, NOW.plusSeconds(5))).isZero();

        CampaignShippingRecord stored = shippingRepository.findById(id).orElseThrow();
        assertThat(stored.confirmation()).isTrue();
        assertThat(stored.jobId()).isEqualTo(finalJob);
        assertThat(stored.deliveredAt()).isEqualTo(NOW.plusSeconds(4));
        assertThat(stored.message()).isEqualTo("hello");
        assertThat(shippingRepository.countDelivered(7L)).isEqualTo(1);
    }

    @Test
    void terminalCampaignBlocksDeliveryAndConfirmationRequest() {
        shippingRepository.insertIfAbsent(
                new ShippingDraft(7L, 101L, "55", "hello", "confirm?"), NOW);
        shippingRepository.insertIfAbsent(new ShippingDraft(7L, 102L, "56", "hello", null), NOW);
        long asking = shippingRepository.findForUpdate(7L, 101L).orElseThrow().id();
        long sending = shippingRepository.findForUpdate(7L, 102L).orElseThrow().id();

        // 送信中に別ジョブがキャンペーンを失敗終了させた
        setCampaignStatus(7L, "FINALIZADA_COM_ERROS");

        assertThat(shippingRepository.markConfirmationRequested(asking, NOW)).isZero();
        assertThat(shippingRepository.markDelivered(sending, NOW)).isZero();
        assertThat(shippingRepository.findById(sending).orElseThrow().deliveredAt()).isNull();
        assertThat(shippingRepository.countDelivered(7L)).isZero();
    }

    @Test
    void confirmedRepliesAreFoundUntilFollowUpIsReserved() {
        jdbcTemplate.update(
                "INSERT INTO contacts (id, company_id, name, number) VALUES (55, 1, 'Ana', '55')",
                new MapSqlParameterSource());
        shippingRepository.insertIfAbsent(
                new ShippingDraft(7L, 101L, "55", "hello", "confirm?"), NOW);
        long id = shippingRepository.findForUpdate(7L, 101L).orElseThrow().id();
        shippingRepository.markConfirmationRequested(id, NOW);

        // 返信前は対象外
        assertThat(shippingRepository.findConfirmedAwaitingDispatch(10)).isEmpty();

        // CRM が返信を書き込む
        jdbcTemplate.update(
                "UPDATE campaign_shipping SET confirmation = TRUE WHERE id = :id",
                new MapSqlParameterSource().addValue("id", id));
        assertThat(shippingRepository.findConfirmedAwaitingDispatch(10))
                .containsExactly(new ConfirmedShipping(id, 7L, 55L));

        assertThat(shippingRepository.markConfirmed(id, UUID.randomUUID(), NOW.plusSeconds(1)))
                .isEqualTo(1);
        assertThat(shippingRepository.findConfirmedAwaitingDispatch(10)).isEmpty();
    }

    private void insertCampaign(long id, String status) {
        jdbcTemplate.update(
                "INSERT INTO campaigns (id, company_id, name, status) VALUES (:id, 1, 'promo', :status)",
                new MapSqlParameterSource().addValue("id", id).addValue("status", status));
    }

    private void setCampaignStatus(long id, String status) {
        jdbcTemplate.update(
                "UPDATE campaigns SET status = :status WHERE id = :id",
                new MapSqlParameterSource().addValue("id", id).addValue("status", status));
    }
}
