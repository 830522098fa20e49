/*
 * どこで: Dispatcher の NATS 連携
 * 何を: キャンペーン状態の更新を会社スコープの subject へ JSON で publish する
 * なぜ: 画面側が進捗をリアルタイムに再描画できるようにするため
 */
package com.example.dispatcher.nats;

import com.example.common.TraceIds;
import com.example.common.event.CompanyRecordEvent;
import com.example.dispatcher.config.NatsProperties;
import com.example.dispatcher.model.CampaignRecord;
import com.example.dispatcher.service.CompanyEventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsCompanyEventPublisher implements CompanyEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsCompanyEventPublisher.class);
  static final String ACTION_UPDATE = "update";
  static final String RECORD_TYPE_CAMPAIGN = "campaign";

  private final Connection connection;
  private final NatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public NatsCompanyEventPublisher(
      Connection connection, NatsProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.connection = connection;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void publishCampaignUpdate(CampaignRecord campaign) {
    final String subject = subjectFor(campaign.companyId());
    final CompanyRecordEvent event =
        new CompanyRecordEvent(
            UUID.randomUUID().toString(),
            ACTION_UPDATE,
            RECORD_TYPE_CAMPAIGN,
            campaign.companyId(),
            toRecord(campaign),
            Instant.now(clock).toString(),
            TraceIds.orNew(MDC.get("trace_id")));
    try {
      connection.publish(subject, objectMapper.writeValueAsBytes(event));
      logger.debug("campaign update published subject={} campaignId={}", subject, campaign.id());
    } catch (JsonProcessingException | IllegalStateException ex) {
      // 通知は best-effort。送信パイプラインの結果には影響させない
      logger.warn(
          "failed to publish campaign update subject={} campaignId={}", subject, campaign.id(), ex);
    }
  }

  String subjectFor(long companyId) {
    return properties.subjectPrefix() + ".company." + companyId + ".campaign";
  }

  private Map<String, Object> toRecord(CampaignRecord campaign) {
    final Map<String, Object> record = new LinkedHashMap<>();
    record.put("id", campaign.id());
    record.put("name", campaign.name());
    record.put("status", campaign.status().name());
    record.put("scheduledAt", toIsoString(campaign.scheduledAt()));
    record.put("completedAt", toIsoString(campaign.completedAt()));
    record.put("recipientCount", campaign.recipientCount());
    return record;
  }

  private static String toIsoString(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
