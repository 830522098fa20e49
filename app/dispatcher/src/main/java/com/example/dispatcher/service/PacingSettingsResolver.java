/*
 * どこで: Dispatcher サービス層
 * 何を: settings テーブルから会社の送信間隔設定を読み、既定値で補完する
 * なぜ: 値が欠落/不正でもキャンペーンを既定ペースで進めるため
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.CampaignProperties;
import com.example.dispatcher.model.PacingSettings;
import com.example.dispatcher.repository.SettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PacingSettingsResolver {

  private static final Logger logger = LoggerFactory.getLogger(PacingSettingsResolver.class);
  static final String KEY_RANDOM_INTERVAL = "randomMessageInterval";
  static final String KEY_LONGER_INTERVAL_AFTER = "longerIntervalAfter";
  static final String KEY_GREATER_INTERVAL = "greaterInterval";
  static final String KEY_FIXED_INTERVAL = "fixedMessageInterval";

  private final SettingRepository settingRepository;
  private final CampaignProperties defaults;
  private final ObjectMapper objectMapper;

  public PacingSettings resolve(long companyId) {
    Map<String, String> settings = settingRepository.findByCompanyId(companyId);
    return new PacingSettings(
        read(settings, KEY_RANDOM_INTERVAL, defaults.randomMessageInterval(), companyId),
        read(settings, KEY_LONGER_INTERVAL_AFTER, defaults.longerIntervalAfter(), companyId),
        read(settings, KEY_GREATER_INTERVAL, defaults.greaterInterval(), companyId),
        read(settings, KEY_FIXED_INTERVAL, defaults.fixedMessageInterval(), companyId));
  }

  // 値は JSON 表現で保存されている ("20" と 20 の両方がありうる)
  private int read(Map<String, String> settings, String key, int fallback, long companyId) {
    String raw = settings.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      JsonNode node = objectMapper.readTree(raw);
      String text = node.isTextual() ? node.asText().trim() : node.toString();
      return Integer.parseInt(text);
    } catch (JsonProcessingException | NumberFormatException ex) {
      logger.warn(
          "invalid pacing setting; fallback to default companyId={} key={} value={} default={}",
          companyId,
          key,
          raw,
          fallback);
      return fallback;
    }
  }
}
