/*
 * どこで: 送信間隔設定の解決のユニットテスト
 * 何を: JSON 表現の設定値の読み取りと欠落/不正値の既定値補完を検証する
 * なぜ: 会社設定が壊れていてもキャンペーンが既定のペースで進むことを保証するため
 */
package com.example.dispatcher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.dispatcher.config.CampaignProperties;
import com.example.dispatcher.model.PacingSettings;
import com.example.dispatcher.repository.SettingRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PacingSettingsResolverTest {

  @Mock private SettingRepository settingRepository;

  private PacingSettingsResolver resolver;

  @BeforeEach
  void setUp() {
    final CampaignProperties defaults =
        new CampaignProperties(
            "*/20 * * * * *", Duration.ofHours(1), "public", 20, 20, 60, 0);
    resolver = new PacingSettingsResolver(settingRepository, defaults, new ObjectMapper());
  }

  @Test
  void readsNumericAndQuotedValues() {
    when(settingRepository.findByCompanyId(1L))
        .thenReturn(
            Map.of(
                "randomMessageInterval", "\"15\"",
                "longerIntervalAfter", "10",
                "greaterInterval", "\" 90 \"",
                "fixedMessageInterval", "3"));

    final PacingSettings settings = resolver.resolve(1L);

    assertThat(settings).isEqualTo(new PacingSettings(15, 10, 90, 3));
  }

  @Test
  void missingOrInvalidValuesUseDefaults() {
    when(settingRepository.findByCompanyId(2L))
        .thenReturn(
            Map.of(
                "randomMessageInterval", "abc",
                "longerIntervalAfter", "2.5",
                "greaterInterval", ""));

    final PacingSettings settings = resolver.resolve(2L);

    assertThat(settings).isEqualTo(new PacingSettings(20, 20, 60, 0));
  }
}
