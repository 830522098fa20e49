/*
 * どこで: ジョブキュー基盤
 * 何を: ジョブペイロードと payload_json の相互変換
 * なぜ: 種別ごとのレコード型を JSONB に保存し、取り出し時に型を復元するため
 */
package com.example.dispatcher.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobPayloadCodec {

  private final ObjectMapper objectMapper;

  public String encode(JobPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("failed to serialize payload type=" + payload.jobType(), ex);
    }
  }

  public JobPayload decode(JobType jobType, String payloadJson) {
    try {
      return objectMapper.readValue(payloadJson, jobType.payloadClass());
    } catch (JsonProcessingException ex) {
      // 壊れたペイロードは何度読み直しても同じ
      throw new NonRetryableJobException("malformed payload type=" + jobType.value(), ex);
    }
  }
}
