package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String traceId) {
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return newTraceId();
  }
}
