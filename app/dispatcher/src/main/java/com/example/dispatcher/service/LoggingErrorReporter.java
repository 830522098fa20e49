/*
 * どこで: Dispatcher サービス層
 * 何を: 報告された失敗を error ログとメトリクスに残す
 * なぜ: 外部の監視 SaaS が無い環境でも失敗を集計できるようにするため
 */
package com.example.dispatcher.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LoggingErrorReporter implements ErrorReporter {

  private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

  private final DispatchMetrics metrics;

  @Override
  public void report(String context, Throwable error) {
    metrics.recordError(context);
    logger.error("error reported context={} message={}", context, error.getMessage(), error);
  }
}
