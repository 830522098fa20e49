/*
 * Where: Dispatcher cleanup worker
 * What: Triggers queue history cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.dispatcher.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dispatch.retention.enabled", havingValue = "true")
public class JobRetentionWorker {

  private final JobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${dispatch.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
