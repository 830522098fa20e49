/*
 * Where: Dispatcher repeating job worker
 * What: Polls persistent triggers and fires the due ones
 */
package com.example.dispatcher.queue;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.queue.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RepeatingTriggerWorker {

  private static final Logger logger = LoggerFactory.getLogger(RepeatingTriggerWorker.class);

  private final RepeatingTriggerService triggerService;

  @Scheduled(fixedDelayString = "${dispatch.queue.trigger-poll-interval}")
  public void run() {
    try {
      triggerService.fireDueTriggers();
    } catch (RuntimeException ex) {
      logger.warn("repeating trigger poll failed", ex);
    }
  }
}
