/*
 * どこで: ジョブキュー基盤
 * 何を: JobType からハンドラへの対応表を保持する
 * なぜ: ハンドラ欠落や重複を起動時に検出し、実行時の未知種別を無くすため
 */
package com.example.dispatcher.queue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JobHandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobHandlerRegistry.class);

  private final Map<JobType, JobHandler<?>> handlers = new EnumMap<>(JobType.class);

  public JobHandlerRegistry(List<JobHandler<?>> handlers) {
    for (JobHandler<?> handler : handlers) {
      register(handler);
    }
    for (JobType type : JobType.values()) {
      if (!this.handlers.containsKey(type)) {
        throw new IllegalStateException(
            "no handler registered queue=" + type.queue().value() + " type=" + type.value());
      }
    }
    logger.info("job handlers registered count={}", this.handlers.size());
  }

  private void register(JobHandler<?> handler) {
    if (handler.payloadType() != handler.jobType().payloadClass()) {
      throw new IllegalStateException(
          "handler payload mismatch type="
              + handler.jobType()
              + " expected="
              + handler.jobType().payloadClass().getSimpleName()
              + " actual="
              + handler.payloadType().getSimpleName());
    }
    JobHandler<?> previous = handlers.putIfAbsent(handler.jobType(), handler);
    if (previous != null) {
      throw new IllegalStateException(
          "duplicate handler type="
              + handler.jobType()
              + " existing="
              + previous.getClass().getName()
              + " new="
              + handler.getClass().getName());
    }
  }

  public void dispatch(JobPayload payload, JobContext context) {
    invoke(handlers.get(payload.jobType()), payload, context);
  }

  private static <P extends JobPayload> void invoke(
      JobHandler<P> handler, JobPayload payload, JobContext context) {
    handler.handle(handler.payloadType().cast(payload), context);
  }
}
