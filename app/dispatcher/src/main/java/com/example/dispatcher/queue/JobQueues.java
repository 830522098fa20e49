/*
 * どこで: ジョブキュー基盤
 * 何を: 論理キューごとのハンドルを起動時に 1 度だけ生成して保持する
 * なぜ: キュー 1 つにつきインスタンス 1 つを保証しつつ DI で受け渡すため
 */
package com.example.dispatcher.queue;

import com.example.dispatcher.config.JobQueueProperties;
import com.example.dispatcher.repository.QueueJobRepository;
import com.example.dispatcher.repository.RepeatingTriggerRepository;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class JobQueues {

  private final Map<QueueName, JobQueue> queues = new EnumMap<>(QueueName.class);

  public JobQueues(
      QueueJobRepository jobRepository,
      RepeatingTriggerRepository triggerRepository,
      JobPayloadCodec codec,
      JobQueueProperties properties,
      Clock clock) {
    for (QueueName name : QueueName.values()) {
      queues.put(
          name,
          new JobQueue(
              name, jobRepository, triggerRepository, codec, clock, properties.maxAttempts()));
    }
  }

  public JobQueue get(QueueName name) {
    return queues.get(name);
  }

  public JobQueue of(JobType jobType) {
    return get(jobType.queue());
  }
}
