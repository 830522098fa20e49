/*
 * どこで: Dispatcher アプリのワーカー設定
 * 何を: ジョブ実行用スレッドプールと送信系ジョブ共有のレートリミッターを定義する
 * なぜ: ポーリングスレッドを送信 IO で塞がず、プロバイダ制約を全送信経路で共有するため
 */
package com.example.dispatcher.config;

import com.example.dispatcher.queue.QueueName;
import com.example.dispatcher.queue.WindowRateLimiter;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class JobWorkerConfig {

  private static final Logger logger = LoggerFactory.getLogger(JobWorkerConfig.class);

  @Bean(name = "jobExecutor")
  public ThreadPoolTaskExecutor jobExecutor(JobQueueProperties properties) {
    // キューごとの同時実行上限の合計をプールサイズにする
    final int poolSize = Math.max(1, properties.concurrency()) * QueueName.values().length;
    logger.info("initializing job executor poolSize={}", poolSize);
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(poolSize);
    executor.setThreadNamePrefix("job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean
  public WindowRateLimiter sendRateLimiter(JobQueueProperties properties, Clock clock) {
    return new WindowRateLimiter(
        properties.sendLimiterMax(), properties.sendLimiterDuration(), clock);
  }
}
