package com.scholary.radio.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for narration task execution.
 *
 * <p>Sets up a bounded thread pool for generating narrations off the playout thread. The pool size
 * and queue capacity are configurable; a batch that arrives while both are full is dropped.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "narrationExecutor")
  public Executor narrationExecutor(
      @Value("${narration.executor.threads}") int threads,
      @Value("${narration.executor.queueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("narration-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
