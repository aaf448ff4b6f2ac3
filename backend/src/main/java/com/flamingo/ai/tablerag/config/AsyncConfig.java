package com.flamingo.ai.tablerag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the worker pool that fans out table summarization requests. */
@Configuration
public class AsyncConfig {

  @Bean(name = "tableSummaryExecutor")
  public ThreadPoolTaskExecutor tableSummaryExecutor(RagConfig ragConfig) {
    return boundedExecutor(ragConfig.getSummarization().getConcurrency(), "table-vlm-");
  }

  /**
   * Builds an initialized pool that never runs more than {@code concurrency} tasks at once. Extra
   * submissions wait in the queue.
   */
  public static ThreadPoolTaskExecutor boundedExecutor(int concurrency, String threadNamePrefix) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
