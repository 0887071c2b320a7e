package com.flamingo.ai.researchchat.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * Runs research pipelines. A full queue rejects new runs instead of growing without bound; the
   * caller turns that into a busy error on the stream.
   */
  @Bean(name = "generationExecutor")
  public Executor generationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("generation-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Fetches result pages concurrently. */
  @Bean(name = "scrapeExecutor")
  public Executor scrapeExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(3);
    executor.setMaxPoolSize(12);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("scrape-");
    executor.initialize();
    return executor;
  }
}
