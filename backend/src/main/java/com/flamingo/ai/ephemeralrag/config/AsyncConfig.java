package com.flamingo.ai.ephemeralrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the thread pools that run work off the request threads. */
@Configuration
public class AsyncConfig {

  /** Runs embedding calls so that request threads can stop waiting on a timeout. */
  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("embed-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
