package com.flamingo.ai.contextlab.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
public class AsyncConfig {

  /** Thread name prefix of the auto-tagging pool; the blocking tagging path checks for it. */
  public static final String AUTO_TAGGING_THREAD_PREFIX = "auto-tag-";

  @Bean(name = "autoTaggingExecutor")
  public Executor autoTaggingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix(AUTO_TAGGING_THREAD_PREFIX);
    executor.initialize();
    return executor;
  }
}
