package com.flamingo.ai.orgassistant.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for ingestion and remote embedding calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor(RagConfig ragConfig) {
    int parallelism = ragConfig.getIngestion().getParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  // Core and max are equal so the pool never exceeds the remote concurrency cap
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(RagConfig ragConfig) {
    int maxConcurrency = ragConfig.getEmbedding().getRemote().getMaxConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxConcurrency);
    executor.setMaxPoolSize(maxConcurrency);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
