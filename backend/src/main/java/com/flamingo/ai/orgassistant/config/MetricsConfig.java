package com.flamingo.ai.orgassistant.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics and time. Every meter carries the application name and the active store and embedding
 * backends, so dashboards can compare deployments that differ only in backend choice.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> backendTags(
      @Value("${spring.application.name:org-assistant}") String application,
      RagConfig ragConfig) {
    return registry ->
        registry
            .config()
            .commonTags(
                "application",
                application,
                "store_backend",
                ragConfig.getStore().getBackend(),
                "embedding_provider",
                ragConfig.getEmbedding().getProvider());
  }

  /** Backs {@code @Timed} on ingestion, search and query entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Clock used for recency checks, job timestamps and processing times. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
