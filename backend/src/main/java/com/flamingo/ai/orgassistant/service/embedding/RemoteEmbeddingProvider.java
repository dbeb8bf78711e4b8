package com.flamingo.ai.orgassistant.service.embedding;

import com.flamingo.ai.orgassistant.config.RagConfig;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Embeds texts through a remote embedding API, one call per text on a bounded pool.
 *
 * <p>Each call goes through the {@code embedding} circuit breaker and is retried by the {@code
 * embedding} retry. While the breaker is open no call reaches the API. A text that still fails, or
 * comes back with the wrong dimension, is replaced by a zero vector so the batch always completes
 * in input order. Zero vectors match nothing meaningfully and are counted as {@code
 * embedding.degraded}.
 */
@Service
@ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "remote")
@Slf4j
public class RemoteEmbeddingProvider implements EmbeddingProvider {

  static final String NAME = "remote";
  static final String RETRY_NAME = "embedding";
  static final String CIRCUIT_BREAKER_NAME = "embedding";

  private final EmbeddingModel embeddingModel;
  private final Executor embeddingExecutor;
  private final Retry retry;
  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;
  private final int dimension;
  private final int maxChars;

  public RemoteEmbeddingProvider(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      RetryRegistry retryRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MeterRegistry meterRegistry,
      RagConfig ragConfig) {
    this.embeddingModel = embeddingModel;
    this.embeddingExecutor = embeddingExecutor;
    this.retry = retryRegistry.retry(RETRY_NAME);
    this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    this.meterRegistry = meterRegistry;
    this.dimension = ragConfig.getEmbedding().getRemote().getDimensions();
    this.maxChars = ragConfig.getEmbedding().getRemote().getMaxChars();
  }

  @Override
  public List<float[]> embedBatch(List<String> texts) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<CompletableFuture<float[]>> futures = new ArrayList<>(texts.size());
      for (int i = 0; i < texts.size(); i++) {
        int index = i;
        String text = texts.get(i);
        futures.add(
            CompletableFuture.supplyAsync(() -> embedWithRetry(index, text), embeddingExecutor)
                .exceptionally(e -> degrade(index, e)));
      }

      List<float[]> vectors = new ArrayList<>(futures.size());
      for (CompletableFuture<float[]> future : futures) {
        vectors.add(future.join());
      }
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private float[] embedWithRetry(int index, String text) {
    String input = text;
    if (input.length() > maxChars) {
      log.warn(
          "Text {} too long for embedding, truncating from {} chars to {} chars",
          index,
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }
    String request = input;
    Supplier<float[]> guarded =
        CircuitBreaker.decorateSupplier(
            circuitBreaker, () -> embeddingModel.embed(request).content().vector());
    Supplier<float[]> call = Retry.decorateSupplier(retry, guarded);
    float[] vector = call.get();
    if (vector.length != dimension) {
      throw new IllegalStateException(
          "Expected dimension " + dimension + " but remote model returned " + vector.length);
    }
    meterRegistry.counter("embedding.requests.success").increment();
    return vector;
  }

  private float[] degrade(int index, Throwable error) {
    Throwable cause = error.getCause() != null ? error.getCause() : error;
    log.error(
        "Embedding of text {} failed, substituting zero vector: {}", index, cause.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    meterRegistry.counter("embedding.degraded").increment();
    return new float[dimension];
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public String name() {
    return NAME;
  }
}
