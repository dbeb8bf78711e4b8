package com.flamingo.ai.orgassistant.service.embedding;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.exception.EmbeddingBackendException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Embeds texts with an in-process model. A batch either succeeds as a whole or fails with {@link
 * EmbeddingBackendException}.
 */
@Service
@ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalEmbeddingProvider implements EmbeddingProvider {

  static final String NAME = "local";

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final int dimension;

  public LocalEmbeddingProvider(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.dimension = ragConfig.getEmbedding().getLocal().getDimensions();
  }

  @Override
  public List<float[]> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = new ArrayList<>(texts.size());
      for (String text : texts) {
        segments.add(TextSegment.from(text));
      }
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      if (embeddings.size() != texts.size()) {
        throw new EmbeddingBackendException(
            NAME,
            "Model returned " + embeddings.size() + " vectors for " + texts.size() + " texts");
      }

      List<float[]> vectors = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        float[] vector = embedding.vector();
        if (vector.length != dimension) {
          throw new EmbeddingBackendException(
              NAME, "Expected dimension " + dimension + " but model returned " + vector.length);
        }
        vectors.add(vector);
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedded {} texts locally", texts.size());
      return vectors;
    } catch (EmbeddingBackendException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingBackendException(NAME, "Local embedding failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
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
