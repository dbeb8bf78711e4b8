package com.flamingo.ai.orgassistant.service.embedding;

import java.util.List;

/**
 * Turns texts into fixed-length vectors. One implementation is active per application; every
 * vector it returns has length {@link #dimension()}.
 */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of texts.
   *
   * @param texts texts to embed
   * @return one vector per input, in input order
   */
  List<float[]> embedBatch(List<String> texts);

  default float[] embedOne(String text) {
    return embedBatch(List.of(text)).get(0);
  }

  int dimension();

  /** Short backend name used in logs and metrics. */
  String name();
}
