package com.flamingo.ai.orgassistant.domain;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A contiguous, embedded span of a document's content: the unit of storage and retrieval.
 *
 * <p>Chunks are created once per document version and never mutated. {@code chunkIndex} is
 * 0-based and always below {@code totalChunks}.
 */
@Value
@Builder
public class Chunk {

  String id;
  String content;
  float[] embedding;
  String sourceDocumentId;

  /** Content-independent identity of the parent document, shared by all of its versions. */
  String documentKey;

  int chunkIndex;
  int totalChunks;
  Map<String, Object> metadata;

  public static String chunkId(String sourceDocumentId, int chunkIndex) {
    return sourceDocumentId + "_chunk_" + chunkIndex;
  }
}
