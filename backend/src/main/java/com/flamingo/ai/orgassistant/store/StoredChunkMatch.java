package com.flamingo.ai.orgassistant.store;

import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.Map;

/**
 * A chunk returned by a vector query.
 *
 * @param id chunk id
 * @param content chunk text
 * @param metadata chunk metadata as written
 * @param distance {@code 1 - cosineSimilarity} to the query; lower is closer
 * @param partition the partition the match came from
 */
public record StoredChunkMatch(
    String id, String content, Map<String, Object> metadata, double distance, UserRole partition) {

  public StoredChunkMatch {
    metadata = metadata == null ? Map.of() : metadata;
  }
}
