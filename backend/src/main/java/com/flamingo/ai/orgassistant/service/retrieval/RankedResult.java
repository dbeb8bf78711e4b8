package com.flamingo.ai.orgassistant.service.retrieval;

import java.util.Map;

/**
 * A retrieval candidate after role-aware re-ranking.
 *
 * @param id chunk id
 * @param content chunk text
 * @param metadata chunk metadata
 * @param distance vector distance to the query
 * @param roleRelevanceScore length-normalized role relevance
 */
public record RankedResult(
    String id,
    String content,
    Map<String, Object> metadata,
    double distance,
    double roleRelevanceScore) {

  public double similarity() {
    return 1 - distance;
  }

  public double combinedScore() {
    return similarity() + roleRelevanceScore;
  }

  public String metadataString(String key) {
    Object value = metadata.get(key);
    return value == null ? "" : value.toString();
  }
}
