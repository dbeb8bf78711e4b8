package com.flamingo.ai.orgassistant.service.query;

import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.service.retrieval.RankedResult;
import java.util.Map;

/**
 * Where a piece of evidence came from, as shown next to an answer. Optional fields are null when
 * the chunk has no such metadata.
 */
public record SourceAttribution(
    String type,
    String contentType,
    double similarity,
    String title,
    String repository,
    String filePath,
    String url,
    String lastUpdated) {

  public static SourceAttribution from(RankedResult result) {
    Map<String, Object> metadata = result.metadata();
    String title = text(metadata, "title");
    if (title == null) {
      title = text(metadata, "file_path");
    }
    String type = text(metadata, ChunkFields.SOURCE);
    String contentType = text(metadata, ChunkFields.CONTENT_TYPE);
    return new SourceAttribution(
        type == null ? "unknown" : type,
        contentType == null ? "general" : contentType,
        result.similarity(),
        title == null ? "Unknown" : title,
        text(metadata, "repository"),
        text(metadata, "file_path"),
        text(metadata, "url"),
        text(metadata, ChunkFields.UPDATED_AT));
  }

  private static String text(Map<String, Object> metadata, String key) {
    Object value = metadata.get(key);
    if (value == null || value.toString().isBlank()) {
      return null;
    }
    return value.toString();
  }
}
