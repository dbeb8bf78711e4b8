package com.flamingo.ai.orgassistant.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A raw unit of organizational knowledge handed over by a source collector.
 *
 * <p>Documents are never stored directly; only the chunks derived from them are indexed.
 */
@Value
@Builder(toBuilder = true)
public class Document {

  String content;
  DocumentSource source;

  /** Free-form classification, e.g. documentation, configuration, code, issue. */
  String docType;

  @Singular Set<String> roleTags;

  /** Open key-value metadata: repository, file_path, page_id, issue_key, labels, url, ... */
  @Singular("metadataEntry")
  Map<String, Object> metadata;

  Instant createdAt;
  Instant updatedAt;

  /**
   * Returns a metadata value as a string, or an empty string when absent.
   *
   * @param key metadata key
   * @return the value's string form, never null
   */
  public String metadataString(String key) {
    Object value = metadata.get(key);
    return value == null ? "" : value.toString();
  }
}
