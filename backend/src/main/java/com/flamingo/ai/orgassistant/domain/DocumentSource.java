package com.flamingo.ai.orgassistant.domain;

import java.util.Arrays;
import java.util.Optional;

/** Origin system of an ingested document. */
public enum DocumentSource {
  GITHUB("github"),
  CONFLUENCE("confluence"),
  JIRA("jira");

  private final String value;

  DocumentSource(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a source from its wire value, case-insensitively.
   *
   * @param value wire value such as {@code github}
   * @return the matching source, or empty when unknown
   */
  public static Optional<DocumentSource> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(value.trim())).findFirst();
  }

  @Override
  public String toString() {
    return value;
  }
}
