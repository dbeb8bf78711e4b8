package com.flamingo.ai.orgassistant.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Audience role. Every role except {@link #GENERAL} names its own partition of the vector index;
 * {@link #GENERAL} is both a partition and the fallback for untagged content.
 */
public enum UserRole {
  DEVELOPER("developer"),
  SUPPORT("support"),
  MANAGER("manager"),
  GENERAL("general");

  private final String value;

  UserRole(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static Optional<UserRole> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.value.equalsIgnoreCase(value.trim())).findFirst();
  }

  @Override
  public String toString() {
    return value;
  }
}
