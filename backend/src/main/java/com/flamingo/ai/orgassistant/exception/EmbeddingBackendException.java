package com.flamingo.ai.orgassistant.exception;

/** Exception thrown when an embedding backend cannot produce vectors for a batch. */
public class EmbeddingBackendException extends RuntimeException {

  private final String provider;

  public EmbeddingBackendException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public EmbeddingBackendException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
