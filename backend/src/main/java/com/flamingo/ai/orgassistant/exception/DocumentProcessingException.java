package com.flamingo.ai.orgassistant.exception;

/** Exception thrown when processing a single document fails. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentId;

  public DocumentProcessingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public DocumentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
