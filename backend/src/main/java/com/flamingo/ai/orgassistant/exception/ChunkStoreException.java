package com.flamingo.ai.orgassistant.exception;

import com.flamingo.ai.orgassistant.domain.UserRole;

/** Exception thrown when a single partition of the chunk store fails a read or a write. */
public class ChunkStoreException extends RuntimeException {

  private final UserRole partition;

  public ChunkStoreException(UserRole partition, String message, Throwable cause) {
    super(message, cause);
    this.partition = partition;
  }

  public UserRole getPartition() {
    return partition;
  }
}
