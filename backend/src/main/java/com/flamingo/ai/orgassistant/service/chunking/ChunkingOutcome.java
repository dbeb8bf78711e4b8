package com.flamingo.ai.orgassistant.service.chunking;

/** Result classification of chunking one document. Only {@link #CHUNKED} yields spans. */
public enum ChunkingOutcome {
  CHUNKED,
  /** Cleaned content is below the configured minimum length. */
  CONTENT_TOO_SHORT,
  /** The splitter produced nothing for content of adequate length. */
  EMPTY_SPLIT
}
