package com.flamingo.ai.orgassistant.service.ingestion;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.service.chunking.ChunkingOutcome;
import java.util.List;

/**
 * A document turned into embedded chunks, ready to be written.
 *
 * @param documentId content-addressed id of this version
 * @param documentKey id shared by every version of the document; null when the document has no
 *     stable identity
 * @param chunks embedded chunks in document order; empty when skipped
 * @param outcome chunking outcome
 */
public record ProcessedDocument(
    String documentId, String documentKey, List<Chunk> chunks, ChunkingOutcome outcome) {

  public ProcessedDocument {
    chunks = List.copyOf(chunks);
  }

  public boolean isSkipped() {
    return outcome != ChunkingOutcome.CHUNKED || chunks.isEmpty();
  }
}
