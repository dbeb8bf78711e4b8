package com.flamingo.ai.orgassistant.service.chunking;

import java.util.List;

/**
 * Outcome of chunking a document.
 *
 * @param outcome what happened
 * @param spans ordered text spans; empty unless {@code outcome} is {@link ChunkingOutcome#CHUNKED}
 * @param language the splitter that was used, null when the content was too short
 */
public record ChunkingResult(ChunkingOutcome outcome, List<String> spans, SplitterLanguage language) {

  public ChunkingResult {
    spans = spans == null ? List.of() : List.copyOf(spans);
  }

  public static ChunkingResult tooShort() {
    return new ChunkingResult(ChunkingOutcome.CONTENT_TOO_SHORT, List.of(), null);
  }

  public boolean hasSpans() {
    return outcome == ChunkingOutcome.CHUNKED && !spans.isEmpty();
  }
}
