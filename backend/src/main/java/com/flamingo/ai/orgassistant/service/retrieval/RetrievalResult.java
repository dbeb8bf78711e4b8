package com.flamingo.ai.orgassistant.service.retrieval;

import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.List;

/** Ranked evidence for one question, handed to answer generation. */
public record RetrievalResult(
    String query, UserRole role, List<RankedResult> results, double confidence) {

  public RetrievalResult {
    results = List.copyOf(results);
  }

  public static RetrievalResult empty(String query, UserRole role) {
    return new RetrievalResult(query, role, List.of(), 0.0);
  }

  /** True when nothing was retrieved and an answer should not be attempted. */
  public boolean isInsufficient() {
    return results.isEmpty();
  }
}
