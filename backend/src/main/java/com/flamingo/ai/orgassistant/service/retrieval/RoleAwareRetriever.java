package com.flamingo.ai.orgassistant.service.retrieval;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.service.embedding.EmbeddingProvider;
import com.flamingo.ai.orgassistant.store.ChunkStore;
import com.flamingo.ai.orgassistant.store.StoredChunkMatch;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves evidence for a question: over-fetches nearest chunks visible to the role, re-ranks them
 * by similarity plus role relevance and keeps the best ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleAwareRetriever {

  private final EmbeddingProvider embeddingProvider;
  private final ChunkStore chunkStore;
  private final RoleRelevanceScorer roleRelevanceScorer;
  private final RetrievalConfidenceService confidenceService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.retrieval", description = "Time to retrieve and rank evidence")
  public RetrievalResult retrieve(String query, UserRole role, Map<String, Object> filters) {
    RagConfig.Retrieval settings = ragConfig.getRetrieval();
    float[] queryEmbedding = embeddingProvider.embedOne(query);
    List<StoredChunkMatch> candidates =
        chunkStore.search(queryEmbedding, role.getValue(), settings.getOverFetch(), filters);

    List<RankedResult> ranked = rank(candidates, role);
    List<RankedResult> top =
        ranked.size() > settings.getTopK() ? ranked.subList(0, settings.getTopK()) : ranked;
    double confidence = confidenceService.calculateConfidence(top);

    meterRegistry.counter("rag.retrieval.requests", "role", role.getValue()).increment();
    log.info(
        "Retrieved {} candidates for role {}, kept {}, confidence {}",
        candidates.size(),
        role,
        top.size(),
        String.format("%.3f", confidence));
    return new RetrievalResult(query, role, top, confidence);
  }

  /**
   * Scores candidates for a role and orders them by combined score, best first. Equal scores keep
   * the closer chunk first.
   */
  public List<RankedResult> rank(List<StoredChunkMatch> candidates, UserRole role) {
    List<RankedResult> ranked = new ArrayList<>(candidates.size());
    for (StoredChunkMatch candidate : candidates) {
      double relevance =
          roleRelevanceScorer.score(candidate.content(), candidate.metadata(), role);
      ranked.add(
          new RankedResult(
              candidate.id(),
              candidate.content(),
              candidate.metadata(),
              candidate.distance(),
              relevance));
    }
    ranked.sort(
        Comparator.comparingDouble(RankedResult::combinedScore)
            .reversed()
            .thenComparingDouble(RankedResult::distance));
    return ranked;
  }
}
