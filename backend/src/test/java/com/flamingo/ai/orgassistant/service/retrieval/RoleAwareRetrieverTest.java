package com.flamingo.ai.orgassistant.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.service.embedding.EmbeddingProvider;
import com.flamingo.ai.orgassistant.store.ChunkStore;
import com.flamingo.ai.orgassistant.store.StoredChunkMatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoleAwareRetriever Tests")
class RoleAwareRetrieverTest {

  private static final float[] QUERY_VECTOR = {0.1f, 0.2f, 0.3f};

  @Mock private EmbeddingProvider embeddingProvider;
  @Mock private ChunkStore chunkStore;
  @Mock private RetrievalConfidenceService confidenceService;

  private SimpleMeterRegistry meterRegistry;
  private RoleAwareRetriever retriever;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    retriever =
        new RoleAwareRetriever(
            embeddingProvider,
            chunkStore,
            new RoleRelevanceScorer(ragConfig),
            confidenceService,
            ragConfig,
            meterRegistry);
  }

  private static StoredChunkMatch match(String id, String content, double distance) {
    return new StoredChunkMatch(id, content, Map.of(), distance, UserRole.GENERAL);
  }

  @Test
  @DisplayName("Should let role relevance outrank a closer chunk")
  void shouldRankByCombinedScore() {
    List<RankedResult> ranked =
        retriever.rank(
            List.of(
                match("a", "overview of quarterly figures", 0.4),
                match("b", "code review for the module", 0.5)),
            UserRole.DEVELOPER);

    assertThat(ranked).extracting(RankedResult::id).containsExactly("b", "a");
    assertThat(ranked.get(0).combinedScore()).isCloseTo(0.7, within(1e-9));
    assertThat(ranked.get(1).combinedScore()).isCloseTo(0.6, within(1e-9));
  }

  @Test
  @DisplayName("Should keep the closer chunk first on equal combined scores")
  void shouldBreakTiesByDistance() {
    List<RankedResult> ranked =
        retriever.rank(
            List.of(match("far", "team x y z", 0.5), match("near", "plain words", 0.25)),
            UserRole.MANAGER);

    assertThat(ranked.get(0).combinedScore()).isEqualTo(ranked.get(1).combinedScore());
    assertThat(ranked).extracting(RankedResult::id).containsExactly("near", "far");
  }

  @Test
  @DisplayName("Should over-fetch candidates and keep the top results")
  void shouldOverFetchAndTruncate() {
    List<StoredChunkMatch> candidates = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      candidates.add(match("c" + i, "plain text", i * 0.05));
    }
    Map<String, Object> filters = Map.of("source", "github");
    when(embeddingProvider.embedOne("how do I deploy")).thenReturn(QUERY_VECTOR);
    when(chunkStore.search(QUERY_VECTOR, "developer", 15, filters)).thenReturn(candidates);
    when(confidenceService.calculateConfidence(anyList())).thenReturn(0.75);

    RetrievalResult result = retriever.retrieve("how do I deploy", UserRole.DEVELOPER, filters);

    assertThat(result.results()).hasSize(8);
    assertThat(result.results().get(0).id()).isEqualTo("c0");
    assertThat(result.confidence()).isEqualTo(0.75);
    assertThat(result.role()).isEqualTo(UserRole.DEVELOPER);
    assertThat(result.isInsufficient()).isFalse();
    assertThat(meterRegistry.counter("rag.retrieval.requests", "role", "developer").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should report insufficient evidence when nothing is found")
  void shouldReturnInsufficientForNoCandidates() {
    when(embeddingProvider.embedOne(anyString())).thenReturn(QUERY_VECTOR);
    when(chunkStore.search(any(), eq("support"), eq(15), any())).thenReturn(List.of());
    when(confidenceService.calculateConfidence(List.of())).thenReturn(0.0);

    RetrievalResult result = retriever.retrieve("unknown topic", UserRole.SUPPORT, Map.of());

    assertThat(result.isInsufficient()).isTrue();
    assertThat(result.confidence()).isZero();
    verify(confidenceService).calculateConfidence(List.of());
  }
}
