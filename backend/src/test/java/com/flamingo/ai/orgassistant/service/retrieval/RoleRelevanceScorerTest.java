package com.flamingo.ai.orgassistant.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RoleRelevanceScorer Tests")
class RoleRelevanceScorerTest {

  private RoleRelevanceScorer scorer;

  @BeforeEach
  void setUp() {
    scorer = new RoleRelevanceScorer(new RagConfig());
  }

  @Test
  @DisplayName("Should score one point per role keyword normalized by word count")
  void shouldScoreKeywordsPerWord() {
    double score = scorer.score("code review for the module", Map.of(), UserRole.DEVELOPER);

    assertThat(score).isCloseTo(0.2, within(1e-9));
  }

  @Test
  @DisplayName("Should count a keyword once however often it appears")
  void shouldCountKeywordPresenceOnce() {
    double score = scorer.score("error error error error", Map.of(), UserRole.SUPPORT);

    assertThat(score).isCloseTo(0.25, within(1e-9));
  }

  @Test
  @DisplayName("Should add role tag and content type weights")
  void shouldAddMetadataWeights() {
    Map<String, Object> metadata =
        Map.of(
            ChunkFields.ROLE_TAGS, List.of("developer"),
            ChunkFields.CONTENT_TYPE, "code_snippet");

    double score = scorer.score("plain words here now", metadata, UserRole.DEVELOPER);

    assertThat(score).isCloseTo((3.0 + 2.0) / 4, within(1e-9));
  }

  @Test
  @DisplayName("Should accept role tags stored as a string")
  void shouldAcceptStringRoleTags() {
    double score =
        scorer.score("one two", Map.of(ChunkFields.ROLE_TAGS, "support,manager"), UserRole.MANAGER);

    assertThat(score).isCloseTo(1.5, within(1e-9));
  }

  @Test
  @DisplayName("Should give general queries no keyword bonus")
  void shouldScoreZeroForGeneral() {
    assertThat(scorer.score("code api error team", Map.of(), UserRole.GENERAL)).isZero();
  }

  @Test
  @DisplayName("Should not divide by zero for empty content")
  void shouldHandleEmptyContent() {
    double score =
        scorer.score("", Map.of(ChunkFields.ROLE_TAGS, List.of("support")), UserRole.SUPPORT);

    assertThat(score).isEqualTo(3.0);
  }
}
