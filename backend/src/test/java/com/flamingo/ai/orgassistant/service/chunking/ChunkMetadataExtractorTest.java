package com.flamingo.ai.orgassistant.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import java.util.List;
import java.util.Map;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkMetadataExtractor Tests")
class ChunkMetadataExtractorTest {

  private final ChunkMetadataExtractor extractor = new ChunkMetadataExtractor(new RagConfig());

  @Nested
  @DisplayName("classify")
  class Classify {

    @Test
    @DisplayName("Should recognize code by case-sensitive signals")
    void shouldRecognizeCode() {
      assertThat(extractor.classify("def handler(event):\n    return 1", "code"))
          .isEqualTo("code_snippet");
      assertThat(extractor.classify("A CLASS OF PROBLEMS WE FIX", "issue"))
          .isEqualTo("troubleshooting");
    }

    @Test
    @DisplayName("Should apply rules in order")
    void shouldApplyRulesInOrder() {
      assertThat(extractor.classify("Set the ENV variable before start", "documentation"))
          .isEqualTo("configuration");
      assertThat(extractor.classify("Call the endpoint with curl", "documentation"))
          .isEqualTo("api_documentation");
      assertThat(extractor.classify("Install the agent on each host", "documentation"))
          .isEqualTo("setup_instructions");
    }

    @Test
    @DisplayName("Should fall back to the document type, then to general")
    void shouldFallBack() {
      assertThat(extractor.classify("Quarterly goals for the team", "planning"))
          .isEqualTo("planning");
      assertThat(extractor.classify("Quarterly goals for the team", null)).isEqualTo("general");
    }
  }

  @Test
  @DisplayName("Should score complexity from terms, code, length and sentences")
  void shouldScoreComplexity() {
    assertThat(extractor.complexity("Plain words only")).isZero();
    assertThat(extractor.complexity("The api configuration")).isCloseTo(0.2, within());
    String dense =
        "api configuration deployment architecture. ```code```. "
            + "One. Two. Three. Four. Five. Six. "
            + "x".repeat(800);
    assertThat(extractor.complexity(dense)).isCloseTo(1.0, within());
  }

  @Test
  @DisplayName("Should collect technical and capitalized keywords, at most ten")
  void shouldExtractKeywords() {
    List<String> keywords =
        extractor.keywords(
            "Deploy the api behind the cache. Kubernetes runs Docker images for Alice and Bob"
                + " with Redis, Kafka and Postgres.");

    assertThat(keywords).hasSizeLessThanOrEqualTo(10).doesNotHaveDuplicates();
    assertThat(keywords).contains("api", "cache", "deploy");
  }

  @Test
  @DisplayName("Should summarize with the first sentence or the leading characters")
  void shouldSummarize() {
    assertThat(extractor.summary("The deployment pipeline publishes artifacts nightly. Then more."))
        .isEqualTo("The deployment pipeline publishes artifacts nightly.");
    assertThat(extractor.summary("Short. Then a much longer second sentence follows."))
        .isEqualTo("Short. Then a much longer second sentence follows.");
    assertThat(extractor.summary("Tiny." + "y".repeat(200))).endsWith("...").hasSize(103);
  }

  @Test
  @DisplayName("Should populate every chunk level field")
  void shouldPopulateAllFields() {
    Map<String, Object> metadata =
        extractor.extract("See https://wiki.example.com/runbook for the fix.", "documentation");

    assertThat(metadata)
        .containsEntry(ChunkFields.HAS_URLS, true)
        .containsEntry(ChunkFields.HAS_CODE, false)
        .containsEntry(ChunkFields.CONTENT_TYPE, "troubleshooting")
        .containsKeys(
            ChunkFields.TOKEN_COUNT,
            ChunkFields.CHAR_COUNT,
            ChunkFields.COMPLEXITY_SCORE,
            ChunkFields.KEYWORDS,
            ChunkFields.SUMMARY);
  }

  private static Offset<Double> within() {
    return Offset.offset(1e-9);
  }
}
