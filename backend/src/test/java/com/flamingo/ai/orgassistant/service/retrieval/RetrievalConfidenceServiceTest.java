package com.flamingo.ai.orgassistant.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetrievalConfidenceService Tests")
class RetrievalConfidenceServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");

  private SimpleMeterRegistry meterRegistry;
  private RetrievalConfidenceService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new RetrievalConfidenceService(
            new RagConfig(), Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
  }

  private static List<RankedResult> results(int count, double distance, String updatedAt) {
    List<RankedResult> results = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      Map<String, Object> metadata =
          updatedAt == null ? Map.of() : Map.of(ChunkFields.UPDATED_AT, updatedAt);
      results.add(new RankedResult("c" + i, "text", metadata, distance, 0.0));
    }
    return results;
  }

  @Test
  @DisplayName("Should return exactly zero for no results")
  void shouldReturnZeroForEmpty() {
    assertThat(service.calculateConfidence(List.of())).isEqualTo(0.0);
    assertThat(meterRegistry.counter("rag.confidence.empty").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should equal average similarity with full evidence and no recent documents")
  void shouldUseAverageSimilarity() {
    double confidence = service.calculateConfidence(results(5, 0.4, "2023-01-01T00:00:00"));

    assertThat(confidence).isCloseTo(0.6, within(1e-9));
  }

  @Test
  @DisplayName("Should scale down sparse evidence")
  void shouldScaleSparseEvidence() {
    double confidence = service.calculateConfidence(results(2, 0.2, null));

    assertThat(confidence).isCloseTo(0.8 * 2 / 5, within(1e-9));
  }

  @Test
  @DisplayName("Should reward recently updated documents")
  void shouldApplyRecencyBonus() {
    double confidence = service.calculateConfidence(results(5, 0.5, "2024-06-20T08:00:00Z"));

    assertThat(confidence).isCloseTo(0.5 * 1.1, within(1e-9));
  }

  @Test
  @DisplayName("Should clamp confidence to one")
  void shouldClampToOne() {
    double confidence = service.calculateConfidence(results(8, 0.0, "2024-06-29T00:00:00"));

    assertThat(confidence).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should clamp confidence to zero for opposite vectors")
  void shouldClampToZero() {
    assertThat(service.calculateConfidence(results(5, 1.5, null))).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should parse offset and local timestamps and ignore garbage")
  void shouldParseTimestamps() {
    assertThat(RetrievalConfidenceService.parseTimestamp("2024-06-01T10:00:00+02:00"))
        .isEqualTo(Instant.parse("2024-06-01T08:00:00Z"));
    assertThat(RetrievalConfidenceService.parseTimestamp("2024-06-01T10:00:00"))
        .isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
    assertThat(RetrievalConfidenceService.parseTimestamp("yesterday")).isNull();
    assertThat(RetrievalConfidenceService.parseTimestamp("")).isNull();
  }
}
