package com.flamingo.ai.orgassistant.service.retrieval;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Estimates how much an answer built from the retrieved chunks can be trusted.
 *
 * <p>The score is the average similarity, scaled down when fewer than {@code full-evidence-count}
 * chunks were found and nudged up by the share of recently updated chunks, clamped to [0, 1].
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalConfidenceService {

  private final RagConfig ragConfig;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  /**
   * Calculates the confidence of a result set.
   *
   * @param results ranked results, possibly empty
   * @return confidence in [0, 1]; exactly 0.0 for no results
   */
  public double calculateConfidence(List<RankedResult> results) {
    if (results.isEmpty()) {
      meterRegistry.counter("rag.confidence.empty").increment();
      return 0.0;
    }
    RagConfig.Retrieval settings = ragConfig.getRetrieval();

    double averageSimilarity =
        results.stream().mapToDouble(RankedResult::similarity).average().orElse(0.0);
    double evidenceFactor =
        Math.min((double) results.size() / settings.getFullEvidenceCount(), 1.0);

    Instant now = clock.instant();
    Duration window = Duration.ofDays(settings.getRecencyWindowDays());
    long recent = results.stream().filter(r -> isRecent(r, now, window)).count();
    double recencyFactor = 1.0 + ((double) recent / results.size()) * settings.getRecencyBonus();

    double confidence = averageSimilarity * evidenceFactor * recencyFactor;
    double clamped = Math.max(0.0, Math.min(confidence, 1.0));
    log.debug(
        "Confidence {} - avgSimilarity={}, evidence={}, recency={}",
        String.format("%.3f", clamped),
        String.format("%.3f", averageSimilarity),
        String.format("%.3f", evidenceFactor),
        String.format("%.3f", recencyFactor));
    return clamped;
  }

  private boolean isRecent(RankedResult result, Instant now, Duration window) {
    Instant updatedAt = parseTimestamp(result.metadataString(ChunkFields.UPDATED_AT));
    return updatedAt != null && Duration.between(updatedAt, now).compareTo(window) < 0;
  }

  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException nested) {
        log.debug("Ignoring unparseable timestamp '{}'", value);
        return null;
      }
    }
  }
}
