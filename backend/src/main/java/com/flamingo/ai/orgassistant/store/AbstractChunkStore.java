package com.flamingo.ai.orgassistant.store;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.UserRole;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for chunk store backends.
 *
 * <p>Implements partition fan-out for writes, fan-in and merge for reads, and per-partition
 * failure containment: a partition that throws is logged, counted and skipped. Subclasses only
 * implement the single-partition primitives.
 */
@Slf4j
public abstract class AbstractChunkStore implements ChunkStore {

  protected final PartitionResolver partitionResolver;
  protected final MeterRegistry meterRegistry;

  protected AbstractChunkStore(PartitionResolver partitionResolver, MeterRegistry meterRegistry) {
    this.partitionResolver = partitionResolver;
    this.meterRegistry = meterRegistry;
  }

  /** Inserts the chunk into one partition, replacing any chunk with the same id. */
  protected abstract void upsert(UserRole partition, Chunk chunk, Set<String> roleTags);

  /**
   * Filtered nearest-neighbour query against one partition.
   *
   * @param filters normalized filters: field name to accepted values, never empty lists
   */
  protected abstract List<StoredChunkMatch> query(
      UserRole partition, float[] queryEmbedding, int limit, Map<String, List<String>> filters);

  protected abstract long count(UserRole partition);

  /** Deletes chunks with the given document key but another source document id. */
  protected abstract void deleteStaleChunks(
      UserRole partition, String documentKey, String currentSourceDocumentId);

  protected abstract void clear(UserRole partition);

  @Override
  @Timed(value = "chunk_store.write", description = "Time to write a chunk to its partitions")
  public Set<UserRole> write(Chunk chunk, Collection<String> roleTags) {
    Set<String> tags = normalizeTags(roleTags);
    Set<UserRole> written = EnumSet.noneOf(UserRole.class);
    for (UserRole partition : partitionResolver.writePartitions(tags)) {
      try {
        upsert(partition, chunk, tags);
        written.add(partition);
      } catch (RuntimeException e) {
        log.error(
            "Failed to write chunk {} to partition {}: {}",
            chunk.getId(),
            partition,
            e.getMessage(),
            e);
        meterRegistry.counter("chunk_store.write.errors").increment();
      }
    }
    return written;
  }

  @Override
  @Timed(value = "chunk_store.search", description = "Time for a fan-in vector search")
  public List<StoredChunkMatch> search(
      float[] queryEmbedding, String role, int limit, Map<String, Object> filters) {
    Map<String, List<String>> normalized = normalizeFilters(filters);
    if (limit <= 0 || normalized.values().stream().anyMatch(List::isEmpty)) {
      return List.of();
    }

    List<StoredChunkMatch> merged = new ArrayList<>();
    for (UserRole partition : partitionResolver.readPartitions(role)) {
      try {
        merged.addAll(query(partition, queryEmbedding, limit, normalized));
      } catch (RuntimeException e) {
        log.error("Query of partition {} failed: {}", partition, e.getMessage(), e);
        meterRegistry.counter("chunk_store.query.errors").increment();
      }
    }
    merged.sort(Comparator.comparingDouble(StoredChunkMatch::distance));
    List<StoredChunkMatch> results =
        merged.size() > limit ? new ArrayList<>(merged.subList(0, limit)) : merged;
    log.debug(
        "Search for role '{}' returned {} of {} merged matches",
        role,
        results.size(),
        merged.size());
    return results;
  }

  @Override
  public Map<String, Long> stats() {
    Map<String, Long> stats = new LinkedHashMap<>();
    for (UserRole partition : UserRole.values()) {
      long count = 0;
      try {
        count = count(partition);
      } catch (RuntimeException e) {
        log.error("Failed to count partition {}: {}", partition, e.getMessage(), e);
        meterRegistry.counter("chunk_store.query.errors").increment();
      }
      stats.put(partition.getValue(), count);
    }
    return stats;
  }

  @Override
  public void deleteStale(String documentKey, String currentSourceDocumentId) {
    for (UserRole partition : UserRole.values()) {
      try {
        deleteStaleChunks(partition, documentKey, currentSourceDocumentId);
      } catch (RuntimeException e) {
        log.error(
            "Failed to delete stale chunks of {} from partition {}: {}",
            documentKey,
            partition,
            e.getMessage(),
            e);
        meterRegistry.counter("chunk_store.write.errors").increment();
      }
    }
  }

  @Override
  public void clearPartition(UserRole partition) {
    clear(partition);
    log.info("Cleared partition {}", partition);
  }

  /**
   * Validates filter keys and turns every value into a list of accepted strings. Role tag values
   * are trimmed and lower-cased the same way tags are on write.
   *
   * @throws IllegalArgumentException for a key outside {@link ChunkFields#FILTERABLE}
   */
  protected static Map<String, List<String>> normalizeFilters(Map<String, Object> filters) {
    if (filters == null || filters.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : filters.entrySet()) {
      if (!ChunkFields.FILTERABLE.contains(entry.getKey())) {
        throw new IllegalArgumentException(
            "Unsupported filter field '"
                + entry.getKey()
                + "', expected one of "
                + ChunkFields.FILTERABLE);
      }
      boolean roleTags = ChunkFields.ROLE_TAGS.equals(entry.getKey());
      List<String> values = new ArrayList<>();
      if (entry.getValue() instanceof Collection<?> collection) {
        for (Object value : collection) {
          values.add(filterValue(value, roleTags));
        }
      } else {
        values.add(filterValue(entry.getValue(), roleTags));
      }
      normalized.put(entry.getKey(), values);
    }
    return normalized;
  }

  private static String filterValue(Object value, boolean roleTag) {
    String text = String.valueOf(value);
    return roleTag ? text.trim().toLowerCase(Locale.ROOT) : text;
  }

  private static Set<String> normalizeTags(Collection<String> roleTags) {
    Set<String> tags = new LinkedHashSet<>();
    if (roleTags != null) {
      for (String tag : roleTags) {
        if (tag != null && !tag.isBlank()) {
          tags.add(tag.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    return tags;
  }

  /** Converts a cosine relevance score in [0, 1], as {@code (1 + cos) / 2}, to a distance. */
  protected static double distanceFromRelevance(double relevance) {
    double cosine = 2 * relevance - 1;
    return 1 - cosine;
  }
}
