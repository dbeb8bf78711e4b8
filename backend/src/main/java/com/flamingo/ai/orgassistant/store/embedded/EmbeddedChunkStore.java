package com.flamingo.ai.orgassistant.store.embedded;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.exception.ChunkStoreException;
import com.flamingo.ai.orgassistant.service.embedding.EmbeddingProvider;
import com.flamingo.ai.orgassistant.store.AbstractChunkStore;
import com.flamingo.ai.orgassistant.store.PartitionResolver;
import com.flamingo.ai.orgassistant.store.StoredChunkMatch;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.logical.And;
import dev.langchain4j.store.embedding.filter.logical.Or;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Chunk store kept in process: one {@link InMemoryEmbeddingStore} per partition, persisted as one
 * JSON file per partition under {@code rag.store.embedded.path}.
 *
 * <p>Keyword fields are kept as segment metadata so filters run inside the vector query. A
 * multi-valued role tag list cannot be matched by equality, so each tag becomes its own {@code
 * role_<tag>} flag and a role tag filter is an {@code Or} of flag checks. The full chunk metadata
 * travels as a JSON string.
 */
@Service
@ConditionalOnProperty(name = "rag.store.backend", havingValue = "embedded", matchIfMissing = true)
@Slf4j
public class EmbeddedChunkStore extends AbstractChunkStore {

  static final String ROLE_FLAG_PREFIX = "role_";
  static final String METADATA_JSON = "metadata_json";
  static final String CHUNK_ID = "chunk_id";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final Path directory;
  private final int dimension;
  private final ObjectMapper objectMapper;
  private final Map<UserRole, InMemoryEmbeddingStore<TextSegment>> partitions =
      new EnumMap<>(UserRole.class);
  private final Map<UserRole, AtomicBoolean> dirty = new EnumMap<>(UserRole.class);

  public EmbeddedChunkStore(
      RagConfig ragConfig,
      EmbeddingProvider embeddingProvider,
      PartitionResolver partitionResolver,
      MeterRegistry meterRegistry,
      ObjectMapper objectMapper) {
    super(partitionResolver, meterRegistry);
    this.directory = Path.of(ragConfig.getStore().getEmbedded().getPath());
    this.dimension = embeddingProvider.dimension();
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public void load() {
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new IllegalStateException("Vector store path is not writable: " + directory, e);
    }
    if (!Files.isWritable(directory)) {
      throw new IllegalStateException("Vector store path is not writable: " + directory);
    }
    for (UserRole partition : UserRole.values()) {
      Path file = partitionFile(partition);
      InMemoryEmbeddingStore<TextSegment> store;
      if (Files.exists(file)) {
        store = InMemoryEmbeddingStore.fromFile(file);
        log.info("Loaded partition {} from {}", partition, file);
      } else {
        store = new InMemoryEmbeddingStore<>();
      }
      partitions.put(partition, store);
      dirty.put(partition, new AtomicBoolean(false));
    }
  }

  @Override
  protected void upsert(UserRole partition, Chunk chunk, Set<String> roleTags) {
    InMemoryEmbeddingStore<TextSegment> store = store(partition);
    TextSegment segment = TextSegment.from(chunk.getContent(), toSegmentMetadata(chunk, roleTags));
    synchronized (store) {
      store.removeAll(List.of(chunk.getId()));
      store.addAll(
          List.of(chunk.getId()), List.of(Embedding.from(chunk.getEmbedding())), List.of(segment));
    }
    dirty.get(partition).set(true);
  }

  @Override
  protected List<StoredChunkMatch> query(
      UserRole partition, float[] queryEmbedding, int limit, Map<String, List<String>> filters) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(queryEmbedding))
            .maxResults(limit)
            .minScore(0.0)
            .filter(toFilter(filters))
            .build();

    List<StoredChunkMatch> matches = new ArrayList<>();
    try {
      for (EmbeddingMatch<TextSegment> match : store(partition).search(request).matches()) {
        TextSegment segment = match.embedded();
        matches.add(
            new StoredChunkMatch(
                match.embeddingId(),
                segment.text(),
                fromSegmentMetadata(segment.metadata()),
                distanceFromRelevance(match.score()),
                partition));
      }
    } catch (RuntimeException e) {
      throw new ChunkStoreException(partition, "Query failed: " + e.getMessage(), e);
    }
    return matches;
  }

  @Override
  protected long count(UserRole partition) {
    float[] allOnes = new float[dimension];
    Arrays.fill(allOnes, 1.0f);
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(allOnes))
            .maxResults(Integer.MAX_VALUE)
            .minScore(0.0)
            .build();
    return store(partition).search(request).matches().size();
  }

  @Override
  protected void deleteStaleChunks(
      UserRole partition, String documentKey, String currentSourceDocumentId) {
    Filter stale =
        new And(
            metadataKey(ChunkFields.DOCUMENT_KEY).isEqualTo(documentKey),
            metadataKey(ChunkFields.SOURCE_DOCUMENT_ID).isNotEqualTo(currentSourceDocumentId));
    store(partition).removeAll(stale);
    dirty.get(partition).set(true);
  }

  @Override
  protected void clear(UserRole partition) {
    store(partition).removeAll();
    dirty.get(partition).set(true);
    flushPartition(partition);
  }

  @Override
  public void flush() {
    for (UserRole partition : UserRole.values()) {
      if (dirty.get(partition).get()) {
        flushPartition(partition);
      }
    }
  }

  private void flushPartition(UserRole partition) {
    Path file = partitionFile(partition);
    try {
      dirty.get(partition).set(false);
      store(partition).serializeToFile(file);
      log.debug("Persisted partition {} to {}", partition, file);
    } catch (RuntimeException e) {
      dirty.get(partition).set(true);
      throw new ChunkStoreException(partition, "Failed to persist partition to " + file, e);
    }
  }

  private InMemoryEmbeddingStore<TextSegment> store(UserRole partition) {
    InMemoryEmbeddingStore<TextSegment> store = partitions.get(partition);
    if (store == null) {
      throw new ChunkStoreException(partition, "Partition is not loaded", null);
    }
    return store;
  }

  @VisibleForTesting
  Path partitionFile(UserRole partition) {
    return directory.resolve(partition.getValue() + ".json");
  }

  private Metadata toSegmentMetadata(Chunk chunk, Set<String> roleTags) {
    Map<String, Object> chunkMetadata =
        chunk.getMetadata() == null ? Map.of() : chunk.getMetadata();
    Metadata metadata = new Metadata();
    metadata.put(CHUNK_ID, chunk.getId());
    metadata.put(ChunkFields.SOURCE_DOCUMENT_ID, nullToEmpty(chunk.getSourceDocumentId()));
    metadata.put(ChunkFields.DOCUMENT_KEY, nullToEmpty(chunk.getDocumentKey()));
    metadata.put(ChunkFields.CHUNK_INDEX, chunk.getChunkIndex());
    metadata.put(ChunkFields.TOTAL_CHUNKS, chunk.getTotalChunks());
    for (String field :
        List.of(ChunkFields.SOURCE, ChunkFields.DOC_TYPE, ChunkFields.CONTENT_TYPE)) {
      Object value = chunkMetadata.get(field);
      metadata.put(field, value == null ? "" : value.toString());
    }
    for (String tag : roleTags) {
      metadata.put(ROLE_FLAG_PREFIX + tag, "true");
    }

    Map<String, Object> full = new LinkedHashMap<>(chunkMetadata);
    full.put(ChunkFields.ROLE_TAGS, new ArrayList<>(roleTags));
    full.put(ChunkFields.SOURCE_DOCUMENT_ID, chunk.getSourceDocumentId());
    full.put(ChunkFields.DOCUMENT_KEY, chunk.getDocumentKey());
    try {
      metadata.put(METADATA_JSON, objectMapper.writeValueAsString(full));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Chunk " + chunk.getId() + " has metadata that cannot be serialized", e);
    }
    return metadata;
  }

  private Map<String, Object> fromSegmentMetadata(Metadata metadata) {
    String json = metadata.getString(METADATA_JSON);
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.warn(
          "Stored metadata of chunk {} is unreadable: {}",
          metadata.getString(CHUNK_ID),
          e.getMessage());
      return Map.of();
    }
  }

  @VisibleForTesting
  static Filter toFilter(Map<String, List<String>> filters) {
    Filter combined = null;
    for (Map.Entry<String, List<String>> entry : filters.entrySet()) {
      Filter filter = fieldFilter(entry.getKey(), entry.getValue());
      combined = combined == null ? filter : new And(combined, filter);
    }
    return combined;
  }

  private static Filter fieldFilter(String field, List<String> values) {
    if (ChunkFields.ROLE_TAGS.equals(field)) {
      Filter anyTag = null;
      for (String value : values) {
        Filter flag = metadataKey(ROLE_FLAG_PREFIX + value).isEqualTo("true");
        anyTag = anyTag == null ? flag : new Or(anyTag, flag);
      }
      return anyTag;
    }
    if (values.size() == 1) {
      return metadataKey(field).isEqualTo(values.get(0));
    }
    return metadataKey(field).isIn(values);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
