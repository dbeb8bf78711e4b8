package com.flamingo.ai.orgassistant.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
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
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Chunk store backed by an Elasticsearch cluster with one index per partition, named {@code
 * <prefix>-<role>}. Search uses approximate kNN over an HNSW graph with the filters applied inside
 * the kNN clause.
 *
 * <p>Cosine similarity is undefined for a zero vector, so chunks with a degraded embedding are
 * indexed without one and rank at distance 1.0, the distance of an orthogonal vector. They fill
 * up a result list that kNN left short, and a zero query vector matches every chunk at that
 * distance. Every cluster call goes through the {@code elasticsearch} circuit breaker.
 */
@Service
@ConditionalOnProperty(name = "rag.store.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchChunkStore extends AbstractChunkStore {

  static final String CIRCUIT_BREAKER_NAME = "elasticsearch";
  static final double UNEMBEDDED_DISTANCE = 1.0;

  private final ElasticsearchClient elasticsearchClient;
  private final ChunkIndexDefinition indexDefinition;
  private final CircuitBreaker circuitBreaker;
  private final String indexPrefix;
  private final int numCandidatesMultiplier;

  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      RagConfig ragConfig,
      EmbeddingProvider embeddingProvider,
      PartitionResolver partitionResolver,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MeterRegistry meterRegistry) {
    super(partitionResolver, meterRegistry);
    RagConfig.Store.Elasticsearch settings = ragConfig.getStore().getElasticsearch();
    this.elasticsearchClient = elasticsearchClient;
    this.indexDefinition =
        new ChunkIndexDefinition(elasticsearchClient, settings, embeddingProvider.dimension());
    this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    this.indexPrefix = settings.getIndexPrefix();
    this.numCandidatesMultiplier = settings.getNumCandidatesMultiplier();
  }

  @PostConstruct
  public void initIndices() {
    for (UserRole partition : UserRole.values()) {
      indexDefinition.ensureIndex(indexName(partition));
    }
  }

  @VisibleForTesting
  String indexName(UserRole partition) {
    return indexPrefix + "-" + partition.getValue();
  }

  @Override
  protected void upsert(UserRole partition, Chunk chunk, Set<String> roleTags) {
    String indexName = indexName(partition);
    ChunkDocument document = ChunkDocument.from(chunk, roleTags);
    if (document.getEmbedding() == null) {
      log.debug("Chunk {} has a zero embedding, indexing it without a vector", chunk.getId());
      meterRegistry.counter("chunk_store.indexed.unembedded").increment();
    }
    guarded(
        partition,
        "Indexing chunk " + chunk.getId(),
        () ->
            elasticsearchClient.index(
                i -> i.index(indexName).id(chunk.getId()).document(document)));
    meterRegistry.counter("chunk_store.indexed").increment();
  }

  @Override
  protected List<StoredChunkMatch> query(
      UserRole partition, float[] queryEmbedding, int limit, Map<String, List<String>> filters) {
    List<Query> filterQueries = toFilterQueries(filters);
    List<StoredChunkMatch> matches = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    boolean zeroQuery = ChunkDocument.isZero(queryEmbedding);
    if (!zeroQuery) {
      for (Hit<ChunkDocument> hit : knnSearch(partition, queryEmbedding, limit, filterQueries)) {
        if (hit.source() != null && hit.score() != null && seen.add(hit.id())) {
          matches.add(toMatch(hit, distanceFromRelevance(hit.score()), partition));
        }
      }
    }
    if (matches.size() < limit) {
      for (Hit<ChunkDocument> hit :
          filteredSearch(partition, limit - matches.size(), filterQueries, !zeroQuery)) {
        if (hit.source() != null && seen.add(hit.id())) {
          matches.add(toMatch(hit, UNEMBEDDED_DISTANCE, partition));
        }
      }
    }
    log.debug("Search on {} returned {} hits", indexName(partition), matches.size());
    return matches;
  }

  private List<Hit<ChunkDocument>> knnSearch(
      UserRole partition, float[] queryEmbedding, int limit, List<Query> filterQueries) {
    List<Float> vector = ChunkDocument.toList(queryEmbedding);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName(partition))
                    .knn(
                        k ->
                            k.field(ChunkIndexDefinition.EMBEDDING)
                                .queryVector(vector)
                                .k(limit)
                                .numCandidates(limit * numCandidatesMultiplier)
                                .filter(filterQueries))
                    .source(src -> src.filter(f -> f.excludes(ChunkIndexDefinition.EMBEDDING)))
                    .size(limit));
    SearchResponse<ChunkDocument> response =
        guarded(
            partition,
            "Vector search",
            () -> elasticsearchClient.search(request, ChunkDocument.class));
    return response.hits().hits();
  }

  /**
   * Filter-only search used when kNN cannot rank: for a zero query vector, or to find chunks
   * stored without a vector.
   */
  private List<Hit<ChunkDocument>> filteredSearch(
      UserRole partition, int size, List<Query> filterQueries, boolean onlyUnembedded) {
    Query query =
        Query.of(
            q ->
                q.bool(
                    b -> {
                      b.filter(filterQueries);
                      if (onlyUnembedded) {
                        b.mustNot(m -> m.exists(e -> e.field(ChunkIndexDefinition.EMBEDDING)));
                      }
                      return b;
                    }));
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName(partition))
                    .query(query)
                    .source(src -> src.filter(f -> f.excludes(ChunkIndexDefinition.EMBEDDING)))
                    .size(size));
    SearchResponse<ChunkDocument> response =
        guarded(
            partition,
            "Filtered search",
            () -> elasticsearchClient.search(request, ChunkDocument.class));
    return response.hits().hits();
  }

  private static StoredChunkMatch toMatch(
      Hit<ChunkDocument> hit, double distance, UserRole partition) {
    ChunkDocument source = hit.source();
    return new StoredChunkMatch(
        hit.id(),
        source.getContent() == null ? "" : source.getContent(),
        source.getMetadata() == null ? Map.of() : source.getMetadata(),
        distance,
        partition);
  }

  @Override
  protected long count(UserRole partition) {
    return guarded(
        partition,
        "Count",
        () -> elasticsearchClient.count(c -> c.index(indexName(partition))).count());
  }
  @Override
  protected void deleteStaleChunks(
      UserRole partition, String documentKey, String currentSourceDocumentId) {
    Query stale =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(
                                f ->
                                    f.term(
                                        t -> t.field(ChunkFields.DOCUMENT_KEY).value(documentKey)))
                            .mustNot(
                                m ->
                                    m.term(
                                        t ->
                                            t.field(ChunkFields.SOURCE_DOCUMENT_ID)
                                                .value(currentSourceDocumentId)))));
    deleteByQuery(partition, stale);
  }

  @Override
  protected void clear(UserRole partition) {
    deleteByQuery(partition, Query.of(q -> q.matchAll(m -> m)));
  }

  private void deleteByQuery(UserRole partition, Query query) {
    Long deleted =
        guarded(
            partition,
            "Delete by query",
            () ->
                elasticsearchClient
                    .deleteByQuery(d -> d.index(indexName(partition)).query(query).refresh(true))
                    .deleted());
    if (deleted != null && deleted > 0) {
      log.info("Deleted {} chunks from {}", deleted, indexName(partition));
      meterRegistry.counter("chunk_store.deleted").increment(deleted);
    }
  }

  @Override
  public void flush() {
    for (UserRole partition : UserRole.values()) {
      try {
        guarded(
            partition,
            "Refresh",
            () -> elasticsearchClient.indices().refresh(r -> r.index(indexName(partition))));
      } catch (ChunkStoreException e) {
        log.warn("Failed to refresh index {}: {}", indexName(partition), e.getMessage());
      }
    }
  }

  /** Runs a cluster call through the circuit breaker, reporting any failure per partition. */
  private <T> T guarded(UserRole partition, String action, Callable<T> call) {
    try {
      return circuitBreaker.executeCallable(call);
    } catch (CallNotPermittedException e) {
      log.warn("{} on {} rejected, circuit breaker is open", action, indexName(partition));
      meterRegistry.counter("chunk_store.circuit_open").increment();
      throw new ChunkStoreException(partition, action + " rejected: circuit breaker is open", e);
    } catch (Exception e) {
      throw new ChunkStoreException(partition, action + " failed: " + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  static List<Query> toFilterQueries(Map<String, List<String>> filters) {
    List<Query> queries = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : filters.entrySet()) {
      String field = entry.getKey();
      List<String> values = entry.getValue();
      if (values.size() == 1) {
        queries.add(Query.of(q -> q.term(t -> t.field(field).value(values.get(0)))));
      } else {
        List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
        queries.add(Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues)))));
      }
    }
    return queries;
  }
}
