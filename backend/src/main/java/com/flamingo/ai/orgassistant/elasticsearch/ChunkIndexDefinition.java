package com.flamingo.ai.orgassistant.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorIndexOptionsType;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Schema of a partition index and its lifecycle: created when missing, otherwise checked for type
 * mismatches (fail fast) and extended with missing fields.
 */
@Slf4j
class ChunkIndexDefinition {

  static final String ID = "id";
  static final String CONTENT = "content";
  static final String EMBEDDING = "embedding";
  static final String METADATA = "metadata";

  private final ElasticsearchClient elasticsearchClient;
  private final RagConfig.Store.Elasticsearch settings;
  private final int dimensions;

  ChunkIndexDefinition(
      ElasticsearchClient elasticsearchClient,
      RagConfig.Store.Elasticsearch settings,
      int dimensions) {
    this.elasticsearchClient = elasticsearchClient;
    this.settings = settings;
    this.dimensions = dimensions;
  }

  Map<String, Property> properties() {
    Map<String, Property> properties = new LinkedHashMap<>();
    properties.put(ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CONTENT, Property.of(p -> p.text(t -> t)));
    properties.put(
        EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)
                                .indexOptions(
                                    o ->
                                        o.type(DenseVectorIndexOptionsType.Hnsw)
                                            .m(settings.getHnswM())
                                            .efConstruction(settings.getHnswEfConstruction()))))));
    for (String keyword : ChunkFields.FILTERABLE) {
      properties.put(keyword, Property.of(p -> p.keyword(k -> k)));
    }
    properties.put(ChunkFields.CHUNK_INDEX, Property.of(p -> p.integer(i -> i)));
    properties.put(ChunkFields.TOTAL_CHUNKS, Property.of(p -> p.integer(i -> i)));
    properties.put(ChunkFields.CREATED_AT, Property.of(p -> p.date(d -> d)));
    properties.put(ChunkFields.UPDATED_AT, Property.of(p -> p.date(d -> d)));
    // Returned with hits, never searched
    properties.put(METADATA, Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  void ensureIndex(String indexName) {
    try {
      if (elasticsearchClient.indices().exists(e -> e.index(indexName)).value()) {
        reconcile(indexName);
      } else {
        create(indexName);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Cannot prepare index '" + indexName + "'", e);
    }
  }

  private void create(String indexName) throws IOException {
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .settings(
                        s ->
                            s.numberOfShards(String.valueOf(settings.getNumberOfShards()))
                                .numberOfReplicas(String.valueOf(settings.getNumberOfReplicas())))
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties())));
    elasticsearchClient.indices().create(request);
    log.info("Created partition index {}", indexName);
  }

  /** Fails on fields whose type changed, adds fields the index does not have yet. */
  private void reconcile(String indexName) throws IOException {
    IndexMappingRecord mapping =
        elasticsearchClient.indices().getMapping(g -> g.index(indexName)).get(indexName);
    Map<String, Property> actual =
        mapping == null ? Map.of() : mapping.mappings().properties();
    MappingDiff diff = MappingDiff.between(properties(), actual);

    if (!diff.conflicts().isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + indexName
              + "' was created with another schema, delete it and re-ingest: "
              + String.join(", ", diff.conflicts()));
    }
    if (diff.missing().isEmpty()) {
      log.debug("Index {} is up to date", indexName);
      return;
    }
    elasticsearchClient
        .indices()
        .putMapping(PutMappingRequest.of(p -> p.index(indexName).properties(diff.missing())));
    log.info("Added fields {} to index {}", diff.missing().keySet(), indexName);
  }

  /**
   * Difference between the expected and the actual mapping of an index.
   *
   * @param conflicts descriptions of fields mapped with another type
   * @param missing expected fields absent from the index
   */
  record MappingDiff(List<String> conflicts, Map<String, Property> missing) {

    static MappingDiff between(Map<String, Property> expected, Map<String, Property> actual) {
      List<String> conflicts =
          expected.entrySet().stream()
              .filter(e -> actual.containsKey(e.getKey()))
              .filter(e -> actual.get(e.getKey())._kind() != e.getValue()._kind())
              .map(
                  e ->
                      e.getKey()
                          + " is "
                          + actual.get(e.getKey())._kind().jsonValue()
                          + ", expected "
                          + e.getValue()._kind().jsonValue())
              .toList();
      Map<String, Property> missing =
          expected.entrySet().stream()
              .filter(e -> !actual.containsKey(e.getKey()))
              .collect(
                  Collectors.toMap(
                      Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
      return new MappingDiff(conflicts, missing);
    }
  }
}
