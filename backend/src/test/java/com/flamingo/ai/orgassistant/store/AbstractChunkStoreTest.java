package com.flamingo.ai.orgassistant.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.exception.ChunkStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AbstractChunkStore Tests")
class AbstractChunkStoreTest {

  private SimpleMeterRegistry meterRegistry;
  private RecordingChunkStore store;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store = new RecordingChunkStore(new PartitionResolver(), meterRegistry);
  }

  private static Chunk chunk(String id) {
    return Chunk.builder()
        .id(id)
        .content("content of " + id)
        .embedding(new float[] {1f, 0f})
        .sourceDocumentId("doc")
        .documentKey("key")
        .chunkIndex(0)
        .totalChunks(1)
        .metadata(Map.of())
        .build();
  }

  private static StoredChunkMatch match(String id, double distance, UserRole partition) {
    return new StoredChunkMatch(id, id, Map.of(), distance, partition);
  }

  @Nested
  @DisplayName("write")
  class Write {

    @Test
    @DisplayName("Should write into every partition named by the role tags")
    void shouldFanOutToTaggedPartitions() {
      Set<UserRole> written = store.write(chunk("c1"), List.of("developer", "support"));

      assertThat(written).containsExactlyInAnyOrder(UserRole.DEVELOPER, UserRole.SUPPORT);
      assertThat(store.upserts.get(UserRole.DEVELOPER)).containsExactly("c1");
      assertThat(store.upserts.get(UserRole.SUPPORT)).containsExactly("c1");
      assertThat(store.upserts.get(UserRole.GENERAL)).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to general for empty or unknown tags")
    void shouldFallBackToGeneral() {
      assertThat(store.write(chunk("c1"), List.of())).containsExactly(UserRole.GENERAL);
      assertThat(store.write(chunk("c2"), List.of("finance"))).containsExactly(UserRole.GENERAL);
      assertThat(store.upserts.get(UserRole.GENERAL)).containsExactly("c1", "c2");
    }

    @Test
    @DisplayName("Should keep writing other partitions when one fails")
    void shouldContainPartitionWriteFailure() {
      store.failing.add(UserRole.DEVELOPER);

      Set<UserRole> written = store.write(chunk("c1"), List.of("developer", "manager"));

      assertThat(written).containsExactly(UserRole.MANAGER);
      assertThat(meterRegistry.counter("chunk_store.write.errors").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("Should merge partitions by distance and truncate to the limit")
    void shouldMergeAndTruncate() {
      store.results.put(
          UserRole.GENERAL,
          List.of(
              match("g1", 0.1, UserRole.GENERAL),
              match("g2", 0.3, UserRole.GENERAL),
              match("g3", 0.5, UserRole.GENERAL),
              match("g4", 0.7, UserRole.GENERAL)));
      store.results.put(
          UserRole.DEVELOPER,
          List.of(
              match("d1", 0.2, UserRole.DEVELOPER),
              match("d2", 0.4, UserRole.DEVELOPER),
              match("d3", 0.6, UserRole.DEVELOPER),
              match("d4", 0.8, UserRole.DEVELOPER)));

      List<StoredChunkMatch> results = store.search(new float[] {1f, 0f}, "developer", 5, null);

      assertThat(results)
          .extracting(StoredChunkMatch::distance)
          .containsExactly(0.1, 0.2, 0.3, 0.4, 0.5);
    }

    @Test
    @DisplayName("Should only query general for the general role or an unknown role")
    void shouldQueryGeneralOnlyForUnknownRoles() {
      store.search(new float[] {1f, 0f}, "general", 5, Map.of());
      store.search(new float[] {1f, 0f}, "auditor", 5, Map.of());

      assertThat(store.queried).containsExactly(UserRole.GENERAL, UserRole.GENERAL);
    }

    @Test
    @DisplayName("Should omit a failing partition from the results")
    void shouldContainPartitionQueryFailure() {
      store.results.put(UserRole.GENERAL, List.of(match("g1", 0.2, UserRole.GENERAL)));
      store.failing.add(UserRole.SUPPORT);

      List<StoredChunkMatch> results = store.search(new float[] {1f, 0f}, "support", 5, Map.of());

      assertThat(results).extracting(StoredChunkMatch::id).containsExactly("g1");
      assertThat(meterRegistry.counter("chunk_store.query.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject unknown filter keys before querying")
    void shouldRejectUnknownFilterKeys() {
      assertThatThrownBy(
              () -> store.search(new float[] {1f, 0f}, "developer", 5, Map.of("author", "bob")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("author");
      assertThat(store.queried).isEmpty();
    }

    @Test
    @DisplayName("Should normalize scalar and collection filter values")
    void shouldNormalizeFilters() {
      store.search(
          new float[] {1f, 0f},
          "general",
          5,
          Map.of("source", "github", "content_type", List.of("code_snippet", "configuration")));

      assertThat(store.lastFilters)
          .containsEntry("source", List.of("github"))
          .containsEntry("content_type", List.of("code_snippet", "configuration"));
    }

    @Test
    @DisplayName("Should lower-case role tag filters like tags on write")
    void shouldLowerCaseRoleTagFilters() {
      store.search(
          new float[] {1f, 0f}, "general", 5, Map.of("role_tags", List.of("Developer", " QA ")));

      assertThat(store.lastFilters).containsEntry("role_tags", List.of("developer", "qa"));

      store.search(new float[] {1f, 0f}, "general", 5, Map.of("role_tags", "DevOps"));

      assertThat(store.lastFilters).containsEntry("role_tags", List.of("devops"));
    }

    @Test
    @DisplayName("Should match nothing for an empty collection filter")
    void shouldReturnNothingForEmptyCollectionFilter() {
      assertThat(store.search(new float[] {1f, 0f}, "general", 5, Map.of("source", List.of())))
          .isEmpty();
      assertThat(store.queried).isEmpty();
    }
  }

  @Test
  @DisplayName("Should report zero for a partition that cannot be counted")
  void shouldReportZeroForFailingPartitionCount() {
    store.upserts.get(UserRole.GENERAL).add("c1");
    store.failing.add(UserRole.MANAGER);

    Map<String, Long> stats = store.stats();

    assertThat(stats)
        .containsEntry("general", 1L)
        .containsEntry("manager", 0L)
        .containsOnlyKeys("developer", "support", "manager", "general");
  }

  @Test
  @DisplayName("Should convert relevance scores to cosine distances")
  void shouldConvertRelevanceToDistance() {
    assertThat(AbstractChunkStore.distanceFromRelevance(1.0)).isZero();
    assertThat(AbstractChunkStore.distanceFromRelevance(0.5)).isEqualTo(1.0);
    assertThat(AbstractChunkStore.distanceFromRelevance(0.0)).isEqualTo(2.0);
  }

  /** Backend that records calls and serves canned results. */
  private static class RecordingChunkStore extends AbstractChunkStore {

    private final Map<UserRole, List<String>> upserts = new EnumMap<>(UserRole.class);
    private final Map<UserRole, List<StoredChunkMatch>> results = new EnumMap<>(UserRole.class);
    private final Set<UserRole> failing = EnumSet.noneOf(UserRole.class);
    private final List<UserRole> queried = new ArrayList<>();
    private Map<String, List<String>> lastFilters;

    RecordingChunkStore(PartitionResolver partitionResolver, SimpleMeterRegistry meterRegistry) {
      super(partitionResolver, meterRegistry);
      for (UserRole role : UserRole.values()) {
        upserts.put(role, new ArrayList<>());
      }
    }

    private void failIfRequested(UserRole partition) {
      if (failing.contains(partition)) {
        throw new ChunkStoreException(partition, "partition unavailable", null);
      }
    }

    @Override
    protected void upsert(UserRole partition, Chunk chunk, Set<String> roleTags) {
      failIfRequested(partition);
      upserts.get(partition).add(chunk.getId());
    }

    @Override
    protected List<StoredChunkMatch> query(
        UserRole partition, float[] queryEmbedding, int limit, Map<String, List<String>> filters) {
      queried.add(partition);
      lastFilters = filters;
      failIfRequested(partition);
      return results.getOrDefault(partition, List.of());
    }

    @Override
    protected long count(UserRole partition) {
      failIfRequested(partition);
      return upserts.get(partition).size();
    }

    @Override
    protected void deleteStaleChunks(
        UserRole partition, String documentKey, String currentSourceDocumentId) {
      failIfRequested(partition);
    }

    @Override
    protected void clear(UserRole partition) {
      upserts.get(partition).clear();
    }

    @Override
    public void flush() {}
  }
}
