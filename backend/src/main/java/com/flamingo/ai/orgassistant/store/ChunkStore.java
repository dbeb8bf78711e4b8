package com.flamingo.ai.orgassistant.store;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vector index split into one partition per {@link UserRole}.
 *
 * <p>Writes fan out to every partition named by a chunk's role tags; reads fan in from the general
 * partition plus the partition of the querying role. A failing partition never fails the whole
 * operation.
 */
public interface ChunkStore {

  /**
   * Upserts a chunk by id into every partition its role tags resolve to.
   *
   * @param chunk the chunk to store
   * @param roleTags role tags of the parent document; empty or unknown tags mean general
   * @return the partitions that accepted the write
   */
  Set<UserRole> write(Chunk chunk, Collection<String> roleTags);

  /**
   * Nearest-neighbour search across the partitions visible to a role.
   *
   * @param queryEmbedding query vector
   * @param role role wire value; unknown or null roles only see the general partition
   * @param limit maximum number of merged results
   * @param filters exact-match filters on keyword fields; collection values mean "any of"
   * @return matches sorted by ascending distance, at most {@code limit}
   * @throws IllegalArgumentException when a filter names a field that cannot be filtered on
   */
  List<StoredChunkMatch> search(
      float[] queryEmbedding, String role, int limit, Map<String, Object> filters);

  /** Chunk count per partition wire value. A partition that cannot be counted reports 0. */
  Map<String, Long> stats();

  /**
   * Removes chunks of superseded versions of a document from every partition.
   *
   * @param documentKey content-independent document identity
   * @param currentSourceDocumentId id of the version to keep
   */
  void deleteStale(String documentKey, String currentSourceDocumentId);

  /** Removes every chunk of one partition. */
  void clearPartition(UserRole partition);

  /** Makes previous writes durable and visible to searches. */
  void flush();
}
