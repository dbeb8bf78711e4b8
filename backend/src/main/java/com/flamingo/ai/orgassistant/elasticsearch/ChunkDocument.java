package com.flamingo.ai.orgassistant.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk as stored in a partition index: the keyword fields used by filters, the vector, and the
 * full chunk metadata returned with hits.
 *
 * <p>A chunk whose embedding is all zeros is stored without {@code embedding}, since cosine
 * similarity is undefined for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkDocument {

  private String id;
  private String content;
  private List<Float> embedding;
  private String source;

  @JsonProperty(ChunkFields.DOC_TYPE)
  private String docType;

  @JsonProperty(ChunkFields.CONTENT_TYPE)
  private String contentType;

  @JsonProperty(ChunkFields.ROLE_TAGS)
  @Builder.Default
  private List<String> roleTags = List.of();

  @JsonProperty(ChunkFields.SOURCE_DOCUMENT_ID)
  private String sourceDocumentId;

  @JsonProperty(ChunkFields.DOCUMENT_KEY)
  private String documentKey;

  @JsonProperty(ChunkFields.CHUNK_INDEX)
  private int chunkIndex;

  @JsonProperty(ChunkFields.TOTAL_CHUNKS)
  private int totalChunks;

  @JsonProperty(ChunkFields.CREATED_AT)
  private String createdAt;

  @JsonProperty(ChunkFields.UPDATED_AT)
  private String updatedAt;

  @Builder.Default private Map<String, Object> metadata = Map.of();

  static ChunkDocument from(Chunk chunk, Set<String> roleTags) {
    Map<String, Object> metadata =
        new LinkedHashMap<>(chunk.getMetadata() == null ? Map.of() : chunk.getMetadata());
    metadata.put(ChunkFields.ROLE_TAGS, new ArrayList<>(roleTags));
    metadata.put(ChunkFields.SOURCE_DOCUMENT_ID, chunk.getSourceDocumentId());
    metadata.put(ChunkFields.DOCUMENT_KEY, chunk.getDocumentKey());

    return ChunkDocument.builder()
        .id(chunk.getId())
        .content(chunk.getContent())
        .embedding(isZero(chunk.getEmbedding()) ? null : toList(chunk.getEmbedding()))
        .source(text(metadata, ChunkFields.SOURCE))
        .docType(text(metadata, ChunkFields.DOC_TYPE))
        .contentType(text(metadata, ChunkFields.CONTENT_TYPE))
        .roleTags(new ArrayList<>(roleTags))
        .sourceDocumentId(chunk.getSourceDocumentId())
        .documentKey(chunk.getDocumentKey())
        .chunkIndex(chunk.getChunkIndex())
        .totalChunks(chunk.getTotalChunks())
        .createdAt(text(metadata, ChunkFields.CREATED_AT))
        .updatedAt(text(metadata, ChunkFields.UPDATED_AT))
        .metadata(metadata)
        .build();
  }

  static boolean isZero(float[] vector) {
    for (float value : vector) {
      if (value != 0f) {
        return false;
      }
    }
    return true;
  }

  static List<Float> toList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float value : vector) {
      values.add(value);
    }
    return values;
  }

  private static String text(Map<String, Object> metadata, String key) {
    Object value = metadata.get(key);
    return value == null ? null : value.toString();
  }
}
