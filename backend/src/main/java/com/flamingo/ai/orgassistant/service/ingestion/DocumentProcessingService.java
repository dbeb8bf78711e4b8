package com.flamingo.ai.orgassistant.service.ingestion;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import com.flamingo.ai.orgassistant.domain.Document;
import com.flamingo.ai.orgassistant.exception.DocumentProcessingException;
import com.flamingo.ai.orgassistant.exception.EmbeddingBackendException;
import com.flamingo.ai.orgassistant.service.chunking.ChunkMetadataExtractor;
import com.flamingo.ai.orgassistant.service.chunking.ChunkingResult;
import com.flamingo.ai.orgassistant.service.chunking.DocumentChunker;
import com.flamingo.ai.orgassistant.service.embedding.EmbeddingProvider;
import com.flamingo.ai.orgassistant.service.identity.DocumentIdentityService;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Turns one document into embedded, annotated chunks. Writes nothing. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private final DocumentIdentityService identityService;
  private final DocumentChunker documentChunker;
  private final ChunkMetadataExtractor metadataExtractor;
  private final EmbeddingProvider embeddingProvider;
  private final Clock clock;

  /**
   * Identifies, chunks and embeds a document with a single embedding batch.
   *
   * @param document the document
   * @return the processed document; without chunks when the content was skipped
   * @throws EmbeddingBackendException when the embedding backend fails the batch
   * @throws DocumentProcessingException on any other failure
   */
  @Timed(value = "ingestion.document", description = "Time to process one document")
  public ProcessedDocument process(Document document) {
    String documentId = identityService.id(document);
    String documentKey = identityService.documentKey(document).orElse(null);
    try {
      ChunkingResult chunking = documentChunker.chunk(document);
      if (!chunking.hasSpans()) {
        log.debug("Document {} skipped: {}", documentId, chunking.outcome());
        return new ProcessedDocument(documentId, documentKey, List.of(), chunking.outcome());
      }

      List<String> spans = chunking.spans();
      List<float[]> vectors = embeddingProvider.embedBatch(spans);
      if (vectors.size() != spans.size()) {
        throw new DocumentProcessingException(
            documentId,
            "Embedding provider returned "
                + vectors.size()
                + " vectors for "
                + spans.size()
                + " chunks");
      }

      String processedAt = clock.instant().toString();
      List<Chunk> chunks = new ArrayList<>(spans.size());
      for (int i = 0; i < spans.size(); i++) {
        String span = spans.get(i);
        chunks.add(
            Chunk.builder()
                .id(Chunk.chunkId(documentId, i))
                .content(span)
                .embedding(vectors.get(i))
                .sourceDocumentId(documentId)
                .documentKey(documentKey)
                .chunkIndex(i)
                .totalChunks(spans.size())
                .metadata(chunkMetadata(document, span, i, spans.size(), processedAt))
                .build());
      }
      log.info(
          "Processed document {} into {} chunks with {} splitter",
          documentId,
          chunks.size(),
          chunking.language());
      return new ProcessedDocument(documentId, documentKey, chunks, chunking.outcome());
    } catch (EmbeddingBackendException | DocumentProcessingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DocumentProcessingException(
          documentId, "Failed to process document " + documentId + ": " + e.getMessage(), e);
    }
  }

  private Map<String, Object> chunkMetadata(
      Document document, String span, int index, int total, String processedAt) {
    Map<String, Object> metadata = new LinkedHashMap<>(document.getMetadata());
    metadata.put(
        ChunkFields.SOURCE, document.getSource() == null ? "" : document.getSource().getValue());
    metadata.put(ChunkFields.DOC_TYPE, document.getDocType() == null ? "" : document.getDocType());
    metadata.put(ChunkFields.ROLE_TAGS, new ArrayList<>(document.getRoleTags()));
    if (document.getCreatedAt() != null) {
      metadata.put(ChunkFields.CREATED_AT, document.getCreatedAt().toString());
    }
    if (document.getUpdatedAt() != null) {
      metadata.put(ChunkFields.UPDATED_AT, document.getUpdatedAt().toString());
    }
    metadata.put(ChunkFields.CHUNK_INDEX, index);
    metadata.put(ChunkFields.TOTAL_CHUNKS, total);
    metadata.put(ChunkFields.PROCESSING_TIMESTAMP, processedAt);
    metadata.putAll(metadataExtractor.extract(span, document.getDocType()));
    return metadata;
  }
}
