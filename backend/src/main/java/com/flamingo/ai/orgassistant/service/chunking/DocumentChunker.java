package com.flamingo.ai.orgassistant.service.chunking;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.Document;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cleans a document and splits it into overlapping text spans with the splitter suited to its
 * content type.
 */
@Service
@Slf4j
public class DocumentChunker {

  private final ContentCleaner contentCleaner;
  private final TextSplitterRouter router;
  private final int minContentLength;
  private final Map<SplitterLanguage, RecursiveTextSplitter> splitters =
      new EnumMap<>(SplitterLanguage.class);

  public DocumentChunker(
      ContentCleaner contentCleaner, TextSplitterRouter router, RagConfig ragConfig) {
    this.contentCleaner = contentCleaner;
    this.router = router;
    RagConfig.Chunking chunking = ragConfig.getChunking();
    this.minContentLength = chunking.getMinContentLength();
    for (SplitterLanguage language : SplitterLanguage.values()) {
      splitters.put(
          language,
          RecursiveTextSplitter.forLanguage(language, chunking.getSize(), chunking.getOverlap()));
    }
  }

  public ChunkingResult chunk(Document document) {
    String cleaned = contentCleaner.clean(document.getContent());
    if (cleaned.length() < minContentLength) {
      log.debug(
          "Skipping document with {} chars of content (minimum {})",
          cleaned.length(),
          minContentLength);
      return ChunkingResult.tooShort();
    }

    SplitterLanguage language = router.route(document, cleaned);
    List<String> spans = splitters.get(language).split(cleaned);
    if (spans.isEmpty()) {
      log.warn("{} splitter produced no spans for {} chars of content", language, cleaned.length());
      return new ChunkingResult(ChunkingOutcome.EMPTY_SPLIT, List.of(), language);
    }
    log.debug("Split {} chars into {} spans with {} splitter", cleaned.length(), spans.size(),
        language);
    return new ChunkingResult(ChunkingOutcome.CHUNKED, spans, language);
  }
}
