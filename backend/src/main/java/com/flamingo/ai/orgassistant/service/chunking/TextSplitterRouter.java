package com.flamingo.ai.orgassistant.service.chunking;

import com.flamingo.ai.orgassistant.domain.Document;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses the splitter for a document. The file path suffix wins; the document type and, for code
 * without a known suffix, the content itself are consulted next.
 */
@Component
@Slf4j
public class TextSplitterRouter {

  static final String FILE_PATH = "file_path";

  public SplitterLanguage route(Document document, String cleanedContent) {
    String path = document.metadataString(FILE_PATH).toLowerCase(Locale.ROOT);
    String docType =
        document.getDocType() == null ? "" : document.getDocType().toLowerCase(Locale.ROOT);

    SplitterLanguage language;
    if (path.endsWith(".md") || path.endsWith(".markdown") || "documentation".equals(docType)) {
      language = SplitterLanguage.MARKDOWN;
    } else if (path.endsWith(".py") || path.endsWith(".pyw")) {
      language = SplitterLanguage.PYTHON;
    } else if (path.endsWith(".js")
        || path.endsWith(".jsx")
        || path.endsWith(".ts")
        || path.endsWith(".tsx")) {
      language = SplitterLanguage.JAVASCRIPT;
    } else if (path.endsWith(".java")) {
      language = SplitterLanguage.JAVA;
    } else if ("code".equals(docType)) {
      language = detectFromContent(cleanedContent);
    } else {
      language = SplitterLanguage.GENERIC;
    }
    log.debug("Routing document (path='{}', type='{}') to {} splitter", path, docType, language);
    return language;
  }

  private SplitterLanguage detectFromContent(String content) {
    if (content.contains("def ") || content.contains("import ")) {
      return SplitterLanguage.PYTHON;
    }
    if (content.contains("function ") || content.contains("const ")) {
      return SplitterLanguage.JAVASCRIPT;
    }
    return SplitterLanguage.GENERIC;
  }
}
