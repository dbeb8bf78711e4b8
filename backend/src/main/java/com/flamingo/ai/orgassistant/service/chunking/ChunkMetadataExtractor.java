package com.flamingo.ai.orgassistant.service.chunking;

import com.flamingo.ai.orgassistant.config.RagConfig;
import com.flamingo.ai.orgassistant.domain.ChunkFields;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives chunk-level descriptors from a text span: content type, complexity, code and URL flags,
 * keywords, a short summary and size estimates. Signal lists come from {@code rag.lexicon}.
 */
@Component
@RequiredArgsConstructor
public class ChunkMetadataExtractor {

  static final int MAX_KEYWORDS = 10;
  static final int MAX_CAPITALIZED_TERMS = 5;
  static final int SUMMARY_CHARS = 100;
  static final int MIN_SENTENCE_SUMMARY = 20;

  private static final Pattern URL = Pattern.compile("https?://\\S+");
  private static final Pattern CAPITALIZED = Pattern.compile("\\b[A-Z][a-zA-Z]+\\b");

  private final RagConfig ragConfig;

  /**
   * Computes the content-derived metadata of one span.
   *
   * @param span chunk text
   * @param docType parent document type, used when no content type signal matches
   * @return mutable map keyed by {@link ChunkFields} names
   */
  public Map<String, Object> extract(String span, String docType) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(ChunkFields.TOKEN_COUNT, estimateTokens(span));
    metadata.put(ChunkFields.CHAR_COUNT, span.length());
    metadata.put(ChunkFields.CONTENT_TYPE, classify(span, docType));
    metadata.put(ChunkFields.COMPLEXITY_SCORE, complexity(span));
    metadata.put(ChunkFields.HAS_CODE, containsCode(span));
    metadata.put(ChunkFields.HAS_URLS, URL.matcher(span).find());
    metadata.put(ChunkFields.KEYWORDS, keywords(span));
    metadata.put(ChunkFields.SUMMARY, summary(span));
    return metadata;
  }

  public String classify(String span, String docType) {
    String lower = span.toLowerCase(Locale.ROOT);
    for (RagConfig.ContentTypeRule rule : ragConfig.getLexicon().getContentTypes()) {
      String haystack = rule.isCaseSensitive() ? span : lower;
      for (String signal : rule.getSignals()) {
        if (haystack.contains(signal)) {
          return rule.getName();
        }
      }
    }
    return docType == null || docType.isBlank() ? "general" : docType;
  }

  /** Score in [0, 1] from technical terms, code, length and sentence count. */
  public double complexity(String span) {
    String lower = span.toLowerCase(Locale.ROOT);
    long terms =
        ragConfig.getLexicon().getComplexityTerms().stream().filter(lower::contains).count();
    double score = Math.min(terms * 0.1, 0.3);
    if (containsCode(span)) {
      score += 0.3;
    }
    if (span.length() > 800) {
      score += 0.2;
    }
    long sentences = Arrays.stream(span.split("\\.")).filter(s -> !s.isBlank()).count();
    if (sentences > 5) {
      score += 0.2;
    }
    return Math.min(score, 1.0);
  }

  public boolean containsCode(String span) {
    return ragConfig.getLexicon().getCodeIndicators().stream().anyMatch(span::contains);
  }

  public List<String> keywords(String span) {
    String lower = span.toLowerCase(Locale.ROOT);
    Set<String> found = new LinkedHashSet<>();
    for (String keyword : ragConfig.getLexicon().getTechnicalKeywords()) {
      if (lower.contains(keyword)) {
        found.add(keyword);
      }
    }
    Matcher matcher = CAPITALIZED.matcher(span);
    int capitalized = 0;
    while (capitalized < MAX_CAPITALIZED_TERMS && matcher.find()) {
      found.add(matcher.group());
      capitalized++;
    }
    List<String> keywords = new ArrayList<>(found);
    return keywords.size() > MAX_KEYWORDS ? keywords.subList(0, MAX_KEYWORDS) : keywords;
  }

  /** First sentence when it is long enough, otherwise the leading characters. */
  public String summary(String span) {
    int dot = span.indexOf('.');
    String firstSentence = dot < 0 ? span : span.substring(0, dot);
    if (firstSentence.length() > MIN_SENTENCE_SUMMARY) {
      return firstSentence.strip() + ".";
    }
    String head = span.substring(0, Math.min(SUMMARY_CHARS, span.length())).strip();
    return span.length() > SUMMARY_CHARS ? head + "..." : head;
  }

  static int estimateTokens(String text) {
    return text.length() / 4;
  }
}
