package com.flamingo.ai.orgassistant.service.chunking;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Normalizes whitespace before content is measured and split. */
@Component
public class ContentCleaner {

  private static final Pattern TRAILING_WHITESPACE =
      Pattern.compile("[ \\t\\x0B\\f\\r]+$", Pattern.MULTILINE);
  private static final Pattern BLANK_LINE_RUN = Pattern.compile("\n{3,}");

  /**
   * Strips trailing whitespace from every line, collapses runs of blank lines into one and trims
   * the result.
   *
   * @param content raw content, may be null
   * @return cleaned content, never null
   */
  public String clean(String content) {
    if (content == null) {
      return "";
    }
    String normalized = content.replace("\r\n", "\n");
    normalized = TRAILING_WHITESPACE.matcher(normalized).replaceAll("");
    normalized = BLANK_LINE_RUN.matcher(normalized).replaceAll("\n\n");
    return normalized.strip();
  }
}
