package com.flamingo.ai.orgassistant.service.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Character based splitter that tries each separator of a hierarchy in turn.
 *
 * <p>The text is split on the coarsest separator it contains; pieces that are still larger than
 * the chunk size are split recursively on the next separators. Small pieces are then merged back
 * into chunks of at most {@code chunkSize} characters, carrying up to {@code overlap} characters of
 * trailing context from one chunk into the next. Separators are kept at the start of the piece
 * that follows them.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public class RecursiveTextSplitter {

  private final List<Pattern> separators;
  private final int chunkSize;
  private final int overlap;

  public RecursiveTextSplitter(List<String> separators, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, chunkSize): overlap=" + overlap + ", chunkSize=" + chunkSize);
    }
    this.separators = separators.stream().map(Pattern::compile).collect(Collectors.toList());
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  public static RecursiveTextSplitter forLanguage(
      SplitterLanguage language, int chunkSize, int overlap) {
    return new RecursiveTextSplitter(language.separators(), chunkSize, overlap);
  }

  /**
   * Splits text into ordered, overlapping chunks.
   *
   * @param text the text to split
   * @return chunks in document order; empty for blank input
   */
  public List<String> split(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return split(text, separators);
  }

  private List<String> split(String text, List<Pattern> candidates) {
    List<String> finalChunks = new ArrayList<>();

    Pattern separator = candidates.get(candidates.size() - 1);
    List<Pattern> remaining = List.of();
    for (int i = 0; i < candidates.size(); i++) {
      Pattern candidate = candidates.get(i);
      if (candidate.pattern().isEmpty()) {
        separator = candidate;
        break;
      }
      if (candidate.matcher(text).find()) {
        separator = candidate;
        remaining = candidates.subList(i + 1, candidates.size());
        break;
      }
    }

    List<String> goodSplits = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < chunkSize) {
        goodSplits.add(piece);
        continue;
      }
      if (!goodSplits.isEmpty()) {
        finalChunks.addAll(merge(goodSplits));
        goodSplits = new ArrayList<>();
      }
      if (remaining.isEmpty()) {
        finalChunks.add(piece);
      } else {
        finalChunks.addAll(split(piece, remaining));
      }
    }
    if (!goodSplits.isEmpty()) {
      finalChunks.addAll(merge(goodSplits));
    }
    return finalChunks;
  }

  private List<String> splitKeepingSeparator(String text, Pattern separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.pattern().isEmpty()) {
      for (int i = 0; i < text.length(); i++) {
        pieces.add(String.valueOf(text.charAt(i)));
      }
      return pieces;
    }
    Matcher matcher = separator.matcher(text);
    int start = 0;
    while (matcher.find()) {
      if (matcher.start() > start) {
        pieces.add(text.substring(start, matcher.start()));
        start = matcher.start();
      }
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  private List<String> merge(List<String> splits) {
    List<String> chunks = new ArrayList<>();
    Deque<String> window = new ArrayDeque<>();
    int total = 0;

    for (String piece : splits) {
      int length = piece.length();
      if (total + length > chunkSize && !window.isEmpty()) {
        addIfNotBlank(chunks, String.join("", window));
        // Drop from the front until only the overlap tail remains and the next piece fits
        while (total > overlap || (total + length > chunkSize && total > 0)) {
          total -= window.removeFirst().length();
        }
      }
      window.addLast(piece);
      total += length;
    }
    addIfNotBlank(chunks, String.join("", window));
    return chunks;
  }

  private static void addIfNotBlank(List<String> chunks, String chunk) {
    String trimmed = chunk.strip();
    if (!trimmed.isEmpty()) {
      chunks.add(trimmed);
    }
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public int getOverlap() {
    return overlap;
  }
}
