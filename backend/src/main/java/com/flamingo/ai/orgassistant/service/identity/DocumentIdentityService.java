package com.flamingo.ai.orgassistant.service.identity;

import com.flamingo.ai.orgassistant.domain.Document;
import com.flamingo.ai.orgassistant.domain.DocumentSource;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Derives deterministic, content-addressed identifiers for documents.
 *
 * <p>The identifier combines the source, the document type, a source-specific natural key taken
 * from the metadata (repository and file path, wiki page id, ticket key) and a short hash of the
 * content. Identical inputs always produce the same id; any content change produces a new one.
 */
@Service
public class DocumentIdentityService {

  static final int ID_LENGTH = 16;
  static final int CONTENT_HASH_LENGTH = 8;

  private static final HashFunction DIGEST = Hashing.sha256();

  /**
   * Returns the content-addressed id of a document.
   *
   * @param document the document
   * @return a 16 character lower-case hex id
   */
  public String id(Document document) {
    String content = document.getContent() == null ? "" : document.getContent();
    String contentHash = hex(content).substring(0, CONTENT_HASH_LENGTH);
    return hex(identityBase(document) + "_" + contentHash).substring(0, ID_LENGTH);
  }

  /**
   * Returns an id that ignores the content, shared by every version of the same document. Used to
   * find chunks of superseded versions.
   *
   * <p>The key is only defined when the document carries a complete stable identity: a GitHub file
   * needs its repository and file path (an issue its repository and issue number), a wiki page its
   * page id and a ticket its issue key. Without one, unrelated documents would share a key and
   * replace each other's chunks.
   *
   * @param document the document
   * @return a 16 character lower-case hex key, or empty when the identity is incomplete
   */
  public Optional<String> documentKey(Document document) {
    List<String> parts = stableIdentity(document);
    if (parts.isEmpty() || parts.stream().anyMatch(String::isBlank)) {
      return Optional.empty();
    }
    String base =
        document.getSource().getValue()
            + "_"
            + (document.getDocType() == null ? "" : document.getDocType())
            + "_"
            + String.join("_", parts);
    return Optional.of(hex(base).substring(0, ID_LENGTH));
  }

  /**
   * Extracts the source-specific natural key. Missing metadata fields become empty strings.
   *
   * @param document the document
   * @return the natural key, possibly empty
   */
  public String naturalKey(Document document) {
    DocumentSource source = document.getSource();
    if (source == null) {
      return "";
    }
    return switch (source) {
      case GITHUB ->
          document.metadataString("repository") + "_" + document.metadataString("file_path");
      case CONFLUENCE -> document.metadataString("page_id");
      case JIRA -> document.metadataString("issue_key");
    };
  }

  private static List<String> stableIdentity(Document document) {
    DocumentSource source = document.getSource();
    if (source == null) {
      return List.of();
    }
    return switch (source) {
      case GITHUB -> {
        String filePath = document.metadataString("file_path");
        String issueNumber = document.metadataString("issue_number");
        String locator = filePath;
        if (locator.isBlank() && !issueNumber.isBlank()) {
          locator = "#" + issueNumber;
        }
        yield List.of(document.metadataString("repository"), locator);
      }
      case CONFLUENCE -> List.of(document.metadataString("page_id"));
      case JIRA -> List.of(document.metadataString("issue_key"));
    };
  }

  private String identityBase(Document document) {
    String source = document.getSource() == null ? "" : document.getSource().getValue();
    String docType = document.getDocType() == null ? "" : document.getDocType();
    return source + "_" + docType + "_" + naturalKey(document);
  }

  private static String hex(String value) {
    return DIGEST.hashString(value, StandardCharsets.UTF_8).toString();
  }
}
