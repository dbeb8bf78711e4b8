package com.flamingo.ai.orgassistant.domain;

import java.util.Set;

/** Metadata keys written on every chunk and the subset usable as search filters. */
public final class ChunkFields {

  public static final String SOURCE = "source";
  public static final String DOC_TYPE = "doc_type";
  public static final String ROLE_TAGS = "role_tags";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String TOTAL_CHUNKS = "total_chunks";
  public static final String TOKEN_COUNT = "token_count";
  public static final String CHAR_COUNT = "char_count";
  public static final String PROCESSING_TIMESTAMP = "processing_timestamp";
  public static final String CONTENT_TYPE = "content_type";
  public static final String COMPLEXITY_SCORE = "complexity_score";
  public static final String HAS_CODE = "has_code";
  public static final String HAS_URLS = "has_urls";
  public static final String KEYWORDS = "keywords";
  public static final String SUMMARY = "summary";
  public static final String SOURCE_DOCUMENT_ID = "source_document_id";
  public static final String DOCUMENT_KEY = "document_key";

  /** Keyword-typed fields accepted in search filters. */
  public static final Set<String> FILTERABLE =
      Set.of(SOURCE, DOC_TYPE, ROLE_TAGS, CONTENT_TYPE, SOURCE_DOCUMENT_ID, DOCUMENT_KEY);

  private ChunkFields() {}
}
