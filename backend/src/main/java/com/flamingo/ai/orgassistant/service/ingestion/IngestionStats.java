package com.flamingo.ai.orgassistant.service.ingestion;

import java.util.Map;

/**
 * Summary of one ingestion batch.
 *
 * @param processedDocuments documents whose chunks were written
 * @param skippedDocuments documents that produced no chunks
 * @param totalChunks chunks written
 * @param errors documents that failed
 * @param partitionWrites successful chunk writes per partition
 * @param partitionStats chunk count per partition after the batch
 */
public record IngestionStats(
    int processedDocuments,
    int skippedDocuments,
    int totalChunks,
    int errors,
    Map<String, Integer> partitionWrites,
    Map<String, Long> partitionStats) {

  public IngestionStats {
    partitionWrites = Map.copyOf(partitionWrites);
    partitionStats = Map.copyOf(partitionStats);
  }
}
