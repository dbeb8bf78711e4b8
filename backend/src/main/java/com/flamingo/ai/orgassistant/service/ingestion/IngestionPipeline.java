package com.flamingo.ai.orgassistant.service.ingestion;

import com.flamingo.ai.orgassistant.domain.Chunk;
import com.flamingo.ai.orgassistant.domain.Document;
import com.flamingo.ai.orgassistant.domain.UserRole;
import com.flamingo.ai.orgassistant.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.orgassistant.store.ChunkStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Ingests document batches: every document is processed independently on the ingestion pool, its
 * superseded chunks are removed and its new chunks written to their partitions. A failing document
 * is counted and never aborts the batch.
 */
@Service
@Slf4j
public class IngestionPipeline {

  private final DocumentProcessingService processingService;
  private final ChunkStore chunkStore;
  private final IngestionJobTracker jobTracker;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;

  public IngestionPipeline(
      DocumentProcessingService processingService,
      ChunkStore chunkStore,
      IngestionJobTracker jobTracker,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry) {
    this.processingService = processingService;
    this.chunkStore = chunkStore;
    this.jobTracker = jobTracker;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Ingests a batch of documents.
   *
   * @param documents documents to ingest
   * @return batch statistics
   */
  public IngestionStats ingest(List<Document> documents) {
    BatchCounters counters = new BatchCounters();
    List<CompletableFuture<Void>> futures = new ArrayList<>(documents.size());
    for (Document document : documents) {
      futures.add(
          CompletableFuture.runAsync(() -> ingestOne(document, counters), ingestionExecutor));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    try {
      chunkStore.flush();
    } catch (RuntimeException e) {
      log.error("Failed to flush chunk store after batch: {}", e.getMessage(), e);
      meterRegistry.counter("ingestion.flush.errors").increment();
    }

    IngestionStats stats =
        new IngestionStats(
            counters.processed.get(),
            counters.skipped.get(),
            counters.chunks.get(),
            counters.errors.get(),
            counters.snapshotPartitionWrites(),
            chunkStore.stats());
    log.info(
        "Ingested batch of {} documents: processed={}, skipped={}, chunks={}, errors={}",
        documents.size(),
        stats.processedDocuments(),
        stats.skippedDocuments(),
        stats.totalChunks(),
        stats.errors());
    return stats;
  }

  /**
   * Runs a batch as the single active ingestion job.
   *
   * @param documents documents to ingest
   * @param sources source names recorded on the job
   * @return the finished job snapshot
   * @throws IngestionAlreadyRunningException when another job is running
   */
  public IngestionJob runJob(List<Document> documents, List<String> sources) {
    IngestionJob job =
        jobTracker
            .tryStart(sources)
            .orElseThrow(() -> new IngestionAlreadyRunningException(jobTracker.current().getId()));
    try {
      return jobTracker.complete(job.getId(), ingest(documents));
    } catch (RuntimeException e) {
      log.error("Ingestion job {} failed: {}", job.getId(), e.getMessage(), e);
      jobTracker.fail(job.getId(), e.getMessage());
      throw e;
    }
  }

  private void ingestOne(Document document, BatchCounters counters) {
    try {
      ProcessedDocument processed = processingService.process(document);
      if (processed.isSkipped()) {
        counters.skipped.incrementAndGet();
        meterRegistry.counter("ingestion.documents.skipped").increment();
        return;
      }

      if (processed.documentKey() != null) {
        chunkStore.deleteStale(processed.documentKey(), processed.documentId());
      } else {
        log.debug(
            "Document {} has no stable identity, earlier versions are kept",
            processed.documentId());
      }
      for (Chunk chunk : processed.chunks()) {
        Set<UserRole> written = chunkStore.write(chunk, document.getRoleTags());
        for (UserRole partition : written) {
          counters.partitionWrites
              .computeIfAbsent(partition.getValue(), k -> new AtomicInteger())
              .incrementAndGet();
        }
        counters.chunks.incrementAndGet();
      }
      counters.processed.incrementAndGet();
      meterRegistry.counter("ingestion.documents.processed").increment();
    } catch (RuntimeException e) {
      counters.errors.incrementAndGet();
      meterRegistry.counter("ingestion.documents.errors").increment();
      log.error("Failed to ingest document from {}: {}", document.getSource(), e.getMessage(), e);
    }
  }

  private static final class BatchCounters {
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger chunks = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private final Map<String, AtomicInteger> partitionWrites = new ConcurrentHashMap<>();

    Map<String, Integer> snapshotPartitionWrites() {
      Map<String, Integer> snapshot = new TreeMap<>();
      partitionWrites.forEach((partition, count) -> snapshot.put(partition, count.get()));
      return snapshot;
    }
  }
}
