package com.flamingo.ai.orgassistant.service.ingestion;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks the single ingestion job that may run at a time. State changes are compare-and-set on an
 * immutable snapshot, so concurrent start requests cannot both succeed.
 */
@Component
@Slf4j
public class IngestionJobTracker {

  private final Clock clock;
  private final AtomicReference<IngestionJob> current =
      new AtomicReference<>(IngestionJob.idle());

  public IngestionJobTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Starts a job unless one is running.
   *
   * @param sources names of the sources being ingested
   * @return the started job, or empty when another job is running
   */
  public Optional<IngestionJob> tryStart(List<String> sources) {
    while (true) {
      IngestionJob previous = current.get();
      if (previous.isRunning()) {
        return Optional.empty();
      }
      IngestionJob started =
          IngestionJob.builder()
              .id(UUID.randomUUID().toString())
              .status(IngestionJob.Status.RUNNING)
              .sources(sources == null ? List.of() : sources)
              .startedAt(clock.instant())
              .build();
      if (current.compareAndSet(previous, started)) {
        log.info("Ingestion job {} started for sources {}", started.getId(), sources);
        return Optional.of(started);
      }
    }
  }

  public IngestionJob complete(String jobId, IngestionStats stats) {
    return finish(jobId, job -> job.status(IngestionJob.Status.COMPLETED).stats(stats));
  }

  public IngestionJob fail(String jobId, String error) {
    return finish(jobId, job -> job.status(IngestionJob.Status.FAILED).error(error));
  }

  public IngestionJob current() {
    return current.get();
  }

  private IngestionJob finish(
      String jobId, UnaryOperator<IngestionJob.IngestionJobBuilder> update) {
    IngestionJob finished =
        current.updateAndGet(
            job -> {
              if (!job.isRunning() || !job.getId().equals(jobId)) {
                return job;
              }
              return update.apply(job.toBuilder().finishedAt(clock.instant())).build();
            });
    log.info("Ingestion job {} is {}", jobId, finished.getStatus());
    return finished;
  }
}
