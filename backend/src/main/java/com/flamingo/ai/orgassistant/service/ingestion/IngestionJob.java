package com.flamingo.ai.orgassistant.service.ingestion;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Immutable snapshot of the ingestion job state. */
@Value
@Builder(toBuilder = true)
public class IngestionJob {

  public enum Status {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
  }

  String id;
  Status status;
  @Singular List<String> sources;
  Instant startedAt;
  Instant finishedAt;
  IngestionStats stats;
  String error;

  public static IngestionJob idle() {
    return IngestionJob.builder().status(Status.IDLE).build();
  }

  public boolean isRunning() {
    return status == Status.RUNNING;
  }
}
