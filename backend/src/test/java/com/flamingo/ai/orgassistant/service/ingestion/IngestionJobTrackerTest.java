package com.flamingo.ai.orgassistant.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IngestionJobTracker Tests")
class IngestionJobTrackerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

  private IngestionJobTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new IngestionJobTracker(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static IngestionStats stats() {
    return new IngestionStats(1, 0, 3, 0, Map.of("general", 3), Map.of("general", 3L));
  }

  @Test
  @DisplayName("Should start idle")
  void shouldStartIdle() {
    assertThat(tracker.current().getStatus()).isEqualTo(IngestionJob.Status.IDLE);
    assertThat(tracker.current().isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should refuse a second job while one is running")
  void shouldAllowSingleRunningJob() {
    Optional<IngestionJob> first = tracker.tryStart(List.of("github"));
    Optional<IngestionJob> second = tracker.tryStart(List.of("jira"));

    assertThat(first).isPresent();
    assertThat(first.get().getStartedAt()).isEqualTo(NOW);
    assertThat(first.get().getSources()).containsExactly("github");
    assertThat(second).isEmpty();
    assertThat(tracker.current().getId()).isEqualTo(first.get().getId());
  }

  @Test
  @DisplayName("Should record stats on completion and allow a new job")
  void shouldCompleteAndRestart() {
    IngestionJob job = tracker.tryStart(List.of("github")).orElseThrow();

    IngestionJob completed = tracker.complete(job.getId(), stats());

    assertThat(completed.getStatus()).isEqualTo(IngestionJob.Status.COMPLETED);
    assertThat(completed.getStats().totalChunks()).isEqualTo(3);
    assertThat(completed.getFinishedAt()).isEqualTo(NOW);
    assertThat(tracker.tryStart(List.of("confluence"))).isPresent();
  }

  @Test
  @DisplayName("Should record the error of a failed job")
  void shouldFailJob() {
    IngestionJob job = tracker.tryStart(List.of()).orElseThrow();

    IngestionJob failed = tracker.fail(job.getId(), "store unavailable");

    assertThat(failed.getStatus()).isEqualTo(IngestionJob.Status.FAILED);
    assertThat(failed.getError()).isEqualTo("store unavailable");
  }

  @Test
  @DisplayName("Should ignore completion of a job that is not the running one")
  void shouldIgnoreForeignJobId() {
    IngestionJob job = tracker.tryStart(List.of()).orElseThrow();

    IngestionJob unchanged = tracker.complete("someone-else", stats());

    assertThat(unchanged.getId()).isEqualTo(job.getId());
    assertThat(unchanged.isRunning()).isTrue();
  }

  @Test
  @DisplayName("Should let exactly one of many concurrent starts win")
  void shouldStartOnceUnderContention() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(1);
    try {
      List<Future<Optional<IngestionJob>>> attempts = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        attempts.add(
            pool.submit(
                () -> {
                  ready.await();
                  return tracker.tryStart(List.of("github"));
                }));
      }
      ready.countDown();

      int started = 0;
      for (Future<Optional<IngestionJob>> attempt : attempts) {
        if (attempt.get(5, TimeUnit.SECONDS).isPresent()) {
          started++;
        }
      }
      assertThat(started).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
