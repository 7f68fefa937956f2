package io.github.themoah.tpeak.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.tpeak.RunResults;
import io.github.themoah.tpeak.exception.SourceUnavailableException;
import io.github.themoah.tpeak.health.RunHealthMonitor;
import io.github.themoah.tpeak.metrics.MetricsReporter;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for AnalysisScheduler.
 */
@ExtendWith(VertxExtension.class)
public class AnalysisSchedulerTest {

  private static final long HOUR_MS = 3_600_000L;

  private final RunHealthMonitor monitor = new RunHealthMonitor();
  private final RecordingReporter reporter = new RecordingReporter();

  @Test
  void successfulRun_reportedAndReady(Vertx vertx, VertxTestContext ctx) {
    AnalysisScheduler scheduler = new AnalysisScheduler(vertx, "file-type", RunResults::persisted,
      reporter, monitor, HOUR_MS);

    scheduler.runOnce().onComplete(ctx.succeeding(result -> ctx.verify(() -> {
      assertTrue(result.baselinePersisted());
      assertEquals(1, reporter.runs.get());
      assertTrue(monitor.isReady());
      assertFalse(scheduler.isRunning());
      ctx.completeNow();
    })));
  }

  @Test
  void failedRun_reportedAndNotReady(Vertx vertx, VertxTestContext ctx) {
    AnalysisScheduler scheduler = new AnalysisScheduler(vertx, "file-type", () -> {
      throw new SourceUnavailableException("backend down");
    }, reporter, monitor, HOUR_MS);

    scheduler.runOnce().onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertTrue(err instanceof SourceUnavailableException);
      assertEquals(1, reporter.failures.get());
      assertFalse(monitor.isReady());
      assertEquals("backend down", monitor.lastError());
      ctx.completeNow();
    })));
  }

  @Test
  void overlappingTick_skipped(Vertx vertx, VertxTestContext ctx) {
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger started = new AtomicInteger();
    AnalysisScheduler scheduler = new AnalysisScheduler(vertx, "file-type", () -> {
      started.incrementAndGet();
      release.await(5, TimeUnit.SECONDS);
      return RunResults.persisted();
    }, reporter, monitor, HOUR_MS);

    Future<AnalysisResult> first = scheduler.runOnce();
    Future<AnalysisResult> second = scheduler.runOnce();

    ctx.verify(() -> {
      assertTrue(second.succeeded());
      assertNull(second.result());
    });
    release.countDown();

    first.onComplete(ctx.succeeding(result -> ctx.verify(() -> {
      assertEquals(1, started.get());
      assertEquals(1, reporter.runs.get());
      ctx.completeNow();
    })));
  }

  @Test
  void start_runsImmediatelyThenPeriodically(Vertx vertx, VertxTestContext ctx) {
    AtomicInteger runs = new AtomicInteger();
    AnalysisScheduler scheduler = new AnalysisScheduler(vertx, "file-type", () -> {
      runs.incrementAndGet();
      return RunResults.persisted();
    }, reporter, monitor, 50);

    scheduler.start().onComplete(ctx.succeeding(v -> {
      ctx.verify(() -> assertEquals(1, runs.get()));
      vertx.setTimer(300, id -> scheduler.stop().onComplete(ctx.succeeding(stopped -> ctx.verify(() -> {
        assertTrue(runs.get() >= 2);
        assertTrue(reporter.closed);
        ctx.completeNow();
      }))));
    }));
  }

  @Test
  void failedFirstRun_startStillSucceeds(Vertx vertx, VertxTestContext ctx) {
    AnalysisScheduler scheduler = new AnalysisScheduler(vertx, "file-type", () -> {
      throw new SourceUnavailableException("backend down");
    }, reporter, monitor, HOUR_MS);

    scheduler.start()
      .compose(v -> scheduler.stop())
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        assertFalse(monitor.isReady());
        ctx.completeNow();
      })));
  }

  private static class RecordingReporter implements MetricsReporter {
    final AtomicInteger runs = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    volatile boolean closed;

    @Override
    public void reportRun(String analyzer, AnalysisResult result) {
      runs.incrementAndGet();
    }

    @Override
    public void reportFailure(String analyzer, Throwable cause) {
      failures.incrementAndGet();
    }

    @Override
    public Future<Void> start() {
      return Future.succeededFuture();
    }

    @Override
    public Future<Void> close() {
      closed = true;
      return Future.succeededFuture();
    }
  }
}
