package io.github.themoah.tpeak.schedule;

import io.github.themoah.tpeak.health.RunHealthMonitor;
import io.github.themoah.tpeak.metrics.MetricsReporter;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the analysis immediately and then periodically on a worker thread.
 *
 * <p>A tick that fires while the previous analysis is still running is skipped, so at most one
 * run touches the stored baseline at a time.
 */
public class AnalysisScheduler {

  private static final Logger log = LoggerFactory.getLogger(AnalysisScheduler.class);

  private final Vertx vertx;
  private final String analyzer;
  private final Callable<AnalysisResult> analysis;
  private final MetricsReporter reporter;
  private final RunHealthMonitor healthMonitor;
  private final long intervalMs;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private Long timerId;

  /**
   * @param analysis one blocking analysis run, resolving its own window
   */
  public AnalysisScheduler(
      Vertx vertx,
      String analyzer,
      Callable<AnalysisResult> analysis,
      MetricsReporter reporter,
      RunHealthMonitor healthMonitor,
      long intervalMs
  ) {
    this.vertx = vertx;
    this.analyzer = analyzer;
    this.analysis = analysis;
    this.reporter = reporter;
    this.healthMonitor = healthMonitor;
    this.intervalMs = intervalMs;
  }

  public Future<Void> start() {
    log.info("Starting analysis scheduler for '{}' with interval: {}ms", analyzer, intervalMs);

    return reporter.start()
      // a failed first run leaves the service up but not ready
      .compose(v -> runOnce().otherwiseEmpty())
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> runOnce());
        log.info("Analysis scheduler started, timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping analysis scheduler");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return reporter.close();
  }

  /**
   * Runs one analysis unless one is already in flight. The returned future fails when the
   * analysis fails.
   */
  Future<AnalysisResult> runOnce() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Previous analysis still running, skipping this tick");
      return Future.succeededFuture();
    }

    Future<AnalysisResult> future = vertx.executeBlocking(analysis, false);
    return future
      .onSuccess(result -> {
        reporter.reportRun(analyzer, result);
        healthMonitor.recordSuccess(result);
      })
      .onFailure(err -> {
        log.error("Analysis run failed", err);
        reporter.reportFailure(analyzer, err);
        healthMonitor.recordFailure(err.getMessage());
      })
      .onComplete(ar -> running.set(false));
  }

  public boolean isRunning() {
    return running.get();
  }
}
