package io.github.themoah.tpeak.health;

import io.github.themoah.tpeak.run.AnalysisResult;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the outcome of the latest analysis run. The service is ready once a run completed
 * with its baseline saved, and stops being ready when a later run fails.
 */
public class RunHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(RunHealthMonitor.class);

  private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.DOWN);
  private final AtomicReference<Instant> lastSuccess = new AtomicReference<>();
  private final AtomicReference<String> lastError = new AtomicReference<>();

  public void recordSuccess(AnalysisResult result) {
    if (!result.baselinePersisted()) {
      recordFailure("baseline not persisted");
      return;
    }
    lastSuccess.set(Instant.now());
    lastError.set(null);
    HealthStatus previous = status.getAndSet(HealthStatus.UP);
    if (previous == HealthStatus.DOWN) {
      log.info("Analysis healthy, {} peaks in last run", result.report().peaks().size());
    }
  }

  public void recordFailure(String reason) {
    lastError.set(reason);
    HealthStatus previous = status.getAndSet(HealthStatus.DOWN);
    if (previous == HealthStatus.UP) {
      log.warn("Analysis unhealthy: {}", reason);
    } else {
      log.debug("Analysis still unhealthy: {}", reason);
    }
  }

  public HealthStatus getStatus() {
    return status.get();
  }

  public boolean isReady() {
    return status.get() == HealthStatus.UP;
  }

  public Instant lastSuccess() {
    return lastSuccess.get();
  }

  public String lastError() {
    return lastError.get();
  }
}
