package io.github.themoah.tpeak.metrics;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.Peak;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes run and peak gauges to a Micrometer registry.
 *
 * <p>Per-peak gauges come and go with the keys that peak. A gauge that is not refreshed by a
 * run is marked, and removed if the following run does not refresh it either.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  private final Map<String, GaugeHandle> gauges = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportRun(String analyzer, AnalysisResult result) {
    DetectionReport report = result.report();
    Tags tags = Tags.of("analyzer", analyzer);
    Set<String> activeKeys = new HashSet<>();

    activeKeys.add(recordGauge("tpeak.run.records.processed", tags, report.recordsProcessed()));
    activeKeys.add(recordGauge("tpeak.run.records.skipped", tags, report.recordsSkipped()));
    activeKeys.add(recordGauge("tpeak.run.records.outside_window", tags, report.recordsOutsideWindow()));
    activeKeys.add(recordGauge("tpeak.run.duration", tags, result.duration().toMillis()));
    activeKeys.add(recordGauge("tpeak.peaks.detected", tags, report.peaks().size()));
    activeKeys.add(recordGauge("tpeak.global.keys", tags, result.global().size()));
    activeKeys.add(recordGauge("tpeak.global.segments", tags, result.global().segments().size()));
    activeKeys.add(recordGauge("tpeak.baseline.persisted", tags, result.baselinePersisted() ? 1 : 0));

    for (Peak peak : report.peaks()) {
      Tags peakTags = Tags.of(
        "analyzer", analyzer,
        "index", peak.index().toString(),
        "dimension", peak.dimension().toString()
      );
      activeKeys.add(recordGauge("tpeak.peak.samp_sub_count_max", peakTags, peak.local().sampSubCountMax()));
      activeKeys.add(recordGauge("tpeak.peak.sub_count", peakTags, peak.local().subCount()));
      activeKeys.add(recordGauge("tpeak.peak.threshold", peakTags, peak.threshold()));
    }

    Counter.builder("tpeak.runs").tags(tags).tag("outcome", result.baselinePersisted() ? "ok" : "not_persisted")
      .register(registry).increment();

    cleanupStaleGauges(activeKeys);
    log.debug("Reported run metrics for analyzer '{}': {} peaks", analyzer, report.peaks().size());
  }

  @Override
  public void reportFailure(String analyzer, Throwable cause) {
    Counter.builder("tpeak.runs").tags("analyzer", analyzer, "outcome", "failed")
      .register(registry).increment();
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    registry.close();
    return Future.succeededFuture();
  }

  public MeterRegistry registry() {
    return registry;
  }

  private String recordGauge(String name, Tags tags, long value) {
    String key = name + tags;
    GaugeHandle handle = gauges.computeIfAbsent(key, k -> {
      AtomicLong holder = new AtomicLong(value);
      Gauge gauge = Gauge.builder(name, holder, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return new GaugeHandle(gauge, holder);
    });
    handle.value().set(value);
    return key;
  }

  /**
   * Two-phase cleanup: gauges missing from a run are marked, gauges still missing from the
   * next run are removed.
   *
   * @param activeKeys gauge keys refreshed by the current run
   */
  void cleanupStaleGauges(Set<String> activeKeys) {
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activeKeys);
    for (String key : toDelete) {
      GaugeHandle handle = gauges.remove(key);
      if (handle != null) {
        registry.remove(handle.gauge());
        log.debug("Removed stale gauge: {}", key);
      }
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>(gauges.keySet());
    missing.removeAll(activeKeys);
    markedForDeletion.retainAll(missing);
    markedForDeletion.addAll(missing);
  }

  int gaugeCount() {
    return gauges.size();
  }

  private record GaugeHandle(Gauge gauge, AtomicLong value) {
  }
}
