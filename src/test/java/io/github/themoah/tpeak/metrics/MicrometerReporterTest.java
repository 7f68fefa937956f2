package io.github.themoah.tpeak.metrics;

import static io.github.themoah.tpeak.RecordFixtures.days;
import static io.github.themoah.tpeak.RecordFixtures.entry;
import static io.github.themoah.tpeak.RecordFixtures.key;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.Peak;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.ThresholdSource;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.github.themoah.tpeak.run.RunStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerReporter gauges and stale gauge cleanup.
 */
public class MicrometerReporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerReporter reporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    reporter = new MicrometerReporter(registry);
  }

  private static AnalysisResult result(boolean persisted, StatisticsKey... peakKeys) {
    List<Peak> peaks = List.of(peakKeys).stream()
      .map(key -> new Peak(key, entry(4, 5, 4), null, 1, ThresholdSource.EXPLICIT, true))
      .collect(Collectors.toList());
    DetectionReport report = new DetectionReport(days(0, 1), peaks, 12, 2, 1);
    return new AnalysisResult(report, GlobalStatisticsTable.empty(), RunStage.COLD_START,
      persisted ? RunStage.PERSIST : RunStage.MERGE, persisted, Duration.ofMillis(250));
  }

  @Test
  void runGauges_taggedByAnalyzer() {
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));

    assertEquals(12.0, registry.get("tpeak.run.records.processed").tag("analyzer", "file-type").gauge().value());
    assertEquals(2.0, registry.get("tpeak.run.records.skipped").tag("analyzer", "file-type").gauge().value());
    assertEquals(1.0, registry.get("tpeak.peaks.detected").tag("analyzer", "file-type").gauge().value());
    assertEquals(250.0, registry.get("tpeak.run.duration").tag("analyzer", "file-type").gauge().value());
    assertEquals(1.0, registry.get("tpeak.baseline.persisted").gauge().value());
    assertEquals(4.0, registry.get("tpeak.peak.samp_sub_count_max")
      .tag("index", "malicious").tag("dimension", "exe").gauge().value());
    assertEquals(1.0, registry.get("tpeak.runs").tag("outcome", "ok").counter().count());
  }

  @Test
  void gauges_updatedInPlace() {
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));
    int gauges = reporter.gaugeCount();

    reporter.reportRun("file-type", result(false, key("malicious", "exe")));

    assertEquals(gauges, reporter.gaugeCount());
    assertEquals(0.0, registry.get("tpeak.baseline.persisted").gauge().value());
    assertEquals(1.0, registry.get("tpeak.runs").tag("outcome", "not_persisted").counter().count());
  }

  @Test
  void peakGauges_removedAfterTwoRunsWithoutPeak() {
    reporter.reportRun("file-type", result(true, key("malicious", "exe"), key("benign", "doc")));
    int withBoth = reporter.gaugeCount();

    // first run without the peak only marks its gauges
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));
    assertEquals(withBoth, reporter.gaugeCount());
    assertNotNull(registry.find("tpeak.peak.sub_count").tag("index", "benign").gauge());

    // second run without it removes them
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));
    assertEquals(withBoth - 3, reporter.gaugeCount());
    assertNull(registry.find("tpeak.peak.sub_count").tag("index", "benign").gauge());
    assertNotNull(registry.find("tpeak.peak.sub_count").tag("index", "malicious").gauge());
  }

  @Test
  void markedGauge_keptWhenPeakReturns() {
    reporter.cleanupStaleGauges(Set.of());
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));
    reporter.reportRun("file-type", result(true));
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));
    reporter.reportRun("file-type", result(true, key("malicious", "exe")));

    assertNotNull(registry.find("tpeak.peak.threshold").tag("index", "malicious").gauge());
  }

  @Test
  void failures_counted() {
    reporter.reportFailure("file-type", new IllegalStateException("boom"));
    reporter.reportFailure("file-type", new IllegalStateException("boom"));

    assertEquals(2.0, registry.get("tpeak.runs").tag("outcome", "failed").counter().count());
  }
}
