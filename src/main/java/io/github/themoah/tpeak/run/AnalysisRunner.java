package io.github.themoah.tpeak.run;

import io.github.themoah.tpeak.analyzer.AnalyzerPolicy;
import io.github.themoah.tpeak.analyzer.AnalyzerRegistry;
import io.github.themoah.tpeak.config.AnalysisConfig;
import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.detection.DetectionConfig;
import io.github.themoah.tpeak.detection.PeakDetector;
import io.github.themoah.tpeak.detection.ThresholdPolicy;
import io.github.themoah.tpeak.exception.AnalysisException;
import io.github.themoah.tpeak.exception.TableStoreException;
import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.LocalBuildResult;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.github.themoah.tpeak.model.TimeWindow;
import io.github.themoah.tpeak.source.RecordSource;
import io.github.themoah.tpeak.source.RecordSources;
import io.github.themoah.tpeak.stats.SampleGrouping;
import io.github.themoah.tpeak.stats.StatisticsTableBuilder;
import io.github.themoah.tpeak.stats.WindowMerger;
import io.github.themoah.tpeak.store.JsonFileTableStore;
import io.github.themoah.tpeak.store.TableStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one analysis run: load the baseline, build the local table, detect peaks, merge and
 * persist.
 *
 * <p>The stored baseline is only replaced after every in-memory stage has completed. A source
 * or load failure aborts the run before anything is written; a save failure keeps the report
 * and marks the baseline as not persisted.
 */
public class AnalysisRunner {

  private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

  private final AnalyzerPolicy analyzer;
  private final RecordSource source;
  private final TableStore store;
  private final StatisticsTableBuilder builder;
  private final PeakDetector detector;
  private final WindowMerger merger;
  private final PeakReportWriter reportWriter;
  private final Path reportPath;
  private final GlobalTableBootstrapper bootstrapper;

  /**
   * @param reportPath where to write the peak report, or null for none
   * @param bootstrapOnColdStart whether a missing baseline is rebuilt from the source
   */
  public AnalysisRunner(
      AnalyzerPolicy analyzer,
      RecordSource source,
      TableStore store,
      StatisticsTableBuilder builder,
      PeakDetector detector,
      WindowMerger merger,
      Path reportPath,
      boolean bootstrapOnColdStart
  ) {
    this.analyzer = analyzer;
    this.source = source;
    this.store = store;
    this.builder = builder;
    this.detector = detector;
    this.merger = merger;
    this.reportWriter = new PeakReportWriter();
    this.reportPath = reportPath;
    this.bootstrapper = bootstrapOnColdStart
      ? new GlobalTableBootstrapper(analyzer, source, builder, merger)
      : null;
  }

  /**
   * Wires a runner from configuration.
   *
   * @throws IllegalArgumentException for an unknown analyzer, source type or grouping
   */
  public static AnalysisRunner create(AnalysisConfig config, DetectionConfig detection, Settings settings) {
    AnalyzerPolicy analyzer = AnalyzerRegistry.withDefaults().create(config.analyzer(), settings);
    RecordSource source = RecordSources.create(config.sourceType(), config.input(), settings);
    SampleGrouping grouping = config.grouping() == null ? null : SampleGrouping.parse(config.grouping());
    return new AnalysisRunner(
      analyzer,
      source,
      new JsonFileTableStore(config.tablePath()),
      new StatisticsTableBuilder(analyzer, grouping),
      new PeakDetector(detection),
      new WindowMerger(config.globalWindow()),
      config.reportPath(),
      config.bootstrapOnColdStart()
    );
  }

  /**
   * Runs the analysis of {@code window}.
   *
   * @param window the local window
   * @param threshold explicit threshold, overriding the advisor for every key
   * @return the report and the new baseline
   * @throws AnalysisException if the records or the stored baseline cannot be read
   */
  public AnalysisResult run(TimeWindow window, OptionalLong threshold) throws AnalysisException {
    long startNanos = System.nanoTime();
    log.info("Loading peak analyzer '{}' for {} with threshold={}", analyzer.name(), window,
      threshold.isPresent() ? threshold.getAsLong() : "advised");

    log.info("Loading global table from {}", store.location());
    Optional<GlobalStatisticsTable> loaded = store.load();
    RunStage startMode = loaded.isPresent() ? RunStage.WARM_START : RunStage.COLD_START;
    GlobalStatisticsTable baseline = loaded.orElseGet(GlobalStatisticsTable::empty);
    if (loaded.isEmpty() && bootstrapper != null) {
      baseline = bootstrapper.bootstrap(window.start());
    }
    log.debug("Stage {}: baseline {}", startMode, baseline);

    log.debug("Stage {}", RunStage.LOCAL_BUILD);
    List<TelemetryRecord> records = source.fetch(analyzer.recordFilter(), window.start(), window.end());
    LocalBuildResult local = builder.build(records, window);

    log.debug("Stage {}", RunStage.DETECT);
    ThresholdPolicy thresholds = ThresholdPolicy.of(detector.config(), analyzer, threshold);
    DetectionReport report = detector.report(local, baseline, thresholds);
    reportWriter.log(report);
    if (reportPath != null) {
      writeReport(report);
    }

    log.debug("Stage {}", RunStage.MERGE);
    GlobalStatisticsTable merged = merger.merge(baseline, local.table());

    boolean persisted = persist(merged);
    RunStage finalStage = persisted ? RunStage.PERSIST : RunStage.MERGE;
    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
    log.info("Analysis of {} finished in {}ms: {} peaks, baseline {} ({})", window, duration.toMillis(),
      report.peaks().size(), persisted ? "saved" : "NOT saved", merged);

    return new AnalysisResult(report, merged, startMode, finalStage, persisted, duration);
  }

  private void writeReport(DetectionReport report) {
    try {
      reportWriter.write(report, reportPath);
    } catch (IOException e) {
      log.error("Failed to write peak report to {}", reportPath, e);
    }
  }

  private boolean persist(GlobalStatisticsTable merged) {
    log.info("Saving global table to {}", store.location());
    try {
      store.save(merged);
      return true;
    } catch (TableStoreException e) {
      log.error("Baseline not advanced: {}", e.getMessage(), e);
      return false;
    }
  }

  public AnalyzerPolicy analyzer() {
    return analyzer;
  }
}
