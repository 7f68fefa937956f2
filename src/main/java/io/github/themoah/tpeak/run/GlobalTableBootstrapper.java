package io.github.themoah.tpeak.run;

import io.github.themoah.tpeak.analyzer.AnalyzerPolicy;
import io.github.themoah.tpeak.exception.SourceUnavailableException;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.LocalBuildResult;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.github.themoah.tpeak.model.TimeWindow;
import io.github.themoah.tpeak.source.RecordSource;
import io.github.themoah.tpeak.stats.StatisticsTableBuilder;
import io.github.themoah.tpeak.stats.WindowMerger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a missing baseline from the record source, one day at a time over the global
 * window preceding the analyzed window.
 */
public class GlobalTableBootstrapper {

  private static final Logger log = LoggerFactory.getLogger(GlobalTableBootstrapper.class);

  private static final Duration SLICE = Duration.ofDays(1);

  private final AnalyzerPolicy analyzer;
  private final RecordSource source;
  private final StatisticsTableBuilder builder;
  private final WindowMerger merger;

  public GlobalTableBootstrapper(
      AnalyzerPolicy analyzer,
      RecordSource source,
      StatisticsTableBuilder builder,
      WindowMerger merger
  ) {
    this.analyzer = analyzer;
    this.source = source;
    this.builder = builder;
    this.merger = merger;
  }

  /**
   * @param before end of the history to rebuild, usually the start of the analyzed window
   * @return the baseline over {@code [before - globalWindow, before)}
   */
  public GlobalStatisticsTable bootstrap(Instant before) throws SourceUnavailableException {
    TimeWindow history = new TimeWindow(before.minus(merger.globalWindow()), before);
    log.info("Bootstrapping global table from the record source over {}", history);

    GlobalStatisticsTable global = GlobalStatisticsTable.empty();
    for (TimeWindow slice : history.split(SLICE)) {
      List<TelemetryRecord> records = source.fetch(analyzer.recordFilter(), slice.start(), slice.end());
      LocalBuildResult local = builder.build(records, slice);
      global = merger.absorb(global, local.table());
    }

    log.info("Bootstrapped global table: {}", global);
    return global;
  }
}
