package io.github.themoah.tpeak.run;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a completed analysis run.
 *
 * @param report the detection report
 * @param global the baseline after merging the local table
 * @param startMode {@link RunStage#COLD_START} or {@link RunStage#WARM_START}
 * @param finalStage the last stage completed
 * @param baselinePersisted whether the new baseline was saved
 * @param duration wall-clock time of the run
 */
public record AnalysisResult(
  DetectionReport report,
  GlobalStatisticsTable global,
  RunStage startMode,
  RunStage finalStage,
  boolean baselinePersisted,
  Duration duration
) {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_NOT_PERSISTED = 2;

  public AnalysisResult {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(global, "global");
    Objects.requireNonNull(startMode, "startMode");
    Objects.requireNonNull(finalStage, "finalStage");
  }

  public int exitCode() {
    return baselinePersisted ? EXIT_OK : EXIT_NOT_PERSISTED;
  }
}
