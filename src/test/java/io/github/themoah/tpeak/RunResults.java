package io.github.themoah.tpeak;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.github.themoah.tpeak.run.RunStage;
import java.time.Duration;
import java.util.List;

/**
 * Canned run outcomes for tests of what happens after a run.
 */
public final class RunResults {

  private RunResults() {
  }

  public static AnalysisResult persisted() {
    return result(true);
  }

  public static AnalysisResult notPersisted() {
    return result(false);
  }

  private static AnalysisResult result(boolean persisted) {
    DetectionReport report = new DetectionReport(RecordFixtures.days(0, 1), List.of(), 0, 0, 0);
    return new AnalysisResult(report, GlobalStatisticsTable.empty(), RunStage.COLD_START,
      persisted ? RunStage.PERSIST : RunStage.MERGE, persisted, Duration.ZERO);
  }
}
