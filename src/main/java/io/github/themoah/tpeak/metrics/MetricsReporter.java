package io.github.themoah.tpeak.metrics;

import io.github.themoah.tpeak.run.AnalysisResult;
import io.vertx.core.Future;

/**
 * Reports analysis outcomes to a metrics backend.
 */
public interface MetricsReporter {

  /**
   * Records a completed run.
   *
   * @param analyzer the analyzer that ran
   * @param result the run outcome
   */
  void reportRun(String analyzer, AnalysisResult result);

  /**
   * Records a run that failed before producing a report.
   */
  void reportFailure(String analyzer, Throwable cause);

  Future<Void> start();

  Future<Void> close();
}
