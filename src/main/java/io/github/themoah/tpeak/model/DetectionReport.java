package io.github.themoah.tpeak.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of evaluating one local window against the baseline.
 *
 * @param window the local window
 * @param evaluations one entry per local key, peaks first by descending local max
 * @param recordsProcessed records aggregated into the local table
 * @param recordsSkipped records that could not be classified
 * @param recordsOutsideWindow records ignored for being outside the window
 */
public record DetectionReport(
  TimeWindow window,
  List<Peak> evaluations,
  long recordsProcessed,
  long recordsSkipped,
  long recordsOutsideWindow
) {

  public DetectionReport {
    Objects.requireNonNull(window, "window");
    evaluations = List.copyOf(evaluations);
  }

  /**
   * Evaluations with a positive verdict, in ranking order.
   */
  public List<Peak> peaks() {
    return evaluations.stream()
      .filter(Peak::detected)
      .collect(Collectors.toList());
  }
}
