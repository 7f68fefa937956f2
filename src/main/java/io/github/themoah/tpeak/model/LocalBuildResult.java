package io.github.themoah.tpeak.model;

import java.util.Objects;

/**
 * A freshly built local table and the record accounting behind it.
 *
 * @param table the local statistics table
 * @param processed records aggregated into the table
 * @param skipped records excluded because they could not be classified
 * @param outsideWindow records ignored because their timestamp is outside the window
 */
public record LocalBuildResult(
  StatisticsTable table,
  long processed,
  long skipped,
  long outsideWindow
) {

  public LocalBuildResult {
    Objects.requireNonNull(table, "table");
  }

  public long total() {
    return processed + skipped + outsideWindow;
  }
}
