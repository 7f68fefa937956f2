package io.github.themoah.tpeak.model;

import java.util.Objects;

/**
 * Statistics for one (index, dimension) bucket.
 *
 * @param subCount distinct sub-items seen in the bucket
 * @param sampCount total observations in the bucket
 * @param distribution distinct sub-items per sample-grouping
 */
public record StatisticsEntry(long subCount, long sampCount, SampleDistribution distribution) {

  public StatisticsEntry {
    Objects.requireNonNull(distribution, "distribution");
    if (subCount < 0 || sampCount < subCount) {
      throw new IllegalArgumentException(String.format(
        "Expected sampCount >= subCount >= 0, got sampCount=%d, subCount=%d", sampCount, subCount));
    }
    // a grouping never sees more distinct sub-items than the whole bucket
    if (distribution.max() > subCount) {
      throw new IllegalArgumentException(String.format(
        "Grouping max %d exceeds subCount %d", distribution.max(), subCount));
    }
    if (subCount > 0 && distribution.isEmpty()) {
      throw new IllegalArgumentException("subCount " + subCount + " without any sample grouping");
    }
  }

  public long sampSubCountMax() {
    return distribution.max();
  }

  public double sampSubCountMean() {
    return distribution.mean();
  }

  public double sampSubCountStd() {
    return distribution.stdDev();
  }

  public long groupingCount() {
    return distribution.count();
  }

  /**
   * Share of the bucket's distinct sub-items seen in its busiest grouping. Derived from the
   * current max and sub count, 0 when there are no sub-items.
   */
  public double sampSubRatio() {
    if (subCount <= 0) {
      return 0.0;
    }
    return Math.max(0, distribution.max()) / (double) subCount;
  }

  /**
   * Combines the statistics of two disjoint windows. Sub counts are added, which
   * over-counts sub-items present in both windows.
   */
  public StatisticsEntry merge(StatisticsEntry other) {
    return new StatisticsEntry(
      subCount + other.subCount,
      sampCount + other.sampCount,
      distribution.combine(other.distribution)
    );
  }
}
