package io.github.themoah.tpeak.model;

import java.util.Collection;

/**
 * Distribution of distinct sub-item counts over sample-groupings: how many groupings
 * contributed, and the max, mean and population standard deviation of their counts.
 *
 * <p>Two distributions over disjoint groupings combine with the parallel formula
 * (count-weighted mean, within-group variance plus between-group mean shift), so the
 * combination equals the distribution computed over the pooled groupings.
 *
 * @param count number of sample-groupings (n)
 * @param max largest per-grouping count
 * @param mean arithmetic mean of the per-grouping counts
 * @param stdDev population standard deviation (divide by n, not n-1)
 */
public record SampleDistribution(long count, long max, double mean, double stdDev) {

  public static final SampleDistribution EMPTY = new SampleDistribution(0, 0, 0.0, 0.0);

  public SampleDistribution {
    if (count < 0 || max < 0 || mean < 0 || stdDev < 0
        || Double.isNaN(mean) || Double.isNaN(stdDev)) {
      throw new IllegalArgumentException(String.format(
        "Distribution fields must be non-negative: count=%d, max=%d, mean=%s, stdDev=%s",
        count, max, mean, stdDev));
    }
  }

  /**
   * Population statistics over the given per-grouping counts. Empty input gives {@link #EMPTY}.
   */
  public static SampleDistribution of(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }

    int n = values.size();
    long max = 0;
    double sum = 0.0;
    for (Number value : values) {
      sum += value.doubleValue();
      max = Math.max(max, value.longValue());
    }
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (Number value : values) {
      double diff = value.doubleValue() - mean;
      sumSquaredDiffs += diff * diff;
    }
    double variance = sumSquaredDiffs / n;

    return new SampleDistribution(n, max, mean, Math.sqrt(variance));
  }

  public double variance() {
    return stdDev * stdDev;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  /**
   * Combines this distribution with one over a disjoint set of groupings.
   */
  public SampleDistribution combine(SampleDistribution other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }

    long n = count + other.count;
    double combinedMean = (count * mean + other.count * other.mean) / n;

    double shiftThis = mean - combinedMean;
    double shiftOther = other.mean - combinedMean;
    double combinedVariance = (count * (variance() + shiftThis * shiftThis)
      + other.count * (other.variance() + shiftOther * shiftOther)) / n;

    // rounding can push a zero variance slightly below zero
    double stdDev = Math.sqrt(Math.max(0.0, combinedVariance));
    return new SampleDistribution(n, Math.max(max, other.max), Math.max(0.0, combinedMean), stdDev);
  }
}
