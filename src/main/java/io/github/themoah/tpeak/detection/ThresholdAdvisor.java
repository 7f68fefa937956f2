package io.github.themoah.tpeak.detection;

import io.github.themoah.tpeak.model.StatisticsEntry;

/**
 * Suggests a threshold from a baseline entry: {@code ceil(mean + k * std)} over the
 * per-grouping distinct sub-item counts, optionally never below the worst value seen.
 */
public class ThresholdAdvisor {

  private final double sigmaMultiplier;
  private final boolean conservative;

  public ThresholdAdvisor(double sigmaMultiplier, boolean conservative) {
    this.sigmaMultiplier = sigmaMultiplier;
    this.conservative = conservative;
  }

  public static ThresholdAdvisor from(DetectionConfig config) {
    return new ThresholdAdvisor(config.sigmaMultiplier(), config.conservative());
  }

  public long suggest(StatisticsEntry global) {
    double bound = global.sampSubCountMean() + sigmaMultiplier * global.sampSubCountStd();
    long threshold = (long) Math.ceil(bound);
    if (conservative) {
      threshold = Math.max(threshold, global.sampSubCountMax());
    }
    return threshold;
  }

  public double sigmaMultiplier() {
    return sigmaMultiplier;
  }

  public boolean conservative() {
    return conservative;
  }
}
