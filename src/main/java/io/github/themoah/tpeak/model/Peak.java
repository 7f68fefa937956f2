package io.github.themoah.tpeak.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Detection result for one local table key.
 *
 * @param key the index and dimension value
 * @param local the local statistics
 * @param global the baseline statistics, or null when the key has no history
 * @param threshold the threshold the local max was compared against
 * @param thresholdSource where the threshold came from
 * @param detected whether the key was classified as a peak
 */
public record Peak(
  StatisticsKey key,
  StatisticsEntry local,
  StatisticsEntry global,
  long threshold,
  ThresholdSource thresholdSource,
  boolean detected
) {

  public Peak {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(local, "local");
    Objects.requireNonNull(thresholdSource, "thresholdSource");
  }

  public Index index() {
    return key.index();
  }

  public DimensionValue dimension() {
    return key.dimension();
  }

  public Optional<StatisticsEntry> globalEntry() {
    return Optional.ofNullable(global);
  }

  public boolean hasBaseline() {
    return global != null;
  }
}
