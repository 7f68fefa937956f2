package io.github.themoah.tpeak.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Aggregation key of a statistics table: an index and one of its dimension values.
 */
public record StatisticsKey(Index index, DimensionValue dimension)
    implements Comparable<StatisticsKey> {

  private static final Comparator<StatisticsKey> ORDER = Comparator
    .comparing(StatisticsKey::index)
    .thenComparing(StatisticsKey::dimension);

  public StatisticsKey {
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(dimension, "dimension");
  }

  public static StatisticsKey of(Index index, DimensionValue dimension) {
    return new StatisticsKey(index, dimension);
  }

  @Override
  public int compareTo(StatisticsKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return index + "|" + dimension;
  }
}
