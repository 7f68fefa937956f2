package io.github.themoah.tpeak.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Statistics entries keyed by (index, dimension) for one time window. Iteration order is the
 * natural key order.
 *
 * @param window the window the entries were computed over
 * @param entries the per-key statistics
 */
public record StatisticsTable(TimeWindow window, SortedMap<StatisticsKey, StatisticsEntry> entries) {

  public StatisticsTable {
    Objects.requireNonNull(window, "window");
    entries = Collections.unmodifiableSortedMap(
      entries == null ? new TreeMap<>() : new TreeMap<>(entries));
  }

  public static StatisticsTable empty(TimeWindow window) {
    return new StatisticsTable(window, new TreeMap<>());
  }

  public static StatisticsTable of(TimeWindow window, Map<StatisticsKey, StatisticsEntry> entries) {
    return new StatisticsTable(window, new TreeMap<>(entries));
  }

  public Optional<StatisticsEntry> entry(StatisticsKey key) {
    return Optional.ofNullable(entries.get(key));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }
}
