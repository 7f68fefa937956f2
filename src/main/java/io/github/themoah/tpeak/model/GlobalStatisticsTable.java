package io.github.themoah.tpeak.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rolling historical baseline.
 *
 * <p>Keeps every absorbed local table that is still inside the global window (its segments,
 * in absorption order) next to the aggregate over all of them, so that a segment which ages out
 * can be removed exactly. Instances are immutable values: merging returns a new table.
 *
 * <p>A segment normally starts at or after the end of every earlier one. The exception is a
 * late segment holding only keys that no earlier segment has: it may overlap earlier windows
 * because none of its records can have been counted before.
 */
public final class GlobalStatisticsTable {

  private static final GlobalStatisticsTable EMPTY =
    new GlobalStatisticsTable(List.of(), new TreeMap<>());

  private final List<StatisticsTable> segments;
  private final SortedMap<StatisticsKey, StatisticsEntry> entries;

  /**
   * @param segments absorbed local tables in absorption order
   * @param entries aggregate of the segments
   * @throws IllegalArgumentException when a segment overlaps an earlier one and is empty or
   *     shares a key with it
   */
  public GlobalStatisticsTable(
      List<StatisticsTable> segments,
      SortedMap<StatisticsKey, StatisticsEntry> entries
  ) {
    Objects.requireNonNull(segments, "segments");
    Objects.requireNonNull(entries, "entries");
    Set<StatisticsKey> seen = new HashSet<>();
    Instant latestEnd = null;
    for (int i = 0; i < segments.size(); i++) {
      StatisticsTable segment = segments.get(i);
      if (latestEnd != null && segment.window().start().isBefore(latestEnd)
          && (segment.isEmpty() || !Collections.disjoint(seen, segment.entries().keySet()))) {
        throw new IllegalArgumentException("Segment " + i + " " + segment.window()
          + " overlaps earlier segments ending " + latestEnd + " and is not limited to new keys");
      }
      seen.addAll(segment.entries().keySet());
      if (latestEnd == null || segment.window().end().isAfter(latestEnd)) {
        latestEnd = segment.window().end();
      }
    }
    this.segments = List.copyOf(segments);
    this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
  }

  public static GlobalStatisticsTable empty() {
    return EMPTY;
  }

  public List<StatisticsTable> segments() {
    return segments;
  }

  public SortedMap<StatisticsKey, StatisticsEntry> entries() {
    return entries;
  }

  public Optional<StatisticsEntry> entry(StatisticsKey key) {
    return Optional.ofNullable(entries.get(key));
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Start of the oldest window still contributing to the aggregate.
   */
  public Optional<Instant> earliestContribution() {
    return segments.stream().map(segment -> segment.window().start()).min(Comparator.naturalOrder());
  }

  /**
   * Latest end among the absorbed windows.
   */
  public Optional<Instant> end() {
    return segments.stream().map(segment -> segment.window().end()).max(Comparator.naturalOrder());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GlobalStatisticsTable other)) {
      return false;
    }
    return segments.equals(other.segments) && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(segments, entries);
  }

  @Override
  public String toString() {
    return "GlobalStatisticsTable[segments=" + segments.size() + ", keys=" + entries.size()
      + ", earliest=" + earliestContribution().orElse(null) + ", end=" + end().orElse(null) + "]";
  }
}
