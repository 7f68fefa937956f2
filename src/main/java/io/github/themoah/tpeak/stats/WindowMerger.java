package io.github.themoah.tpeak.stats;

import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.StatisticsTable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds local tables into the global baseline and retires windows that aged out.
 *
 * <p>Per key present on both sides, counts are added and the per-grouping distributions are
 * combined with the weighted parallel formula ({@link StatisticsEntry#merge}); a key present on
 * one side only is carried over unchanged. The baseline keeps each absorbed local table as a
 * segment, so retirement drops the expired segments and replays the rest: the aggregate after
 * retirement is exactly the one that would have been built from the remaining windows alone.
 *
 * <p>A local window starting before the baseline's end (typically a re-run of an analyzed
 * interval) would count the same records twice for the keys the baseline already has. Only its
 * keys unknown to the baseline are absorbed, as a segment of their own.
 */
public class WindowMerger {

  private static final Logger log = LoggerFactory.getLogger(WindowMerger.class);

  private final Duration globalWindow;

  /**
   * @param globalWindow how far back from the newest local window end the baseline reaches
   */
  public WindowMerger(Duration globalWindow) {
    if (globalWindow == null || globalWindow.isZero() || globalWindow.isNegative()) {
      throw new IllegalArgumentException("Global window must be positive: " + globalWindow);
    }
    this.globalWindow = globalWindow;
  }

  public Duration globalWindow() {
    return globalWindow;
  }

  /**
   * Absorbs {@code local} and retires everything ending at or before
   * {@code local.end - globalWindow}.
   *
   * @param global the prior baseline, or null on a cold start
   * @param local the freshly built local table
   * @return the new baseline
   */
  public GlobalStatisticsTable merge(GlobalStatisticsTable global, StatisticsTable local) {
    return merge(global, local, local.window().end().minus(globalWindow));
  }

  /**
   * Absorbs {@code local}, then retires segments ending at or before {@code retireBefore}.
   * An empty local table is the identity: nothing is absorbed and nothing retired.
   *
   * @param global the prior baseline, or null on a cold start
   * @param local the freshly built local table
   * @param retireBefore retirement cutoff, or null to retire nothing
   * @return the new baseline
   */
  public GlobalStatisticsTable merge(
      GlobalStatisticsTable global,
      StatisticsTable local,
      Instant retireBefore
  ) {
    if (local.isEmpty()) {
      log.debug("Local table for {} is empty, baseline unchanged", local.window());
      return global == null ? GlobalStatisticsTable.empty() : global;
    }
    return retire(absorb(global, local), retireBefore);
  }

  /**
   * Adds {@code local} to the baseline without retiring anything.
   */
  public GlobalStatisticsTable absorb(GlobalStatisticsTable global, StatisticsTable local) {
    GlobalStatisticsTable base = global == null ? GlobalStatisticsTable.empty() : global;
    Objects.requireNonNull(local, "local");

    if (local.isEmpty()) {
      log.debug("Local table for {} is empty, baseline unchanged", local.window());
      return base;
    }

    StatisticsTable absorbed = local;
    Instant baseEnd = base.end().orElse(null);
    if (baseEnd != null && local.window().start().isBefore(baseEnd)) {
      absorbed = unseenKeys(base, local);
      log.warn("Local window {} starts before the baseline end {}, absorbing only its {} of {} keys"
        + " new to the baseline", local.window(), baseEnd, absorbed.size(), local.size());
      if (absorbed.isEmpty()) {
        return base;
      }
    }

    List<StatisticsTable> segments = new ArrayList<>(base.segments());
    segments.add(absorbed);
    SortedMap<StatisticsKey, StatisticsEntry> entries = mergeEntries(base.entries(), absorbed.entries());

    log.info("Merged local table {} ({} keys) into baseline: {} keys, {} segments",
      absorbed.window(), absorbed.size(), entries.size(), segments.size());
    return new GlobalStatisticsTable(segments, entries);
  }

  private static StatisticsTable unseenKeys(GlobalStatisticsTable base, StatisticsTable local) {
    SortedMap<StatisticsKey, StatisticsEntry> unseen = new TreeMap<>(local.entries());
    unseen.keySet().removeAll(base.entries().keySet());
    return StatisticsTable.of(local.window(), unseen);
  }

  /**
   * Drops every segment ending at or before {@code retireBefore} and rebuilds the aggregate
   * from the remaining ones.
   */
  public GlobalStatisticsTable retire(GlobalStatisticsTable global, Instant retireBefore) {
    if (retireBefore == null || global.isEmpty()) {
      return global;
    }

    List<StatisticsTable> kept = new ArrayList<>();
    for (StatisticsTable segment : global.segments()) {
      if (segment.window().end().isAfter(retireBefore)) {
        kept.add(segment);
      }
    }

    int retired = global.segments().size() - kept.size();
    if (retired == 0) {
      return global;
    }

    GlobalStatisticsTable replayed = replay(kept);
    log.info("Retired {} baseline segments ending at or before {}, {} keys remain",
      retired, retireBefore, replayed.size());
    return replayed;
  }

  /**
   * Rebuilds a baseline from its segments, oldest first.
   */
  public static GlobalStatisticsTable replay(List<StatisticsTable> segments) {
    SortedMap<StatisticsKey, StatisticsEntry> entries = new TreeMap<>();
    for (StatisticsTable segment : segments) {
      entries = mergeEntries(entries, segment.entries());
    }
    return new GlobalStatisticsTable(segments, entries);
  }

  /**
   * Key-wise union of two entry maps; keys on both sides are combined, older side first.
   */
  public static SortedMap<StatisticsKey, StatisticsEntry> mergeEntries(
      Map<StatisticsKey, StatisticsEntry> older,
      Map<StatisticsKey, StatisticsEntry> newer
  ) {
    SortedMap<StatisticsKey, StatisticsEntry> merged = new TreeMap<>(older);
    newer.forEach((key, entry) -> merged.merge(key, entry, StatisticsEntry::merge));
    return merged;
  }
}
