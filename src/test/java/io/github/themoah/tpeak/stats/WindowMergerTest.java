package io.github.themoah.tpeak.stats;

import static io.github.themoah.tpeak.RecordFixtures.days;
import static io.github.themoah.tpeak.RecordFixtures.entry;
import static io.github.themoah.tpeak.RecordFixtures.key;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.StatisticsTable;
import io.github.themoah.tpeak.model.TimeWindow;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WindowMerger merge and retirement.
 */
public class WindowMergerTest {

  private final StatisticsKey exe = key("malicious", "exe");
  private final StatisticsKey doc = key("benign", "doc");

  private final WindowMerger merger = new WindowMerger(Duration.ofDays(10));

  private static StatisticsTable table(TimeWindow window, Map<StatisticsKey, StatisticsEntry> entries) {
    return StatisticsTable.of(window, entries);
  }

  @Test
  void coldStart_mergeEqualsLocalTable() {
    StatisticsTable local = table(days(0, 1), Map.of(exe, entry(3, 5, 3)));

    GlobalStatisticsTable merged = merger.merge(null, local);

    assertEquals(local.entries(), merged.entries());
    assertEquals(List.of(local), merged.segments());
    assertEquals(merged, merger.merge(GlobalStatisticsTable.empty(), local));
  }

  @Test
  void merge_addsCountsAndCombinesDistribution() {
    StatisticsTable first = table(days(0, 2), Map.of(exe, entry(6, 9, 2, 4)));
    StatisticsTable second = table(days(2, 3), Map.of(exe, entry(6, 6, 6)));

    GlobalStatisticsTable merged = merger.merge(merger.merge(null, first), second);

    StatisticsEntry entry = merged.entry(exe).orElseThrow();
    assertEquals(12, entry.subCount());
    assertEquals(15, entry.sampCount());
    assertEquals(3, entry.groupingCount());
    assertEquals(6, entry.sampSubCountMax());
    assertEquals(4.0, entry.sampSubCountMean(), 1e-9);
    assertEquals(8.0 / 3.0, entry.distribution().variance(), 1e-9);
  }

  @Test
  void splitWindows_countsAdditive() {
    StatisticsTable l1 = table(days(1, 2), Map.of(exe, entry(3, 5, 3), doc, entry(1, 2, 1)));
    StatisticsTable l2 = table(days(2, 3), Map.of(exe, entry(4, 4, 4)));
    StatisticsTable union = table(days(1, 3), Map.of(exe, entry(7, 9, 3, 4), doc, entry(1, 2, 1)));
    GlobalStatisticsTable global = merger.merge(null, table(days(0, 1), Map.of(exe, entry(2, 2, 2))));

    GlobalStatisticsTable stepwise = merger.merge(merger.merge(global, l1), l2);
    GlobalStatisticsTable once = merger.merge(global, union);

    for (StatisticsKey key : List.of(exe, doc)) {
      assertEquals(once.entry(key).orElseThrow().subCount(), stepwise.entry(key).orElseThrow().subCount());
      assertEquals(once.entry(key).orElseThrow().sampCount(), stepwise.entry(key).orElseThrow().sampCount());
    }
  }

  @Test
  void keyOnOneSide_carriedUnchanged() {
    StatisticsEntry exeEntry = entry(3, 4, 3);
    StatisticsEntry docEntry = entry(2, 2, 1, 1);
    StatisticsTable first = table(days(0, 1), Map.of(exe, exeEntry));
    StatisticsTable second = table(days(1, 2), Map.of(doc, docEntry));

    GlobalStatisticsTable merged = merger.merge(merger.merge(null, first), second);

    assertEquals(exeEntry, merged.entry(exe).orElseThrow());
    assertEquals(docEntry, merged.entry(doc).orElseThrow());
    assertEquals(2, merged.size());
  }

  @Test
  void overlappingWindow_knownKeysNotMergedTwice() {
    StatisticsTable local = table(days(0, 2), Map.of(exe, entry(3, 5, 3)));
    GlobalStatisticsTable once = merger.merge(null, local);

    assertSame(once, merger.merge(once, local));
    assertSame(once, merger.merge(once, table(days(1, 3), Map.of(exe, entry(1, 1, 1)))));
  }

  @Test
  void overlappingWindow_absorbsKeysNewToBaseline() {
    StatisticsEntry docEntry = entry(2, 3, 1, 2);
    GlobalStatisticsTable global = merger.merge(null, table(days(0, 2), Map.of(exe, entry(3, 5, 3))));

    GlobalStatisticsTable merged = merger.merge(global,
      table(days(1, 3), Map.of(exe, entry(1, 1, 1), doc, docEntry)));

    assertEquals(docEntry, merged.entry(doc).orElseThrow());
    // exe was already counted over the overlap
    assertEquals(global.entry(exe), merged.entry(exe));
    assertEquals(2, merged.segments().size());
    assertEquals(List.of(doc), List.copyOf(merged.segments().get(1).entries().keySet()));
    assertEquals(days(1, 3).end(), merged.end().orElseThrow());
    assertEquals(days(0, 1).start(), merged.earliestContribution().orElseThrow());
  }

  @Test
  void overlappingWindow_newKeysRetireWithTheirOwnWindow() {
    WindowMerger threeDays = new WindowMerger(Duration.ofDays(3));
    GlobalStatisticsTable global = threeDays.merge(null, table(days(0, 2), Map.of(exe, entry(3, 5, 3))));
    global = threeDays.merge(global, table(days(1, 3), Map.of(doc, entry(1, 1, 1))));

    // cutoff day 2 retires [0, 2) only
    GlobalStatisticsTable later = threeDays.merge(global, table(days(3, 5), Map.of(exe, entry(4, 4, 4))));

    assertTrue(later.entry(doc).isPresent());
    assertEquals(4, later.entry(exe).orElseThrow().subCount());
    assertEquals(WindowMerger.replay(later.segments()), later);

    // cutoff day 3 retires the late doc segment as well
    GlobalStatisticsTable next = threeDays.merge(later, table(days(5, 6), Map.of(exe, entry(1, 1, 1))));
    assertTrue(next.entry(doc).isEmpty());
    assertEquals(5, next.entry(exe).orElseThrow().subCount());
  }

  @Test
  void emptyLocalTable_identity() {
    GlobalStatisticsTable global = merger.merge(null, table(days(0, 1), Map.of(exe, entry(3, 5, 3))));

    // far enough in the future that merging anything would retire the only segment
    assertSame(global, merger.merge(global, StatisticsTable.empty(days(30, 31))));
    assertTrue(merger.merge(null, StatisticsTable.empty(days(0, 1))).isEmpty());
  }

  @Test
  void retire_equalsRemainingWindowsOnly() {
    StatisticsTable w1 = table(days(0, 1), Map.of(exe, entry(3, 4, 3), doc, entry(1, 1, 1)));
    StatisticsTable w2 = table(days(1, 2), Map.of(exe, entry(5, 8, 5)));
    StatisticsTable w3 = table(days(2, 3), Map.of(exe, entry(2, 2, 2), doc, entry(4, 4, 4)));

    GlobalStatisticsTable all = merger.absorb(merger.absorb(merger.absorb(null, w1), w2), w3);
    GlobalStatisticsTable retired = merger.retire(all, w1.window().end());

    GlobalStatisticsTable expected = merger.absorb(merger.absorb(null, w2), w3);
    assertEquals(expected, retired);
    assertEquals(List.of(w2, w3), retired.segments());
    assertEquals(WindowMerger.replay(List.of(w2, w3)), retired);
  }

  @Test
  void merge_retiresSegmentsOutsideGlobalWindow() {
    WindowMerger twoDays = new WindowMerger(Duration.ofDays(2));
    StatisticsTable w1 = table(days(0, 1), Map.of(doc, entry(1, 1, 1)));
    StatisticsTable w2 = table(days(1, 2), Map.of(exe, entry(5, 8, 5)));
    StatisticsTable w3 = table(days(2, 3), Map.of(exe, entry(2, 2, 2)));

    GlobalStatisticsTable global = twoDays.merge(twoDays.merge(twoDays.merge(null, w1), w2), w3);

    assertEquals(List.of(w2, w3), global.segments());
    // doc only ever appeared in the retired window
    assertTrue(global.entry(doc).isEmpty());
    assertEquals(7, global.entry(exe).orElseThrow().subCount());
    assertEquals(days(1, 3).start(), global.earliestContribution().orElseThrow());
  }

  @Test
  void globalWindow_mustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new WindowMerger(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new WindowMerger(Duration.ofDays(-1)));
  }
}
