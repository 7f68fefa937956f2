package io.github.themoah.tpeak.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticsEntry.
 */
public class StatisticsEntryTest {

  @Test
  void ratio_maxOverSubCount() {
    StatisticsEntry entry = new StatisticsEntry(11083, 20000,
      new SampleDistribution(30, 426, 120.5, 40.0));

    assertEquals(0.03844, entry.sampSubRatio(), 1e-5);
  }

  @Test
  void ratio_zeroWithoutSubItems() {
    StatisticsEntry entry = new StatisticsEntry(0, 0, SampleDistribution.EMPTY);

    assertEquals(0.0, entry.sampSubRatio());
  }

  @Test
  void sampCountBelowSubCount_rejected() {
    assertThrows(IllegalArgumentException.class,
      () -> new StatisticsEntry(5, 4, SampleDistribution.of(List.of(5))));
    assertThrows(IllegalArgumentException.class,
      () -> new StatisticsEntry(-1, 4, SampleDistribution.EMPTY));
  }

  @Test
  void groupingMaxAboveSubCount_rejected() {
    assertThrows(IllegalArgumentException.class,
      () -> new StatisticsEntry(3, 5, SampleDistribution.of(List.of(4))));
  }

  @Test
  void subItemsWithoutGrouping_rejected() {
    assertThrows(IllegalArgumentException.class,
      () -> new StatisticsEntry(2, 2, SampleDistribution.EMPTY));
  }

  @Test
  void merge_addsCountsAndCombinesDistribution() {
    StatisticsEntry older = new StatisticsEntry(6, 9, SampleDistribution.of(List.of(2, 4)));
    StatisticsEntry newer = new StatisticsEntry(6, 6, SampleDistribution.of(List.of(6)));

    StatisticsEntry merged = older.merge(newer);

    assertEquals(12, merged.subCount());
    assertEquals(15, merged.sampCount());
    assertEquals(3, merged.groupingCount());
    assertEquals(6, merged.sampSubCountMax());
    assertEquals(4.0, merged.sampSubCountMean(), 1e-9);
    assertEquals(Math.sqrt(8.0 / 3.0), merged.sampSubCountStd(), 1e-9);
    // ratio follows the merged fields
    assertEquals(0.5, merged.sampSubRatio(), 1e-9);
  }
}
