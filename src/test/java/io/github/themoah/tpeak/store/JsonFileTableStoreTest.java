package io.github.themoah.tpeak.store;

import static io.github.themoah.tpeak.RecordFixtures.days;
import static io.github.themoah.tpeak.RecordFixtures.entry;
import static io.github.themoah.tpeak.RecordFixtures.key;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.tpeak.exception.CorruptTableException;
import io.github.themoah.tpeak.exception.TableStoreException;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.StatisticsTable;
import io.github.themoah.tpeak.stats.WindowMerger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for JsonFileTableStore.
 */
public class JsonFileTableStoreTest {

  @TempDir
  Path dir;

  private static GlobalStatisticsTable twoSegments() {
    WindowMerger merger = new WindowMerger(Duration.ofDays(10));
    GlobalStatisticsTable first = merger.merge(null, StatisticsTable.of(days(0, 1), Map.of(
      key("malicious", "exe"), entry(3, 5, 3),
      key("benign", "doc"), entry(2, 2, 1, 1))));
    return merger.merge(first, StatisticsTable.of(days(1, 2), Map.of(
      key("malicious", "exe"), entry(7, 9, 4, 3))));
  }

  @Test
  void missingFile_coldStart() throws Exception {
    JsonFileTableStore store = new JsonFileTableStore(dir.resolve("global_table.json"));

    assertTrue(store.load().isEmpty());
  }

  @Test
  void save_thenLoadEqual() throws Exception {
    JsonFileTableStore store = new JsonFileTableStore(dir.resolve("nested/global_table.json"));
    GlobalStatisticsTable table = twoSegments();

    store.save(table);
    GlobalStatisticsTable loaded = store.load().orElseThrow();

    assertEquals(table, loaded);
    assertEquals(2, loaded.segments().size());
    // no temporary files left next to the table
    try (Stream<Path> files = Files.list(dir.resolve("nested"))) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void invalidJson_corrupt() throws Exception {
    Path file = dir.resolve("global_table.json");
    Files.writeString(file, "{\"format\": 1, \"segments\": [");

    assertThrows(CorruptTableException.class, () -> new JsonFileTableStore(file).load());
  }

  @Test
  void missingField_corrupt() throws Exception {
    Path file = dir.resolve("global_table.json");
    Files.writeString(file, "{\"format\": 1, \"segments\": [{\"start\": \"2021-03-01T00:00:00Z\", "
      + "\"end\": \"2021-03-02T00:00:00Z\", \"entries\": [{\"index\": [\"malicious\"], \"dimension\": [\"exe\"], "
      + "\"sub_count\": 3, \"samp_count\": 5, \"grouping_count\": 1, \"samp_sub_count_max\": 3, "
      + "\"samp_sub_count_mean\": 3.0}]}]}");

    assertThrows(CorruptTableException.class, () -> new JsonFileTableStore(file).load());
  }

  @Test
  void invariantViolation_corrupt() throws Exception {
    Path file = dir.resolve("global_table.json");
    // samp_count below sub_count
    Files.writeString(file, "{\"format\": 1, \"segments\": [{\"start\": \"2021-03-01T00:00:00Z\", "
      + "\"end\": \"2021-03-02T00:00:00Z\", \"entries\": [{\"index\": [\"malicious\"], \"dimension\": [\"exe\"], "
      + "\"sub_count\": 5, \"samp_count\": 3, \"grouping_count\": 1, \"samp_sub_count_max\": 3, "
      + "\"samp_sub_count_mean\": 3.0, \"samp_sub_count_std\": 0.0}]}]}");

    assertThrows(CorruptTableException.class, () -> new JsonFileTableStore(file).load());
  }

  @Test
  void unknownFormat_corrupt() throws Exception {
    Path file = dir.resolve("global_table.json");
    Files.writeString(file, "{\"format\": 99, \"segments\": []}");

    assertThrows(CorruptTableException.class, () -> new JsonFileTableStore(file).load());
  }

  @Test
  void failedSave_leavesPreviousContent() throws Exception {
    // a non-empty directory where the table file should go cannot be replaced
    Path target = dir.resolve("global_table.json");
    Files.createDirectories(target);
    Files.writeString(target.resolve("keep.txt"), "previous");

    JsonFileTableStore store = new JsonFileTableStore(target);

    assertThrows(TableStoreException.class, () -> store.save(twoSegments()));
    assertEquals("previous", Files.readString(target.resolve("keep.txt")));
    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(1, files.count());
    }
  }
}
