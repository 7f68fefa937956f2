package io.github.themoah.tpeak.analyzer;

import static io.github.themoah.tpeak.RecordFixtures.at;
import static io.github.themoah.tpeak.RecordFixtures.file;
import static io.github.themoah.tpeak.RecordFixtures.key;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.exception.UnclassifiableRecordException;
import io.github.themoah.tpeak.model.DimensionValue;
import io.github.themoah.tpeak.model.Index;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.TelemetryRecord;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnalyzerRegistry and the built-in analyzers.
 */
public class AnalyzerRegistryTest {

  private final AnalyzerRegistry registry = AnalyzerRegistry.withDefaults();
  private final Settings settings = Settings.of(Map.of());

  @Test
  void builtInAnalyzers_registered() {
    assertEquals(Set.of("file-type", "origin", "custom"), registry.names());
    assertThrows(IllegalArgumentException.class, () -> registry.create("nope", settings));
  }

  @Test
  void fileType_classifiesBySeverityAndType() throws Exception {
    AnalyzerPolicy fileType = registry.create(AnalyzerRegistry.FILE_TYPE, settings);
    TelemetryRecord record = file(at(0, 0), "malicious", "exe", "a");

    assertEquals(key("malicious", "exe"), fileType.classify(record));
    assertEquals("a", fileType.subItem(record));
    assertEquals(90, fileType.defaultThreshold(Index.of("malicious")).getAsLong());
    assertTrue(fileType.defaultThreshold(Index.of("unknown")).isEmpty());
    assertTrue(fileType.recordFilter().orElseThrow().matches(record));
    assertFalse(fileType.recordFilter().orElseThrow().matches(file(at(0, 0), "suspicious", "exe", "a")));
  }

  @Test
  void origin_twoDimensionsAndSubmitterGrouping() throws Exception {
    AnalyzerPolicy origin = registry.create(AnalyzerRegistry.ORIGIN, settings);
    TelemetryRecord record = new TelemetryRecord(at(0, 0), Map.of(
      "source.origin", "api",
      "task.severity", "malicious",
      "file.llfile_type", "exe",
      "file.sha1", "a",
      "source.user_id", "17"));

    assertEquals(StatisticsKey.of(Index.of("api"), DimensionValue.of("malicious", "exe")), origin.classify(record));
    assertEquals("17", origin.sampleGroupingKey(record));
  }

  @Test
  void missingAttribute_unclassifiable() {
    AnalyzerPolicy fileType = registry.create(AnalyzerRegistry.FILE_TYPE, settings);

    assertThrows(UnclassifiableRecordException.class,
      () -> fileType.classify(new TelemetryRecord(at(0, 0), Map.of("task.severity", "malicious"))));
  }

  @Test
  void customAnalyzer_readsSettings() throws Exception {
    AnalyzerPolicy custom = registry.create(AnalyzerRegistry.CUSTOM, Settings.of(Map.of(
      "TPEAK_CUSTOM_INDEX", "task.severity",
      "TPEAK_CUSTOM_SUB_ITEM", "file.md5",
      "TPEAK_CUSTOM_GROUPING", "hour")));
    TelemetryRecord record = new TelemetryRecord(at(0, 0), Map.of("task.severity", "benign", "file.md5", "m"));

    assertEquals(StatisticsKey.of(Index.of("benign"), DimensionValue.NONE), custom.classify(record));
    assertEquals("m", custom.subItem(record));
    assertEquals("hour", custom.defaultGrouping().name());

    assertThrows(IllegalArgumentException.class, () -> registry.create(AnalyzerRegistry.CUSTOM, settings));
  }

  @Test
  void moreThanTwoDimensions_rejected() {
    assertThrows(IllegalArgumentException.class, () -> AttributeAnalyzerPolicy.builder("wide")
      .index("a")
      .dimensions("b", "c", "d")
      .subItem("e")
      .build());
  }
}
