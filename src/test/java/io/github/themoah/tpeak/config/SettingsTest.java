package io.github.themoah.tpeak.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for Settings layering and typed lookups.
 */
public class SettingsTest {

  @TempDir
  Path dir;

  @Test
  void precedence_overridesThenEnvironmentThenFile() throws Exception {
    Path file = dir.resolve("tpeak.properties");
    Files.writeString(file, "tpeak.analyzer=origin\ntpeak.input=from-file.json\ntpeak.delta.days=3\n");

    Settings settings = Settings.of(Map.of("TPEAK_INPUT", "from-env.json", "TPEAK_ANALYZER", "custom"))
      .withPropertiesFile(file)
      .withOverrides(Map.of("TPEAK_ANALYZER", "file-type"));

    assertEquals("file-type", settings.getString("TPEAK_ANALYZER", null));
    assertEquals("from-env.json", settings.getString("TPEAK_INPUT", null));
    assertEquals(3, settings.getInt("TPEAK_DELTA_DAYS", 1));
  }

  @Test
  void blankValue_treatedAsUnset() {
    Settings settings = Settings.of(Map.of("TPEAK_INPUT", "  "));

    assertTrue(settings.get("TPEAK_INPUT").isEmpty());
    assertEquals("fallback", settings.getString("TPEAK_INPUT", "fallback"));
  }

  @Test
  void invalidNumber_usesDefault() {
    Settings settings = Settings.of(Map.of("HTTP_PORT", "eighty", "TPEAK_SIGMA_MULTIPLIER", "x"));

    assertEquals(8888, settings.getInt("HTTP_PORT", 8888));
    assertEquals(2.0, settings.getDouble("TPEAK_SIGMA_MULTIPLIER", 2.0));
  }

  @Test
  void list_splitsOnCommas() {
    Settings settings = Settings.of(Map.of("TPEAK_CUSTOM_INDEX", "source.origin, task.severity,,"));

    assertEquals(List.of("source.origin", "task.severity"), settings.getList("TPEAK_CUSTOM_INDEX", List.of()));
  }

  @Test
  void propertyKey_lowercaseDotted() {
    assertEquals("tpeak.global.window.days", Settings.propertyKey("TPEAK_GLOBAL_WINDOW_DAYS"));
  }
}
