package io.github.themoah.tpeak.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.tpeak.config.Settings;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DetectionConfig.
 */
public class DetectionConfigTest {

  @Test
  void nothingSet_usesDefaults() {
    DetectionConfig config = DetectionConfig.from(Settings.of(Map.of()));

    assertEquals(DetectionConfig.defaults(), config);
    assertEquals(2.0, config.sigmaMultiplier());
    assertTrue(config.conservative());
  }

  @Test
  void settings_parsed() {
    DetectionConfig config = DetectionConfig.from(Settings.of(Map.of(
      "TPEAK_SIGMA_MULTIPLIER", "3",
      "TPEAK_CONSERVATIVE_THRESHOLD", "false",
      "TPEAK_DEFAULT_THRESHOLD", "7",
      "TPEAK_MIN_SUB_COUNT", "2")));

    assertEquals(3.0, config.sigmaMultiplier());
    assertFalse(config.conservative());
    assertEquals(7, config.defaultThreshold());
    assertEquals(2, config.minSubCount());
  }

  @Test
  void invalidNumbers_fallBackToDefaults() {
    DetectionConfig config = DetectionConfig.from(Settings.of(Map.of("TPEAK_SIGMA_MULTIPLIER", "lots")));

    assertEquals(2.0, config.sigmaMultiplier());
  }
}
