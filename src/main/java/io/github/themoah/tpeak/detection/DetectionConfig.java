package io.github.themoah.tpeak.detection;

import io.github.themoah.tpeak.config.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for peak detection.
 *
 * @param sigmaMultiplier standard deviation multiplier for the advised threshold (default 2.0)
 * @param conservative whether the advised threshold is floored at the historical max (default true)
 * @param defaultThreshold threshold used when neither history nor the analyzer gives one (default 0)
 * @param minSubCount local distinct sub-item count below which a key is never flagged (default 0, disabled)
 */
public record DetectionConfig(
  double sigmaMultiplier,
  boolean conservative,
  long defaultThreshold,
  long minSubCount
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  private static final double DEFAULT_SIGMA_MULTIPLIER = 2.0;
  private static final boolean DEFAULT_CONSERVATIVE = true;
  private static final long DEFAULT_THRESHOLD = 0;
  private static final long DEFAULT_MIN_SUB_COUNT = 0;

  public DetectionConfig {
    if (sigmaMultiplier < 0 || Double.isNaN(sigmaMultiplier)) {
      throw new IllegalArgumentException("sigmaMultiplier must be >= 0, got " + sigmaMultiplier);
    }
    if (defaultThreshold < 0) {
      throw new IllegalArgumentException("defaultThreshold must be >= 0, got " + defaultThreshold);
    }
  }

  public static DetectionConfig defaults() {
    return new DetectionConfig(DEFAULT_SIGMA_MULTIPLIER, DEFAULT_CONSERVATIVE, DEFAULT_THRESHOLD,
      DEFAULT_MIN_SUB_COUNT);
  }

  public static DetectionConfig fromEnvironment() {
    return from(Settings.fromEnvironment());
  }

  /**
   * Loads configuration from settings.
   *
   * <p>Supported variables:
   * <ul>
   *   <li>TPEAK_SIGMA_MULTIPLIER - Standard deviations above the historical mean (default: 2.0)</li>
   *   <li>TPEAK_CONSERVATIVE_THRESHOLD - Never advise below the historical max (default: true)</li>
   *   <li>TPEAK_DEFAULT_THRESHOLD - Fallback threshold (default: 0)</li>
   *   <li>TPEAK_MIN_SUB_COUNT - Minimum local sub-item count to flag a peak (default: 0)</li>
   * </ul>
   */
  public static DetectionConfig from(Settings settings) {
    double sigma = settings.getDouble("TPEAK_SIGMA_MULTIPLIER", DEFAULT_SIGMA_MULTIPLIER);
    if (sigma < 0 || Double.isNaN(sigma)) {
      log.warn("Invalid value for TPEAK_SIGMA_MULTIPLIER: {}, using default: {}", sigma, DEFAULT_SIGMA_MULTIPLIER);
      sigma = DEFAULT_SIGMA_MULTIPLIER;
    }
    boolean conservative = settings.getBoolean("TPEAK_CONSERVATIVE_THRESHOLD", DEFAULT_CONSERVATIVE);
    long defaultThreshold = settings.getLong("TPEAK_DEFAULT_THRESHOLD", DEFAULT_THRESHOLD);
    if (defaultThreshold < 0) {
      log.warn("Invalid value for TPEAK_DEFAULT_THRESHOLD: {}, using default: {}", defaultThreshold, DEFAULT_THRESHOLD);
      defaultThreshold = DEFAULT_THRESHOLD;
    }
    long minSubCount = settings.getLong("TPEAK_MIN_SUB_COUNT", DEFAULT_MIN_SUB_COUNT);

    DetectionConfig config = new DetectionConfig(sigma, conservative, defaultThreshold, minSubCount);
    log.info("Detection config: sigma={}, conservative={}, defaultThreshold={}, minSubCount={}",
      sigma, conservative, defaultThreshold, minSubCount);
    return config;
  }
}
