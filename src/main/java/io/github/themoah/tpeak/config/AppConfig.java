package io.github.themoah.tpeak.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-level configuration.
 *
 * @param httpPort HTTP server port in service mode
 * @param analysisIntervalMs interval between analyses; 0 runs once and exits
 * @param reporterType metrics registry: prometheus, otlp or simple
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 */
public record AppConfig(
  int httpPort,
  long analysisIntervalMs,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_ANALYSIS_INTERVAL_MS = 0L;
  private static final String DEFAULT_REPORTER = "simple";

  public static AppConfig fromEnvironment() {
    return from(Settings.fromEnvironment());
  }

  /**
   * Loads configuration with defaults.
   *
   * <ul>
   *   <li>HTTP_PORT - HTTP server port (default: 8888)</li>
   *   <li>TPEAK_ANALYSIS_INTERVAL_MS - Service mode interval, 0 for a single run (default: 0)</li>
   *   <li>METRICS_REPORTER - prometheus, otlp or simple (default: simple)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static AppConfig from(Settings settings) {
    int port = settings.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = settings.getLong("TPEAK_ANALYSIS_INTERVAL_MS", DEFAULT_ANALYSIS_INTERVAL_MS);
    if (interval < 0) {
      log.warn("Invalid value for TPEAK_ANALYSIS_INTERVAL_MS: {}, using default: {}", interval,
        DEFAULT_ANALYSIS_INTERVAL_MS);
      interval = DEFAULT_ANALYSIS_INTERVAL_MS;
    }
    String reporter = settings.getString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvmMetrics = settings.getBoolean("METRICS_JVM_ENABLED", false);

    log.info("AppConfig loaded: httpPort={}, analysisIntervalMs={}, reporter={}, jvmMetrics={}",
      port, interval, reporter, jvmMetrics);
    return new AppConfig(port, interval, reporter, jvmMetrics);
  }

  public boolean serviceMode() {
    return analysisIntervalMs > 0;
  }
}
