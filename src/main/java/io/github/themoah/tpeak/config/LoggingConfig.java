package io.github.themoah.tpeak.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the application log level at runtime. The static default comes from
 * {@code logback.xml} and {@code TPEAK_LOG_LEVEL}.
 */
public final class LoggingConfig {

  static final String APP_LOGGER = "io.github.themoah.tpeak";

  private LoggingConfig() {
  }

  public static void setLevel(String level) {
    org.slf4j.Logger logger = LoggerFactory.getLogger(APP_LOGGER);
    if (logger instanceof Logger) {
      Level parsed = Level.toLevel(level, Level.INFO);
      ((Logger) logger).setLevel(parsed);
      logger.debug("Log level set to {}", parsed);
    }
  }
}
