package io.github.themoah.tpeak.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layered lookup of configuration values by environment-variable name.
 *
 * <p>Precedence: command-line overrides, then environment variables, then the properties
 * file, then the caller's default. A variable {@code TPEAK_GLOBAL_WINDOW_DAYS} is looked up
 * in the properties file as {@code tpeak.global.window.days}. Malformed numbers are logged
 * and replaced by the default.
 */
public final class Settings {

  private static final Logger log = LoggerFactory.getLogger(Settings.class);

  public static final String DEFAULT_PROPERTIES_FILE = "tpeak.properties";

  private final Map<String, String> overrides;
  private final Map<String, String> environment;
  private final Properties properties;

  private Settings(Map<String, String> overrides, Map<String, String> environment, Properties properties) {
    this.overrides = Map.copyOf(overrides);
    this.environment = Map.copyOf(environment);
    this.properties = properties;
  }

  /**
   * Settings backed by the process environment and the default properties file, if present.
   */
  public static Settings fromEnvironment() {
    return new Settings(Map.of(), System.getenv(), loadDefaultProperties());
  }

  /**
   * Settings backed only by the given values, for tests and embedding.
   */
  public static Settings of(Map<String, String> values) {
    return new Settings(Map.of(), values, new Properties());
  }

  /**
   * Returns a copy that reads the given properties file as its lowest-precedence layer.
   */
  public Settings withPropertiesFile(Path file) throws IOException {
    Properties loaded = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      loaded.load(reader);
    }
    log.info("Loaded {} settings from {}", loaded.size(), file);
    return new Settings(overrides, environment, loaded);
  }

  /**
   * Returns a copy where the given values take precedence over every other layer.
   */
  public Settings withOverrides(Map<String, String> values) {
    Map<String, String> merged = new HashMap<>(overrides);
    merged.putAll(values);
    return new Settings(merged, environment, properties);
  }

  public Optional<String> get(String name) {
    String value = overrides.get(name);
    if (isBlank(value)) {
      value = environment.get(name);
    }
    if (isBlank(value)) {
      value = properties.getProperty(propertyKey(name));
    }
    return isBlank(value) ? Optional.empty() : Optional.of(value.trim());
  }

  public String getString(String name, String defaultValue) {
    return get(name).orElse(defaultValue);
  }

  public int getInt(String name, int defaultValue) {
    Optional<String> value = get(name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value.get(), defaultValue);
      return defaultValue;
    }
  }

  public long getLong(String name, long defaultValue) {
    Optional<String> value = get(name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.get());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value.get(), defaultValue);
      return defaultValue;
    }
  }

  public double getDouble(String name, double defaultValue) {
    Optional<String> value = get(name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.get());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value.get(), defaultValue);
      return defaultValue;
    }
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    return get(name).map(Boolean::parseBoolean).orElse(defaultValue);
  }

  /**
   * Comma-separated list, blank items dropped.
   */
  public List<String> getList(String name, List<String> defaultValue) {
    return get(name)
      .map(value -> Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .collect(Collectors.toList()))
      .orElse(defaultValue);
  }

  static String propertyKey(String name) {
    return name.toLowerCase(Locale.ROOT).replace('_', '.');
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static Properties loadDefaultProperties() {
    Properties props = new Properties();
    Path local = Path.of(DEFAULT_PROPERTIES_FILE);
    if (Files.isRegularFile(local)) {
      try (Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
        props.load(reader);
        log.info("Loaded settings from {}", local.toAbsolutePath());
        return props;
      } catch (IOException e) {
        log.warn("Could not read {}: {}", local.toAbsolutePath(), e.getMessage());
      }
    }
    try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
      if (in != null) {
        props.load(in);
        log.info("Loaded settings from classpath:{}", DEFAULT_PROPERTIES_FILE);
      }
    } catch (IOException e) {
      log.warn("Could not read classpath:{}: {}", DEFAULT_PROPERTIES_FILE, e.getMessage());
    }
    return props;
  }
}
