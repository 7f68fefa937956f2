package io.github.themoah.tpeak.config;

import io.github.themoah.tpeak.analyzer.AnalyzerRegistry;
import io.github.themoah.tpeak.model.TimeWindow;
import io.github.themoah.tpeak.source.JsonFileRecordSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What to analyze and where the baseline lives.
 *
 * @param analyzer registered analyzer name
 * @param sourceType record source type
 * @param input record source input (file glob for the JSON source)
 * @param tablePath global table file
 * @param globalWindow how much history the baseline keeps
 * @param startDate explicit window start, or null
 * @param endDate explicit window end, or null
 * @param deltaDays trailing window length in days when no explicit dates are given
 * @param delayDays days between the trailing window end and today
 * @param threshold explicit threshold overriding the advisor
 * @param grouping sample grouping overriding the analyzer's, or null
 * @param reportPath peak report output file, or null
 * @param bootstrapOnColdStart whether a missing baseline is rebuilt from the source
 */
public record AnalysisConfig(
  String analyzer,
  String sourceType,
  String input,
  Path tablePath,
  Duration globalWindow,
  LocalDate startDate,
  LocalDate endDate,
  int deltaDays,
  int delayDays,
  OptionalLong threshold,
  String grouping,
  Path reportPath,
  boolean bootstrapOnColdStart
) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  private static final String DEFAULT_ANALYZER = AnalyzerRegistry.FILE_TYPE;
  private static final String DEFAULT_SOURCE = JsonFileRecordSource.TYPE;
  private static final String DEFAULT_TABLE_PATH = "global_table.json";
  private static final int DEFAULT_GLOBAL_WINDOW_DAYS = 10;
  private static final int DEFAULT_DELTA_DAYS = 1;
  private static final int DEFAULT_DELAY_DAYS = 0;

  /**
   * Loads configuration from settings.
   *
   * <p>Supported variables:
   * <ul>
   *   <li>TPEAK_ANALYZER - Analyzer name (default: file-type)</li>
   *   <li>TPEAK_SOURCE - Record source type (default: json)</li>
   *   <li>TPEAK_INPUT - Record source input, e.g. a file glob</li>
   *   <li>TPEAK_TABLE_PATH - Global table file (default: global_table.json)</li>
   *   <li>TPEAK_GLOBAL_WINDOW_DAYS - Days of history kept in the baseline (default: 10)</li>
   *   <li>TPEAK_START_DATE / TPEAK_END_DATE - Explicit window, yyyy-MM-dd</li>
   *   <li>TPEAK_DELTA_DAYS - Trailing window length (default: 1)</li>
   *   <li>TPEAK_DELAY_DAYS - Trailing window delay (default: 0)</li>
   *   <li>TPEAK_THRESHOLD - Explicit threshold</li>
   *   <li>TPEAK_GROUPING - Sample grouping: day, hour or attr:&lt;name&gt;</li>
   *   <li>TPEAK_REPORT_PATH - Peak report output file</li>
   *   <li>TPEAK_BOOTSTRAP - Rebuild a missing baseline from the source (default: false)</li>
   * </ul>
   */
  public static AnalysisConfig from(Settings settings) {
    int globalWindowDays = settings.getInt("TPEAK_GLOBAL_WINDOW_DAYS", DEFAULT_GLOBAL_WINDOW_DAYS);
    if (globalWindowDays < 1) {
      log.warn("Invalid value for TPEAK_GLOBAL_WINDOW_DAYS: {}, using default: {}",
        globalWindowDays, DEFAULT_GLOBAL_WINDOW_DAYS);
      globalWindowDays = DEFAULT_GLOBAL_WINDOW_DAYS;
    }

    OptionalLong threshold = settings.get("TPEAK_THRESHOLD")
      .map(AnalysisConfig::parseThreshold)
      .orElse(OptionalLong.empty());

    AnalysisConfig config = new AnalysisConfig(
      settings.getString("TPEAK_ANALYZER", DEFAULT_ANALYZER),
      settings.getString("TPEAK_SOURCE", DEFAULT_SOURCE),
      settings.getString("TPEAK_INPUT", null),
      Path.of(settings.getString("TPEAK_TABLE_PATH", DEFAULT_TABLE_PATH)),
      Duration.ofDays(globalWindowDays),
      parseDate(settings, "TPEAK_START_DATE"),
      parseDate(settings, "TPEAK_END_DATE"),
      settings.getInt("TPEAK_DELTA_DAYS", DEFAULT_DELTA_DAYS),
      settings.getInt("TPEAK_DELAY_DAYS", DEFAULT_DELAY_DAYS),
      threshold,
      settings.getString("TPEAK_GROUPING", null),
      settings.get("TPEAK_REPORT_PATH").map(Path::of).orElse(null),
      settings.getBoolean("TPEAK_BOOTSTRAP", false)
    );

    log.info("Analysis config: analyzer={}, source={}, input={}, table={}, globalWindow={}d, threshold={}",
      config.analyzer(), config.sourceType(), config.input(), config.tablePath(), globalWindowDays,
      threshold.isPresent() ? threshold.getAsLong() : "advised");
    return config;
  }

  /**
   * The window to analyze now.
   *
   * @throws IllegalArgumentException if the dates do not form a valid window
   */
  public TimeWindow window(Clock clock) {
    return TimeWindow.resolve(startDate, endDate, deltaDays, delayDays, clock);
  }

  private static OptionalLong parseThreshold(String value) {
    try {
      long parsed = Long.parseLong(value);
      if (parsed >= 0) {
        return OptionalLong.of(parsed);
      }
    } catch (NumberFormatException e) {
      log.warn("Invalid value for TPEAK_THRESHOLD: '{}', using advised thresholds", value);
      return OptionalLong.empty();
    }
    log.warn("Negative TPEAK_THRESHOLD {}, using advised thresholds", value);
    return OptionalLong.empty();
  }

  private static LocalDate parseDate(Settings settings, String name) {
    Optional<String> value = settings.get(name);
    if (value.isEmpty()) {
      return null;
    }
    try {
      return LocalDate.parse(value.get());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Not a valid date for " + name + ": '" + value.get() + "'", e);
    }
  }
}
