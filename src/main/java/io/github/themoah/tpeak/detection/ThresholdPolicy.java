package io.github.themoah.tpeak.detection;

import io.github.themoah.tpeak.analyzer.AnalyzerPolicy;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.ThresholdSource;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Resolves the effective threshold for one key.
 *
 * <p>An explicit threshold wins outright. Otherwise the advisor is consulted when the key has
 * history, then the analyzer's default for the index, then the configured default.
 */
public class ThresholdPolicy {

  private final OptionalLong explicit;
  private final ThresholdAdvisor advisor;
  private final AnalyzerPolicy analyzer;
  private final long configuredDefault;

  public ThresholdPolicy(
      OptionalLong explicit,
      ThresholdAdvisor advisor,
      AnalyzerPolicy analyzer,
      long configuredDefault
  ) {
    this.explicit = Objects.requireNonNull(explicit, "explicit");
    this.advisor = Objects.requireNonNull(advisor, "advisor");
    this.analyzer = analyzer;
    this.configuredDefault = configuredDefault;
  }

  public static ThresholdPolicy of(DetectionConfig config, AnalyzerPolicy analyzer, OptionalLong explicit) {
    return new ThresholdPolicy(explicit, ThresholdAdvisor.from(config), analyzer, config.defaultThreshold());
  }

  /**
   * @param key the key being evaluated
   * @param global the key's baseline entry, or null when it has none
   */
  public Threshold resolve(StatisticsKey key, StatisticsEntry global) {
    if (explicit.isPresent()) {
      return new Threshold(explicit.getAsLong(), ThresholdSource.EXPLICIT);
    }
    if (global != null) {
      return new Threshold(advisor.suggest(global), ThresholdSource.ADVISED);
    }
    if (analyzer != null) {
      OptionalLong analyzerDefault = analyzer.defaultThreshold(key.index());
      if (analyzerDefault.isPresent()) {
        return new Threshold(analyzerDefault.getAsLong(), ThresholdSource.ANALYZER_DEFAULT);
      }
    }
    return new Threshold(configuredDefault, ThresholdSource.CONFIGURED_DEFAULT);
  }

  public OptionalLong explicit() {
    return explicit;
  }

  public record Threshold(long value, ThresholdSource source) {
  }
}
