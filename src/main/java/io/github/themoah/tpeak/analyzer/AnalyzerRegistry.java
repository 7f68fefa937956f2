package io.github.themoah.tpeak.analyzer;

import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.model.Index;
import io.github.themoah.tpeak.stats.SampleGrouping;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps stable analyzer names to policy factories.
 */
public final class AnalyzerRegistry {

  private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

  public static final String FILE_TYPE = "file-type";
  public static final String ORIGIN = "origin";
  public static final String CUSTOM = "custom";

  private final Map<String, Function<Settings, AnalyzerPolicy>> factories = new TreeMap<>();

  /**
   * Registry holding the built-in analyzers.
   */
  public static AnalyzerRegistry withDefaults() {
    AnalyzerRegistry registry = new AnalyzerRegistry();
    registry.register(FILE_TYPE, settings -> fileType());
    registry.register(ORIGIN, settings -> origin());
    registry.register(CUSTOM, settings -> AttributeAnalyzerPolicy.fromSettings(CUSTOM, settings));
    return registry;
  }

  public void register(String name, Function<Settings, AnalyzerPolicy> factory) {
    factories.put(name, factory);
  }

  public Set<String> names() {
    return factories.keySet();
  }

  /**
   * Creates the analyzer registered under {@code name}.
   *
   * @throws IllegalArgumentException if no analyzer has that name
   */
  public AnalyzerPolicy create(String name, Settings settings) {
    Function<Settings, AnalyzerPolicy> factory = factories.get(name);
    if (factory == null) {
      throw new IllegalArgumentException("Unknown analyzer '" + name + "', known: " + names());
    }
    AnalyzerPolicy policy = factory.apply(settings);
    log.info("Loading analyzer '{}': {}", name, policy);
    return policy;
  }

  /**
   * File types per severity: how many distinct files of a type show up per day.
   */
  public static AnalyzerPolicy fileType() {
    return AttributeAnalyzerPolicy.builder(FILE_TYPE)
      .index("task.severity")
      .dimensions("file.llfile_type")
      .subItem("file.sha1")
      .grouping(SampleGrouping.byDay())
      .allowValues("task.severity", Set.of("malicious", "benign"))
      .defaultThreshold(Index.of("malicious"), 90)
      .defaultThreshold(Index.of("benign"), 500)
      .build();
  }

  /**
   * Submission origins split by severity and file type, distinct files per submitter.
   */
  public static AnalyzerPolicy origin() {
    return AttributeAnalyzerPolicy.builder(ORIGIN)
      .index("source.origin")
      .dimensions("task.severity", "file.llfile_type")
      .subItem("file.sha1")
      .grouping(SampleGrouping.byAttribute("source.user_id"))
      .build();
  }
}
