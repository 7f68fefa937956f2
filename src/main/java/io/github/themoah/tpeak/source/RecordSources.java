package io.github.themoah.tpeak.source;

import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.model.TelemetryRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates record sources by type name.
 */
public final class RecordSources {

  private static final Logger log = LoggerFactory.getLogger(RecordSources.class);

  public static final List<String> TYPES = List.of(JsonFileRecordSource.TYPE, InMemoryRecordSource.TYPE);

  private RecordSources() {
  }

  /**
   * @param type source type, "json" or "memory"
   * @param input location understood by the source (a file glob for "json")
   * @param settings settings for source-specific options
   * @throws IllegalArgumentException for an unknown type or a missing input
   */
  public static RecordSource create(String type, String input, Settings settings) {
    switch (type) {
      case JsonFileRecordSource.TYPE:
        if (input == null || input.isBlank()) {
          throw new IllegalArgumentException("Record source 'json' needs an input file or glob");
        }
        String timestampAttribute = settings.getString("TPEAK_TIMESTAMP_ATTRIBUTE",
          JsonFileRecordSource.DEFAULT_TIMESTAMP_ATTRIBUTE);
        log.info("Using JSON record source: input={}, timestampAttribute={}", input, timestampAttribute);
        return new JsonFileRecordSource(input, timestampAttribute);
      case InMemoryRecordSource.TYPE:
        return new InMemoryRecordSource();
      default:
        throw new IllegalArgumentException("Unknown record source type '" + type + "', known: " + TYPES);
    }
  }

  /**
   * Whether a record belongs to a fetch: inside {@code [start, end)} or without timestamp, and
   * accepted by the filter.
   */
  static boolean accepts(TelemetryRecord record, Optional<RecordFilter> filter, Instant start, Instant end) {
    Instant ts = record.timestamp();
    if (ts != null && (ts.isBefore(start) || !ts.isBefore(end))) {
      return false;
    }
    return filter.map(f -> f.matches(record)).orElse(true);
  }
}
