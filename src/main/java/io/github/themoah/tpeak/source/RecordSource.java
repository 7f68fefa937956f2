package io.github.themoah.tpeak.source;

import io.github.themoah.tpeak.exception.SourceUnavailableException;
import io.github.themoah.tpeak.model.TelemetryRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the raw records of a closed time range.
 */
public interface RecordSource {

  /**
   * Stable name used to select the source from configuration.
   */
  String type();

  /**
   * Fetches the records with a timestamp in {@code [start, end)}. Records without a timestamp
   * are passed through so the caller can account for them.
   *
   * @param filter optional restriction on attribute values
   * @param start inclusive lower bound
   * @param end exclusive upper bound
   * @return the matching records, empty when nothing matches
   * @throws SourceUnavailableException if the backing data cannot be read
   */
  List<TelemetryRecord> fetch(Optional<RecordFilter> filter, Instant start, Instant end)
    throws SourceUnavailableException;
}
