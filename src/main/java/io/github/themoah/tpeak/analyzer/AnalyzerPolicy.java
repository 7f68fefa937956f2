package io.github.themoah.tpeak.analyzer;

import io.github.themoah.tpeak.exception.UnclassifiableRecordException;
import io.github.themoah.tpeak.model.Index;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.github.themoah.tpeak.source.RecordFilter;
import io.github.themoah.tpeak.stats.SampleGrouping;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Decides which record attributes form the index, the dimension and the counted sub-item.
 * The statistics engine only depends on this interface; concrete policies are looked up by
 * name in {@link AnalyzerRegistry}.
 */
public interface AnalyzerPolicy {

  String name();

  /**
   * Maps a record to its (index, dimension) bucket.
   *
   * @throws UnclassifiableRecordException if an index or dimension attribute is missing
   */
  StatisticsKey classify(TelemetryRecord record) throws UnclassifiableRecordException;

  /**
   * Returns the identifier of the sub-item the record counts towards.
   *
   * @throws UnclassifiableRecordException if the sub-item attribute is missing
   */
  String subItem(TelemetryRecord record) throws UnclassifiableRecordException;

  /**
   * Grouping used for the per-grouping distinct sub-item distribution.
   */
  SampleGrouping defaultGrouping();

  default String sampleGroupingKey(TelemetryRecord record) throws UnclassifiableRecordException {
    return defaultGrouping().keyOf(record);
  }

  /**
   * Filter handed to the record source, if the analyzer only looks at part of the data.
   */
  default Optional<RecordFilter> recordFilter() {
    return Optional.empty();
  }

  /**
   * Threshold to use for an index without history, if the analyzer defines one.
   */
  default OptionalLong defaultThreshold(Index index) {
    return OptionalLong.empty();
  }
}
