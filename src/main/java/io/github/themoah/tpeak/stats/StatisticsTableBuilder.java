package io.github.themoah.tpeak.stats;

import io.github.themoah.tpeak.analyzer.AnalyzerPolicy;
import io.github.themoah.tpeak.exception.UnclassifiableRecordException;
import io.github.themoah.tpeak.model.LocalBuildResult;
import io.github.themoah.tpeak.model.Observation;
import io.github.themoah.tpeak.model.SampleDistribution;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.StatisticsTable;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.github.themoah.tpeak.model.TimeWindow;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a local statistics table from the records of one closed time window.
 *
 * <p>Records are grouped by (index, dimension) as classified by the analyzer policy. Within a
 * bucket, {@code sub_count} is the number of distinct sub-items, {@code samp_count} the number
 * of records, and the distribution is taken over the distinct sub-item count of each
 * sample-grouping. The result does not depend on the order of the input.
 */
public class StatisticsTableBuilder {

  private static final Logger log = LoggerFactory.getLogger(StatisticsTableBuilder.class);

  private final AnalyzerPolicy policy;
  // null when the analyzer's own grouping applies
  private final SampleGrouping groupingOverride;

  public StatisticsTableBuilder(AnalyzerPolicy policy) {
    this(policy, null);
  }

  /**
   * @param policy the analyzer classifying records
   * @param groupingOverride grouping to use instead of the analyzer's, or null
   */
  public StatisticsTableBuilder(AnalyzerPolicy policy, SampleGrouping groupingOverride) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.groupingOverride = groupingOverride;
  }

  public SampleGrouping grouping() {
    return groupingOverride != null ? groupingOverride : policy.defaultGrouping();
  }

  /**
   * Aggregates the records inside {@code window}.
   *
   * <p>Records that cannot be classified are skipped and counted; records outside the window
   * are ignored and counted separately. Empty input gives an empty table.
   *
   * @param records the records, in any order
   * @param window the local window
   * @return the local table with its record accounting
   */
  public LocalBuildResult build(Iterable<TelemetryRecord> records, TimeWindow window) {
    Map<StatisticsKey, Bucket> buckets = new HashMap<>();
    long processed = 0;
    long skipped = 0;
    long outsideWindow = 0;

    for (TelemetryRecord record : records) {
      if (record.timestamp() != null && !window.contains(record.timestamp())) {
        outsideWindow++;
        continue;
      }
      Observation observation;
      try {
        observation = observe(record);
      } catch (UnclassifiableRecordException e) {
        skipped++;
        log.trace("Skipping record {}: {}", record.attributes(), e.getMessage());
        continue;
      }
      buckets.computeIfAbsent(observation.key(), k -> new Bucket()).add(observation);
      processed++;
    }

    Map<StatisticsKey, StatisticsEntry> entries = new TreeMap<>();
    for (Map.Entry<StatisticsKey, Bucket> entry : buckets.entrySet()) {
      entries.put(entry.getKey(), entry.getValue().toEntry());
    }

    if (skipped > 0) {
      log.warn("Skipped {} unclassifiable records for analyzer '{}' in window {}",
        skipped, policy.name(), window);
    }
    log.info("Built local table for {} with {} keys from {} records ({} skipped, {} outside window, grouping={})",
      window, entries.size(), processed, skipped, outsideWindow, grouping().name());

    return new LocalBuildResult(StatisticsTable.of(window, entries), processed, skipped, outsideWindow);
  }

  private Observation observe(TelemetryRecord record) throws UnclassifiableRecordException {
    if (record.timestamp() == null) {
      throw UnclassifiableRecordException.missingTimestamp();
    }
    StatisticsKey key = policy.classify(record);
    String subItem = policy.subItem(record);
    String groupingKey = groupingOverride != null
      ? groupingOverride.keyOf(record)
      : policy.sampleGroupingKey(record);
    return new Observation(record.timestamp(), key, subItem, groupingKey);
  }

  /**
   * Accumulator for one (index, dimension) bucket.
   */
  private static final class Bucket {
    private final Set<String> subItems = new HashSet<>();
    // sorted so the distribution is computed in the same order for any input order
    private final Map<String, Set<String>> subItemsPerGrouping = new TreeMap<>();
    private long samples;

    void add(Observation observation) {
      subItems.add(observation.subItem());
      subItemsPerGrouping.computeIfAbsent(observation.groupingKey(), k -> new HashSet<>())
        .add(observation.subItem());
      samples++;
    }

    StatisticsEntry toEntry() {
      List<Integer> perGrouping = new ArrayList<>(subItemsPerGrouping.size());
      for (Set<String> items : subItemsPerGrouping.values()) {
        perGrouping.add(items.size());
      }
      return new StatisticsEntry(subItems.size(), samples, SampleDistribution.of(perGrouping));
    }
  }
}
