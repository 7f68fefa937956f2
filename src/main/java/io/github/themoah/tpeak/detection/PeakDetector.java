package io.github.themoah.tpeak.detection;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.LocalBuildResult;
import io.github.themoah.tpeak.model.Peak;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.StatisticsTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies local table keys as peaks against the baseline.
 *
 * <p>A key is a peak when its local {@code samp_sub_count_max} is strictly above the effective
 * threshold and its local {@code sub_count} reaches the configured minimum. Keys without
 * history are compared against a zero baseline, so any local activity above the fallback
 * threshold is a candidate. Results are ordered by descending local max, then index, then
 * dimension value.
 */
public class PeakDetector {

  private static final Logger log = LoggerFactory.getLogger(PeakDetector.class);

  static final Comparator<Peak> RANKING = Comparator
    .comparingLong((Peak peak) -> peak.local().sampSubCountMax()).reversed()
    .thenComparing(Peak::key);

  private final DetectionConfig config;

  public PeakDetector(DetectionConfig config) {
    this.config = config;
  }

  /**
   * Evaluates every local key.
   *
   * @param local the local table
   * @param global the baseline, or null on a cold start
   * @param thresholds threshold resolution for this run
   * @return one verdict per local key, in ranking order
   */
  public List<Peak> evaluate(StatisticsTable local, GlobalStatisticsTable global, ThresholdPolicy thresholds) {
    List<Peak> evaluations = new ArrayList<>(local.size());

    for (Map.Entry<StatisticsKey, StatisticsEntry> entry : local.entries().entrySet()) {
      StatisticsKey key = entry.getKey();
      StatisticsEntry localEntry = entry.getValue();
      StatisticsEntry globalEntry = global == null ? null : global.entry(key).orElse(null);

      ThresholdPolicy.Threshold threshold = thresholds.resolve(key, globalEntry);
      boolean detected = localEntry.sampSubCountMax() > threshold.value()
        && localEntry.subCount() >= config.minSubCount();

      evaluations.add(new Peak(key, localEntry, globalEntry, threshold.value(), threshold.source(), detected));

      if (detected) {
        log.debug("Peak detected: key={}, max={}, threshold={} ({}), subCount={}",
          key, localEntry.sampSubCountMax(), threshold.value(), threshold.source(), localEntry.subCount());
      }
    }

    evaluations.sort(RANKING);
    return evaluations;
  }

  /**
   * Returns only the keys classified as peaks, in ranking order.
   */
  public List<Peak> detect(StatisticsTable local, GlobalStatisticsTable global, ThresholdPolicy thresholds) {
    return evaluate(local, global, thresholds).stream()
      .filter(Peak::detected)
      .collect(Collectors.toList());
  }

  /**
   * Evaluates a freshly built local table and bundles the verdicts with its record accounting.
   */
  public DetectionReport report(LocalBuildResult local, GlobalStatisticsTable global, ThresholdPolicy thresholds) {
    List<Peak> evaluations = evaluate(local.table(), global, thresholds);
    long peaks = evaluations.stream().filter(Peak::detected).count();
    if (peaks > 0) {
      log.info("Detected {} peaks out of {} keys in {}", peaks, evaluations.size(), local.table().window());
    } else {
      log.info("No peaks out of {} keys in {}", evaluations.size(), local.table().window());
    }
    return new DetectionReport(local.table().window(), evaluations, local.processed(), local.skipped(),
      local.outsideWindow());
  }

  public DetectionConfig config() {
    return config;
  }
}
