package io.github.themoah.tpeak.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A record after classification by an analyzer policy.
 *
 * @param timestamp when the observation happened
 * @param key the (index, dimension) bucket it falls into
 * @param subItem the finer-grained unit being counted (e.g. a file hash)
 * @param groupingKey the sample-grouping the observation belongs to (e.g. its calendar day)
 */
public record Observation(
  Instant timestamp,
  StatisticsKey key,
  String subItem,
  String groupingKey
) {

  public Observation {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(subItem, "subItem");
    Objects.requireNonNull(groupingKey, "groupingKey");
  }
}
