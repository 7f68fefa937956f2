package io.github.themoah.tpeak.model;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One raw telemetry observation as handed over by a record source.
 *
 * @param timestamp when the observation happened, or null if the source document had none
 * @param attributes flat attribute bag (nested documents are flattened with dots)
 */
public record TelemetryRecord(Instant timestamp, Map<String, String> attributes) {

  public TelemetryRecord {
    // null-valued attributes count as absent
    attributes = attributes == null
      ? Map.of()
      : attributes.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  /**
   * Returns the attribute value, or null when the attribute is absent or blank.
   */
  public String attribute(String name) {
    String value = attributes.get(name);
    return value == null || value.isBlank() ? null : value;
  }
}
