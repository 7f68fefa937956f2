package io.github.themoah.tpeak.source;

import io.github.themoah.tpeak.model.TelemetryRecord;
import java.util.Map;
import java.util.Set;

/**
 * Restricts fetched records to allowed attribute values.
 *
 * <p>A record is rejected only when it carries a listed attribute with a value outside the
 * allowed set. Records missing the attribute pass, so the analyzer can count them as skipped.
 *
 * @param allowedValues attribute name to the values it may take
 */
public record RecordFilter(Map<String, Set<String>> allowedValues) {

  public RecordFilter {
    allowedValues = Map.copyOf(allowedValues);
  }

  public static RecordFilter allowing(String attribute, Set<String> values) {
    return new RecordFilter(Map.of(attribute, Set.copyOf(values)));
  }

  public boolean matches(TelemetryRecord record) {
    for (Map.Entry<String, Set<String>> entry : allowedValues.entrySet()) {
      String value = record.attribute(entry.getKey());
      if (value != null && !entry.getValue().contains(value)) {
        return false;
      }
    }
    return true;
  }
}
