package io.github.themoah.tpeak.stats;

import io.github.themoah.tpeak.exception.UnclassifiableRecordException;
import io.github.themoah.tpeak.model.TelemetryRecord;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Named partition of a bucket's records over which distinct sub-items per grouping are
 * measured (e.g. per calendar day, or per submitter).
 */
public interface SampleGrouping {

  String ATTRIBUTE_PREFIX = "attr:";

  /**
   * Stable name, as accepted by {@link #parse(String)}.
   */
  String name();

  /**
   * Returns the grouping key for a record.
   *
   * @throws UnclassifiableRecordException if the record lacks what the grouping needs
   */
  String keyOf(TelemetryRecord record) throws UnclassifiableRecordException;

  static SampleGrouping byDay() {
    return new Calendar(ChronoUnit.DAYS);
  }

  static SampleGrouping byHour() {
    return new Calendar(ChronoUnit.HOURS);
  }

  static SampleGrouping byAttribute(String attribute) {
    return new Attribute(attribute);
  }

  /**
   * Parses {@code day}, {@code hour} or {@code attr:<attribute>}.
   */
  static SampleGrouping parse(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Sample grouping name must not be blank");
    }
    String trimmed = name.trim();
    if (trimmed.startsWith(ATTRIBUTE_PREFIX)) {
      return byAttribute(trimmed.substring(ATTRIBUTE_PREFIX.length()));
    }
    return switch (trimmed.toLowerCase(Locale.ROOT)) {
      case "day" -> byDay();
      case "hour" -> byHour();
      default -> throw new IllegalArgumentException("Unknown sample grouping: " + name
        + " (expected day, hour or " + ATTRIBUTE_PREFIX + "<attribute>)");
    };
  }

  /**
   * Groups by the UTC calendar unit the timestamp falls into.
   */
  record Calendar(ChronoUnit unit) implements SampleGrouping {

    @Override
    public String name() {
      return unit == ChronoUnit.DAYS ? "day" : "hour";
    }

    @Override
    public String keyOf(TelemetryRecord record) throws UnclassifiableRecordException {
      if (record.timestamp() == null) {
        throw UnclassifiableRecordException.missingTimestamp();
      }
      return record.timestamp().truncatedTo(unit).toString();
    }
  }

  /**
   * Groups by the value of one record attribute.
   */
  record Attribute(String attribute) implements SampleGrouping {

    public Attribute {
      if (attribute == null || attribute.isBlank()) {
        throw new IllegalArgumentException("Grouping attribute must not be blank");
      }
    }

    @Override
    public String name() {
      return ATTRIBUTE_PREFIX + attribute;
    }

    @Override
    public String keyOf(TelemetryRecord record) throws UnclassifiableRecordException {
      String value = record.attribute(attribute);
      if (value == null) {
        throw UnclassifiableRecordException.missingAttribute(attribute);
      }
      return value;
    }
  }
}
