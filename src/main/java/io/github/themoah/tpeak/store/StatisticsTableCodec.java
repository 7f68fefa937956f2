package io.github.themoah.tpeak.store;

import io.github.themoah.tpeak.exception.CorruptTableException;
import io.github.themoah.tpeak.model.DimensionValue;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.github.themoah.tpeak.model.Index;
import io.github.themoah.tpeak.model.SampleDistribution;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.StatisticsTable;
import io.github.themoah.tpeak.model.TimeWindow;
import io.github.themoah.tpeak.stats.WindowMerger;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON encoding of the global statistics table.
 *
 * <p>Only the segments are stored; the aggregate is rebuilt from them on decode, so a stored
 * table can never carry an aggregate that disagrees with its segments.
 */
public final class StatisticsTableCodec {

  public static final int FORMAT = 1;

  private StatisticsTableCodec() {
  }

  public static JsonObject encode(GlobalStatisticsTable table) {
    JsonArray segments = new JsonArray();
    for (StatisticsTable segment : table.segments()) {
      segments.add(encodeSegment(segment));
    }
    return new JsonObject()
      .put("format", FORMAT)
      .put("segments", segments);
  }

  static JsonObject encodeSegment(StatisticsTable segment) {
    JsonArray entries = new JsonArray();
    for (Map.Entry<StatisticsKey, StatisticsEntry> e : segment.entries().entrySet()) {
      StatisticsEntry entry = e.getValue();
      entries.add(new JsonObject()
        .put("index", new JsonArray(new ArrayList<>(e.getKey().index().values())))
        .put("dimension", new JsonArray(new ArrayList<>(e.getKey().dimension().values())))
        .put("sub_count", entry.subCount())
        .put("samp_count", entry.sampCount())
        .put("grouping_count", entry.groupingCount())
        .put("samp_sub_count_max", entry.sampSubCountMax())
        .put("samp_sub_count_mean", entry.sampSubCountMean())
        .put("samp_sub_count_std", entry.sampSubCountStd()));
    }
    return new JsonObject()
      .put("start", segment.window().start().toString())
      .put("end", segment.window().end().toString())
      .put("entries", entries);
  }

  /**
   * @throws CorruptTableException on an unknown format, a missing field or a value that
   *     violates the table invariants
   */
  public static GlobalStatisticsTable decode(JsonObject json) throws CorruptTableException {
    try {
      Integer format = json.getInteger("format");
      if (format == null || format != FORMAT) {
        throw new CorruptTableException("Unsupported table format: " + json.getValue("format"));
      }
      JsonArray segments = json.getJsonArray("segments");
      if (segments == null) {
        throw CorruptTableException.missingField("segments", "table");
      }
      List<StatisticsTable> decoded = new ArrayList<>(segments.size());
      for (int i = 0; i < segments.size(); i++) {
        decoded.add(decodeSegment(segments.getJsonObject(i), "segment " + i));
      }
      return WindowMerger.replay(decoded);
    } catch (ClassCastException | IllegalArgumentException | NullPointerException e) {
      throw new CorruptTableException("Invalid global table: " + e.getMessage(), e);
    }
  }

  private static StatisticsTable decodeSegment(JsonObject json, String context) throws CorruptTableException {
    if (json == null) {
      throw new CorruptTableException("Empty " + context);
    }
    TimeWindow window = new TimeWindow(instant(json, "start", context), instant(json, "end", context));
    JsonArray entries = json.getJsonArray("entries");
    if (entries == null) {
      throw CorruptTableException.missingField("entries", context);
    }

    Map<StatisticsKey, StatisticsEntry> decoded = new TreeMap<>();
    for (int i = 0; i < entries.size(); i++) {
      JsonObject entry = entries.getJsonObject(i);
      String entryContext = context + " entry " + i;
      if (entry == null) {
        throw new CorruptTableException("Empty " + entryContext);
      }
      StatisticsKey key = StatisticsKey.of(
        new Index(strings(entry, "index", entryContext)),
        new DimensionValue(strings(entry, "dimension", entryContext)));
      SampleDistribution distribution = new SampleDistribution(
        longValue(entry, "grouping_count", entryContext),
        longValue(entry, "samp_sub_count_max", entryContext),
        doubleValue(entry, "samp_sub_count_mean", entryContext),
        doubleValue(entry, "samp_sub_count_std", entryContext));
      StatisticsEntry value = new StatisticsEntry(
        longValue(entry, "sub_count", entryContext),
        longValue(entry, "samp_count", entryContext),
        distribution);
      if (decoded.put(key, value) != null) {
        throw new CorruptTableException("Duplicate key " + key + " in " + context);
      }
    }
    return StatisticsTable.of(window, decoded);
  }

  private static Instant instant(JsonObject json, String field, String context) throws CorruptTableException {
    String value = json.getString(field);
    if (value == null) {
      throw CorruptTableException.missingField(field, context);
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new CorruptTableException("Invalid '" + field + "' in " + context + ": " + value, e);
    }
  }

  private static List<String> strings(JsonObject json, String field, String context) throws CorruptTableException {
    JsonArray array = json.getJsonArray(field);
    if (array == null) {
      throw CorruptTableException.missingField(field, context);
    }
    List<String> values = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      values.add(array.getString(i));
    }
    return values;
  }

  private static long longValue(JsonObject json, String field, String context) throws CorruptTableException {
    Long value = json.getLong(field);
    if (value == null) {
      throw CorruptTableException.missingField(field, context);
    }
    return value;
  }

  private static double doubleValue(JsonObject json, String field, String context) throws CorruptTableException {
    Double value = json.getDouble(field);
    if (value == null) {
      throw CorruptTableException.missingField(field, context);
    }
    return value;
  }
}
