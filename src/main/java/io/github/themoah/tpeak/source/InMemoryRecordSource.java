package io.github.themoah.tpeak.source;

import io.github.themoah.tpeak.model.TelemetryRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Record source over records held in memory.
 */
public class InMemoryRecordSource implements RecordSource {

  public static final String TYPE = "memory";

  private final List<TelemetryRecord> records = new CopyOnWriteArrayList<>();

  public InMemoryRecordSource() {
  }

  public InMemoryRecordSource(Collection<TelemetryRecord> records) {
    this.records.addAll(records);
  }

  public void add(TelemetryRecord record) {
    records.add(record);
  }

  public void addAll(Collection<TelemetryRecord> more) {
    records.addAll(more);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<TelemetryRecord> fetch(Optional<RecordFilter> filter, Instant start, Instant end) {
    List<TelemetryRecord> matching = new ArrayList<>();
    for (TelemetryRecord record : records) {
      if (RecordSources.accepts(record, filter, start, end)) {
        matching.add(record);
      }
    }
    return matching;
  }
}
