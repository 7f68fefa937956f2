package io.github.themoah.tpeak.source;

import io.github.themoah.tpeak.exception.SourceUnavailableException;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.parsetools.JsonEvent;
import io.vertx.core.parsetools.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads records from JSON files.
 *
 * <p>The input is a file, a directory (all {@code *.json} files in it) or a glob on the file
 * name such as {@code data/telemetry-*.json}. Each file holds a JSON array of objects, parsed
 * as a stream so a file is never loaded whole; nested objects are flattened into dotted
 * attribute names. The timestamp attribute (a flattened name)
 * holds epoch milliseconds or an ISO-8601 date-time (UTC when no offset is given).
 */
public class JsonFileRecordSource implements RecordSource {

  private static final Logger log = LoggerFactory.getLogger(JsonFileRecordSource.class);

  public static final String TYPE = "json";
  public static final String DEFAULT_TIMESTAMP_ATTRIBUTE = "utc_timestamp";

  private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");
  private static final int READ_CHUNK_BYTES = 64 * 1024;

  private final String input;
  private final String timestampAttribute;

  public JsonFileRecordSource(String input) {
    this(input, DEFAULT_TIMESTAMP_ATTRIBUTE);
  }

  public JsonFileRecordSource(String input, String timestampAttribute) {
    this.input = input;
    this.timestampAttribute = timestampAttribute;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<TelemetryRecord> fetch(Optional<RecordFilter> filter, Instant start, Instant end)
      throws SourceUnavailableException {
    List<Path> files = resolveFiles();
    List<TelemetryRecord> records = new ArrayList<>();
    long read = 0;

    for (Path file : files) {
      read += readFile(file, record -> {
        if (RecordSources.accepts(record, filter, start, end)) {
          records.add(record);
        }
      });
    }

    if (records.isEmpty()) {
      log.info("No records in [{}, {}) from {} ({} files, {} records read)", start, end, input, files.size(), read);
    } else {
      log.info("Fetched {} of {} records in [{}, {}) from {} files", records.size(), read, start, end, files.size());
    }
    return records;
  }

  List<Path> resolveFiles() throws SourceUnavailableException {
    Path path = Path.of(input);
    if (Files.isRegularFile(path)) {
      return List.of(path);
    }

    Path dir;
    String glob;
    if (Files.isDirectory(path)) {
      dir = path;
      glob = "*.json";
    } else {
      dir = path.getParent() == null ? Path.of(".") : path.getParent();
      glob = path.getFileName().toString();
    }
    if (!Files.isDirectory(dir)) {
      log.info("Input directory {} does not exist, no records", dir);
      return List.of();
    }

    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
      for (Path file : stream) {
        if (Files.isRegularFile(file)) {
          files.add(file);
        }
      }
    } catch (IOException e) {
      throw SourceUnavailableException.unreadable(input, e);
    }
    files.sort(null);
    log.debug("Input {} matched {} files", input, files.size());
    return files;
  }

  /**
   * Streams the elements of the file's top-level array to {@code sink}, one object at a time.
   *
   * @return the number of records read
   */
  private long readFile(Path file, Consumer<TelemetryRecord> sink) throws SourceUnavailableException {
    ArrayElementHandler elements = new ArrayElementHandler(file, sink);
    JsonParser parser = JsonParser.newParser().objectValueMode();
    parser.handler(elements);
    parser.exceptionHandler(elements::fail);

    try (InputStream in = Files.newInputStream(file)) {
      byte[] chunk = new byte[READ_CHUNK_BYTES];
      int n;
      while (elements.failure == null && (n = in.read(chunk)) != -1) {
        parser.handle(Buffer.buffer(n).appendBytes(chunk, 0, n));
      }
      if (elements.failure == null) {
        parser.end();
      }
    } catch (IOException e) {
      throw SourceUnavailableException.unreadable(file.toString(), e);
    }

    if (elements.failure == null && (!elements.sawArray || elements.depth != 0)) {
      elements.fail(new DecodeException("Expected a complete JSON array"));
    }
    if (elements.failure != null) {
      throw SourceUnavailableException.unreadable(file.toString(), elements.failure);
    }
    log.debug("Read {} records from {}", elements.count, file);
    return elements.count;
  }

  /**
   * Turns the objects directly inside the top-level array into records.
   */
  private final class ArrayElementHandler implements Handler<JsonEvent> {

    private final Path file;
    private final Consumer<TelemetryRecord> sink;
    private boolean sawArray;
    private int depth;
    private long index;
    private long count;
    private Throwable failure;

    ArrayElementHandler(Path file, Consumer<TelemetryRecord> sink) {
      this.file = file;
      this.sink = sink;
    }

    @Override
    public void handle(JsonEvent event) {
      if (failure != null) {
        return;
      }
      switch (event.type()) {
        case START_ARRAY -> {
          if (depth == 0) {
            sawArray = true;
          } else if (depth == 1) {
            log.debug("Ignoring non-object element {} in {}", index++, file);
          }
          depth++;
        }
        case END_ARRAY -> depth--;
        case VALUE -> {
          if (depth == 0) {
            fail(new DecodeException("Expected a JSON array at the top level"));
          } else if (depth == 1) {
            if (event.isObject()) {
              sink.accept(toRecord(event.objectValue()));
              count++;
            } else {
              log.debug("Ignoring non-object element {} in {}", index, file);
            }
            index++;
          }
        }
        default -> {
        }
      }
    }

    void fail(Throwable cause) {
      if (failure == null) {
        failure = cause;
      }
    }
  }

  TelemetryRecord toRecord(JsonObject json) {
    Map<String, String> attributes = new HashMap<>();
    flatten("", json, attributes);
    return new TelemetryRecord(parseTimestamp(attributes.get(timestampAttribute)), attributes);
  }

  private static void flatten(String prefix, JsonObject json, Map<String, String> out) {
    for (Map.Entry<String, Object> field : json) {
      String name = prefix + field.getKey();
      Object value = field.getValue();
      if (value instanceof JsonObject) {
        flatten(name + ".", (JsonObject) value, out);
      } else if (value instanceof JsonArray) {
        out.put(name, ((JsonArray) value).encode());
      } else if (value != null) {
        out.put(name, String.valueOf(value));
      }
    }
  }

  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    if (EPOCH_MILLIS.matcher(value).matches()) {
      return Instant.ofEpochMilli(Long.parseLong(value));
    }
    String text = value.trim().replace(' ', 'T');
    try {
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
        .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime) {
        return ((OffsetDateTime) parsed).toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      log.trace("Unparseable timestamp '{}'", text);
      return null;
    }
  }
}
