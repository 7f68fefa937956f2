package io.github.themoah.tpeak.store;

import io.github.themoah.tpeak.exception.CorruptTableException;
import io.github.themoah.tpeak.exception.TableStoreException;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the global table as a JSON file.
 *
 * <p>Saving writes a temporary file next to the target and moves it into place, so a reader
 * sees either the old or the new table and a failed save leaves the old one untouched.
 */
public class JsonFileTableStore implements TableStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileTableStore.class);

  private final Path file;

  public JsonFileTableStore(Path file) {
    this.file = file;
  }

  @Override
  public Optional<GlobalStatisticsTable> load() throws TableStoreException {
    if (!Files.exists(file)) {
      log.info("No global table at {}, starting cold", file);
      return Optional.empty();
    }

    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw TableStoreException.loadFailed(file.toString(), e);
    }

    JsonObject json;
    try {
      json = new JsonObject(content);
    } catch (DecodeException e) {
      throw new CorruptTableException("Global table " + file + " is not valid JSON: " + e.getMessage(), e);
    }

    GlobalStatisticsTable table = StatisticsTableCodec.decode(json);
    log.info("Loaded global table from {}: {}", file, table);
    return Optional.of(table);
  }

  @Override
  public void save(GlobalStatisticsTable table) throws TableStoreException {
    Path dir = file.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      Files.createDirectories(dir);
      tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
      Files.writeString(tmp, StatisticsTableCodec.encode(table).encodePrettily(), StandardCharsets.UTF_8);
      move(tmp, file);
      tmp = null;
    } catch (IOException e) {
      throw TableStoreException.saveFailed(file.toString(), e);
    } finally {
      if (tmp != null) {
        deleteQuietly(tmp);
      }
    }
    log.info("Saved global table to {}: {}", file, table);
  }

  @Override
  public String location() {
    return file.toString();
  }

  public Path file() {
    return file;
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, replacing in place", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
    }
  }
}
