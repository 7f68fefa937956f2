package io.github.themoah.tpeak.store;

import io.github.themoah.tpeak.exception.CorruptTableException;
import io.github.themoah.tpeak.exception.TableStoreException;
import io.github.themoah.tpeak.model.GlobalStatisticsTable;
import java.util.Optional;

/**
 * Persists the global statistics table between runs.
 */
public interface TableStore {

  /**
   * Loads the stored baseline.
   *
   * @return the baseline, or empty when none was stored yet (cold start)
   * @throws CorruptTableException if a baseline exists but cannot be decoded
   * @throws TableStoreException if the storage cannot be read
   */
  Optional<GlobalStatisticsTable> load() throws TableStoreException;

  /**
   * Replaces the stored baseline. On failure the previously stored baseline is left intact.
   *
   * @throws TableStoreException if the baseline could not be written
   */
  void save(GlobalStatisticsTable table) throws TableStoreException;

  /**
   * Human-readable location, for logs.
   */
  String location();
}
