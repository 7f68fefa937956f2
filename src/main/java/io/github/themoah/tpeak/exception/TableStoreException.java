package io.github.themoah.tpeak.exception;

/**
 * Loading or saving the global statistics table failed.
 */
public class TableStoreException extends AnalysisException {

  public TableStoreException(String message) {
    super(message);
  }

  public TableStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public static TableStoreException saveFailed(String location, Throwable cause) {
    return new TableStoreException(
      String.format("Failed to save global table to '%s': %s", location, cause.getMessage()), cause);
  }

  public static TableStoreException loadFailed(String location, Throwable cause) {
    return new TableStoreException(
      String.format("Failed to load global table from '%s': %s", location, cause.getMessage()), cause);
  }
}
