package io.github.themoah.tpeak.exception;

/**
 * The record source could not be reached or read. Fatal to the run; no retries are made.
 */
public class SourceUnavailableException extends AnalysisException {

  public SourceUnavailableException(String message) {
    super(message);
  }

  public SourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public static SourceUnavailableException unreadable(String location, Throwable cause) {
    return new SourceUnavailableException(
      String.format("Cannot read telemetry from '%s': %s", location, cause.getMessage()), cause);
  }
}
