package io.github.themoah.tpeak.exception;

/**
 * Base checked exception for failures at the boundary of an analysis run: reading records,
 * loading or saving the baseline, classifying input.
 *
 * <p>Subclasses name the failure category so the caller can decide whether the run is lost
 * ({@link SourceUnavailableException}, {@link CorruptTableException}) or only the affected
 * record is ({@link UnclassifiableRecordException}).
 */
public class AnalysisException extends Exception {

  public AnalysisException(String message) {
    super(message);
  }

  public AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
