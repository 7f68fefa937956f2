package io.github.themoah.tpeak.exception;

/**
 * A record lacks an attribute the analyzer needs. The record is skipped and counted.
 */
public class UnclassifiableRecordException extends AnalysisException {

  public UnclassifiableRecordException(String message) {
    super(message);
  }

  public static UnclassifiableRecordException missingAttribute(String attribute) {
    return new UnclassifiableRecordException("Missing required attribute '" + attribute + "'");
  }

  public static UnclassifiableRecordException missingTimestamp() {
    return new UnclassifiableRecordException("Missing timestamp");
  }
}
