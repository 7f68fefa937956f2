package io.github.themoah.tpeak.exception;

/**
 * A stored global table exists but cannot be decoded into a valid table. The run must not
 * continue with a partially parsed baseline.
 */
public class CorruptTableException extends TableStoreException {

  public CorruptTableException(String message) {
    super(message);
  }

  public CorruptTableException(String message, Throwable cause) {
    super(message, cause);
  }

  public static CorruptTableException missingField(String field, String context) {
    return new CorruptTableException(
      String.format("Missing or invalid field '%s' in %s", field, context));
  }
}
