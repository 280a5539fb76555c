package com.gentoro.configreader.exception;

import java.util.Map;

/** A value was read as a type it does not hold. */
public class ValueTypeException extends ConfigReaderException {
  public ValueTypeException(String message) {
    super(ConfigReaderErrorCode.TYPE_MISMATCH, message);
  }

  public ValueTypeException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.TYPE_MISMATCH, message, context);
  }

  public ValueTypeException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.TYPE_MISMATCH, message, context, cause);
  }
}
