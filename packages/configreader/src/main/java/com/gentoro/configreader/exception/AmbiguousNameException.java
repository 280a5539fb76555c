package com.gentoro.configreader.exception;

import java.util.Map;

/** Unique-name lookup matched more than one key in the tree. */
public class AmbiguousNameException extends ConfigReaderException {
  public AmbiguousNameException(String message) {
    super(ConfigReaderErrorCode.AMBIGUOUS_NAME, message);
  }

  public AmbiguousNameException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.AMBIGUOUS_NAME, message, context);
  }

  public AmbiguousNameException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.AMBIGUOUS_NAME, message, context, cause);
  }
}
