package com.gentoro.configreader.exception;

import java.util.Map;

/** The same key appears twice within one section. */
public class DuplicateKeyException extends ConfigReaderException {
  public DuplicateKeyException(String message) {
    super(ConfigReaderErrorCode.DUPLICATE_KEY, message);
  }

  public DuplicateKeyException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.DUPLICATE_KEY, message, context);
  }

  public DuplicateKeyException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.DUPLICATE_KEY, message, context, cause);
  }
}
