package com.gentoro.configreader.exception;

import java.util.Map;

/** A line that is neither a header, a comment nor a key/value pair. */
public class MalformedLineException extends ConfigReaderException {
  public MalformedLineException(String message) {
    super(ConfigReaderErrorCode.MALFORMED_LINE, message);
  }

  public MalformedLineException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.MALFORMED_LINE, message, context);
  }

  public MalformedLineException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.MALFORMED_LINE, message, context, cause);
  }
}
