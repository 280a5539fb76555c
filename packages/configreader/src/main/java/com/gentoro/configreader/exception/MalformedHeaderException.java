package com.gentoro.configreader.exception;

import java.util.Map;

/** Section header is unreadable or nests deeper than the currently open sections allow. */
public class MalformedHeaderException extends ConfigReaderException {
  public MalformedHeaderException(String message) {
    super(ConfigReaderErrorCode.MALFORMED_HEADER, message);
  }

  public MalformedHeaderException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.MALFORMED_HEADER, message, context);
  }

  public MalformedHeaderException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.MALFORMED_HEADER, message, context, cause);
  }
}
