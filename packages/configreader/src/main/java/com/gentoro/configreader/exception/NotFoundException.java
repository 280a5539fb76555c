package com.gentoro.configreader.exception;

import java.util.Map;

/** Unique-name lookup found no key with the requested name. */
public class NotFoundException extends ConfigReaderException {
  public NotFoundException(String message) {
    super(ConfigReaderErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.NOT_FOUND, message, context);
  }
}
