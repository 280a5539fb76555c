package com.gentoro.configreader.exception;

import java.util.Map;

/** Two sibling sections with the same name under the same parent. */
public class DuplicateSectionException extends ConfigReaderException {
  public DuplicateSectionException(String message) {
    super(ConfigReaderErrorCode.DUPLICATE_SECTION, message);
  }

  public DuplicateSectionException(String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.DUPLICATE_SECTION, message, context);
  }

  public DuplicateSectionException(String message, Map<String, ?> context, Throwable cause) {
    super(ConfigReaderErrorCode.DUPLICATE_SECTION, message, context, cause);
  }
}
