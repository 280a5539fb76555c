package com.gentoro.configreader.exception;

import java.util.Map;

/**
 * A constant references a name that is not in the namespace at the time it is evaluated. This
 * covers unknown names as well as constants defined further down in the same section.
 */
public class UnresolvedIdentifierException extends ConfigReaderException {
  private final String identifier;

  public UnresolvedIdentifierException(String identifier, String message) {
    super(ConfigReaderErrorCode.UNRESOLVED_IDENTIFIER, message, Map.of("name", identifier));
    this.identifier = identifier;
  }

  public UnresolvedIdentifierException(
      String identifier, String message, Map<String, ?> context) {
    super(ConfigReaderErrorCode.UNRESOLVED_IDENTIFIER, message, context);
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }
}
