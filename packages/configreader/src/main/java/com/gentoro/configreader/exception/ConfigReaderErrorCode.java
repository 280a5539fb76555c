package com.gentoro.configreader.exception;

/**
 * Canonical error codes for the configuration reader. Codes are stable and suitable for logs and
 * callers that branch on the failure kind rather than on the exception class.
 */
public enum ConfigReaderErrorCode {
  // Structure
  MALFORMED_HEADER,
  MALFORMED_LINE,
  DUPLICATE_SECTION,
  DUPLICATE_KEY,

  // Evaluation
  UNRESOLVED_IDENTIFIER,
  EVALUATION_ERROR,

  // Lookup
  PATH_NOT_FOUND,
  AMBIGUOUS_NAME,
  NOT_FOUND,
  TYPE_MISMATCH,

  // I/O, output and settings
  IO_ERROR,
  SERIALIZATION_ERROR,
  CONFIGURATION_ERROR,
}
