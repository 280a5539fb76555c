package com.gentoro.configreader.exception;

/** The evaluated tree could not be written as JSON or YAML. */
public class SerializationException extends ConfigReaderException {
  public SerializationException(String message, Throwable cause) {
    super(ConfigReaderErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
