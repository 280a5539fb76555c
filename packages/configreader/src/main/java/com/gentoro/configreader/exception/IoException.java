package com.gentoro.configreader.exception;

/** I/O operation failed (filesystem, classpath, reader streams). */
public class IoException extends ConfigReaderException {
  public IoException(String message) {
    super(ConfigReaderErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(ConfigReaderErrorCode.IO_ERROR, message, cause);
  }
}
