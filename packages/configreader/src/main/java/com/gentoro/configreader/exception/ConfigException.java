package com.gentoro.configreader.exception;

/** Reader settings are missing or invalid. */
public class ConfigException extends ConfigReaderException {
  public ConfigException(String message) {
    super(ConfigReaderErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ConfigReaderErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
