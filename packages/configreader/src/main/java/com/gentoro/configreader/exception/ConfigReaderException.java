package com.gentoro.configreader.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the configuration reader with a stable {@link ConfigReaderErrorCode}
 * and optional context.
 *
 * <p>The context map carries the location of the failure ({@code section}, {@code key}, {@code
 * line}, {@code path}, ...). It is copied on construction and unmodifiable.
 */
public class ConfigReaderException extends RuntimeException {
  private final ConfigReaderErrorCode code;
  private final Map<String, Object> context;

  public ConfigReaderException(ConfigReaderErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public ConfigReaderException(ConfigReaderErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public ConfigReaderException(
      ConfigReaderErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public ConfigReaderException(
      ConfigReaderErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public ConfigReaderErrorCode getCode() {
    return code;
  }

  /** Additional key/value details locating the failure. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach((k, v) -> m.put(k, v));
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
