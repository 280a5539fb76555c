package com.gentoro.configreader.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Returns {@code t} unchanged when it already is a {@link ConfigReaderException}, otherwise the
   * exception produced by {@code supplier}. Intended for {@code throw
   * ExceptionUtil.rethrowIfUnchecked(e, ...)} inside broad catch blocks.
   */
  public static ConfigReaderException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ConfigReaderException> supplier) {
    if (t instanceof ConfigReaderException) {
      return (ConfigReaderException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
