package com.gentoro.configreader.value;

import com.gentoro.configreader.ConfigElement;
import com.gentoro.configreader.exception.ValueTypeException;

/**
 * A resolved, typed leaf of the configuration tree.
 *
 * <p>Implementations are the four records {@link IntegerValue}, {@link RealValue}, {@link
 * BooleanValue} and {@link StringValue}. The typed accessors throw {@link ValueTypeException} when
 * the value holds a different variant; {@link #asDouble()} also accepts integers.
 */
public interface Value extends ConfigElement {

  ValueType type();

  /** The underlying datum as a plain Java object ({@code Long}, {@code Double}, ...). */
  Object raw();

  @Override
  default boolean isNode() {
    return false;
  }

  default boolean isNumeric() {
    return type() == ValueType.INTEGER || type() == ValueType.REAL;
  }

  default long asLong() {
    throw mismatch(ValueType.INTEGER);
  }

  default double asDouble() {
    throw mismatch(ValueType.REAL);
  }

  default boolean asBoolean() {
    throw mismatch(ValueType.BOOLEAN);
  }

  default String asString() {
    throw mismatch(ValueType.STRING);
  }

  private ValueTypeException mismatch(ValueType expected) {
    return new ValueTypeException(
        "Expected a %s value but found %s '%s'".formatted(expected, type(), this));
  }
}
