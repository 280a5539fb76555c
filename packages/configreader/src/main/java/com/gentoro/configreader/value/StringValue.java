package com.gentoro.configreader.value;

import java.util.Objects;

public record StringValue(String value) implements Value {

  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public ValueType type() {
    return ValueType.STRING;
  }

  @Override
  public Object raw() {
    return value;
  }

  @Override
  public String asString() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
