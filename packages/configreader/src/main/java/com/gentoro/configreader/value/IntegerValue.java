package com.gentoro.configreader.value;

public record IntegerValue(long value) implements Value {

  @Override
  public ValueType type() {
    return ValueType.INTEGER;
  }

  @Override
  public Object raw() {
    return value;
  }

  @Override
  public long asLong() {
    return value;
  }

  @Override
  public double asDouble() {
    return value;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
