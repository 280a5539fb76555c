package com.gentoro.configreader.value;

import java.math.BigDecimal;

public record RealValue(double value) implements Value {

  @Override
  public ValueType type() {
    return ValueType.REAL;
  }

  @Override
  public Object raw() {
    return value;
  }

  @Override
  public double asDouble() {
    return value;
  }

  /**
   * Plain decimal notation for magnitudes in {@code [1e-4, 1e16)}, always with a fractional part,
   * so {@code 1.5E8} renders as {@code 150000000.0}. Other magnitudes keep scientific notation.
   */
  @Override
  public String toString() {
    double abs = Math.abs(value);
    if (Double.isFinite(value) && (abs == 0.0 || (abs >= 1e-4 && abs < 1e16))) {
      String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
      return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
    return Double.toString(value);
  }
}
