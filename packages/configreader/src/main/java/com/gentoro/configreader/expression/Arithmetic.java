package com.gentoro.configreader.expression;

import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import com.gentoro.configreader.value.Value;
import java.util.Map;

/**
 * Numeric semantics of the operators.
 *
 * <p>Two integers stay integral under {@code + - * // %} and under {@code **} with a non-negative
 * exponent; integer overflow is an error, not a wrap-around. {@code /} and any real operand produce
 * a real. Floor division and modulo round toward negative infinity. A non-finite result from
 * finite operands is reported as a domain error.
 */
public final class Arithmetic {
  private Arithmetic() {}

  public static Value apply(BinaryOperator op, Value left, Value right) {
    requireNumeric(op.symbol(), left);
    requireNumeric(op.symbol(), right);
    if (left instanceof IntegerValue l
        && right instanceof IntegerValue r
        && op != BinaryOperator.DIVIDE) {
      return integral(op, l.value(), r.value());
    }
    double a = left.asDouble();
    double b = right.asDouble();
    double result;
    switch (op) {
      case ADD:
        result = a + b;
        break;
      case SUBTRACT:
        result = a - b;
        break;
      case MULTIPLY:
        result = a * b;
        break;
      case DIVIDE:
        requireNonZero(op, b);
        result = a / b;
        break;
      case FLOOR_DIVIDE:
        requireNonZero(op, b);
        result = Math.floor(a / b);
        break;
      case MODULO:
        requireNonZero(op, b);
        result = a - b * Math.floor(a / b);
        break;
      case POWER:
        result = Math.pow(a, b);
        break;
      default:
        throw new IllegalStateException("Unhandled operator " + op);
    }
    return real(op.symbol(), result, a, b);
  }

  public static Value negate(Value operand) {
    requireNumeric("-", operand);
    if (operand instanceof IntegerValue i) {
      try {
        return new IntegerValue(Math.negateExact(i.value()));
      } catch (ArithmeticException e) {
        throw overflow("-", e);
      }
    }
    return new RealValue(-operand.asDouble());
  }

  public static Value plus(Value operand) {
    requireNumeric("+", operand);
    return operand;
  }

  /** Builds a real result, rejecting NaN or infinity unless an operand was already non-finite. */
  static RealValue real(String operation, double result, double... operands) {
    if (!Double.isFinite(result)) {
      for (double d : operands) {
        if (!Double.isFinite(d)) return new RealValue(result);
      }
      throw new EvaluationException(
          "Math domain or range error in '%s'".formatted(operation),
          Map.of("operation", operation));
    }
    return new RealValue(result);
  }

  static void requireNumeric(String operation, Value v) {
    if (!v.isNumeric()) {
      throw new EvaluationException(
          "Unsupported operand for '%s': %s '%s'".formatted(operation, v.type(), v),
          Map.of("operation", operation, "operandType", v.type().name()));
    }
  }

  private static Value integral(BinaryOperator op, long a, long b) {
    try {
      switch (op) {
        case ADD:
          return new IntegerValue(Math.addExact(a, b));
        case SUBTRACT:
          return new IntegerValue(Math.subtractExact(a, b));
        case MULTIPLY:
          return new IntegerValue(Math.multiplyExact(a, b));
        case FLOOR_DIVIDE:
          requireNonZero(op, b);
          if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
          return new IntegerValue(Math.floorDiv(a, b));
        case MODULO:
          requireNonZero(op, b);
          return new IntegerValue(Math.floorMod(a, b));
        case POWER:
          if (b < 0) return real(op.symbol(), Math.pow(a, b), a, b);
          return new IntegerValue(power(a, b));
        default:
          throw new IllegalStateException("Unhandled integer operator " + op);
      }
    } catch (ArithmeticException e) {
      throw overflow(op.symbol(), e);
    }
  }

  /** Exact exponentiation by squaring. */
  static long power(long base, long exponent) {
    long result = 1;
    long b = base;
    long e = exponent;
    while (e > 0) {
      if ((e & 1) == 1) result = Math.multiplyExact(result, b);
      e >>= 1;
      if (e > 0) b = Math.multiplyExact(b, b);
    }
    return result;
  }

  private static void requireNonZero(BinaryOperator op, double divisor) {
    if (divisor == 0) {
      throw new EvaluationException(
          "Division by zero in '%s'".formatted(op.symbol()), Map.of("operation", op.symbol()));
    }
  }

  private static EvaluationException overflow(String operation, ArithmeticException e) {
    return new EvaluationException(
        "Integer overflow in '%s'".formatted(operation), Map.of("operation", operation), e);
  }
}
