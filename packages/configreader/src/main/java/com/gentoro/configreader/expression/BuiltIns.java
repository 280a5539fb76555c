package com.gentoro.configreader.expression;

import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import com.gentoro.configreader.value.Value;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * The fixed built-in namespace.
 *
 * <ul>
 *   <li>Constants: {@code pi}, {@code Pi}, {@code PI}, {@code e}, {@code E}.
 *   <li>Unary functions: {@code sin}, {@code cos}, {@code tan}, {@code exp}, {@code log} (natural),
 *       {@code sqrt}, {@code root} (alias of sqrt), {@code abs}, {@code int} (truncate), {@code
 *       float}.
 *   <li>Binary function: {@code pow}, same semantics as {@code **}.
 * </ul>
 */
final class BuiltIns {
  private BuiltIns() {}

  static final Namespace NAMESPACE = new Namespace(null, constants(), functions());

  private static Map<String, Value> constants() {
    Map<String, Value> m = new LinkedHashMap<>();
    RealValue pi = new RealValue(Math.PI);
    RealValue e = new RealValue(Math.E);
    m.put("pi", pi);
    m.put("Pi", pi);
    m.put("PI", pi);
    m.put("e", e);
    m.put("E", e);
    return m;
  }

  private static Map<String, NumericFunction> functions() {
    Map<String, NumericFunction> m = new LinkedHashMap<>();
    register(m, real("sin", Math::sin));
    register(m, real("cos", Math::cos));
    register(m, real("tan", Math::tan));
    register(m, real("exp", Math::exp));
    register(m, real("log", Math::log));
    register(m, real("sqrt", Math::sqrt));
    register(m, real("root", Math::sqrt));
    register(m, unary("abs", BuiltIns::abs));
    register(m, unary("int", BuiltIns::truncate));
    register(m, unary("float", v -> new RealValue(v.asDouble())));
    register(
        m,
        new SimpleFunction(
            "pow", 2, args -> Arithmetic.apply(BinaryOperator.POWER, args.get(0), args.get(1))));
    return m;
  }

  private static void register(Map<String, NumericFunction> m, NumericFunction f) {
    m.put(f.name(), f);
  }

  private static NumericFunction real(String name, DoubleUnaryOperator op) {
    return unary(
        name,
        v -> {
          double x = v.asDouble();
          return Arithmetic.real(name, op.applyAsDouble(x), x);
        });
  }

  private static NumericFunction unary(String name, Function<Value, Value> body) {
    return new SimpleFunction(
        name,
        1,
        args -> {
          Value v = args.get(0);
          Arithmetic.requireNumeric(name + "()", v);
          return body.apply(v);
        });
  }

  private static Value abs(Value v) {
    if (v instanceof IntegerValue i) {
      try {
        return new IntegerValue(Math.absExact(i.value()));
      } catch (ArithmeticException e) {
        throw new EvaluationException(
            "Integer overflow in 'abs()'", Map.of("operation", "abs()"), e);
      }
    }
    return new RealValue(Math.abs(v.asDouble()));
  }

  private static Value truncate(Value v) {
    if (v instanceof IntegerValue) return v;
    double d = v.asDouble();
    if (!Double.isFinite(d) || d >= 0x1p63 || d < -0x1p63) {
      throw new EvaluationException(
          "Cannot convert %s to an integer".formatted(v), Map.of("operation", "int()"));
    }
    return new IntegerValue((long) d);
  }

  private record SimpleFunction(String name, int arity, Function<List<Value>, Value> body)
      implements NumericFunction {
    @Override
    public Value apply(List<Value> arguments) {
      return body.apply(arguments);
    }
  }
}
