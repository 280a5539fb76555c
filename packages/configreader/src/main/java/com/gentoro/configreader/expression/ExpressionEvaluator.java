package com.gentoro.configreader.expression;

import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.exception.UnresolvedIdentifierException;
import com.gentoro.configreader.value.BooleanValue;
import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import com.gentoro.configreader.value.StringValue;
import com.gentoro.configreader.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the type of a raw text value and evaluates arithmetic expressions.
 *
 * <p>Rules are tried in order and the first match wins:
 *
 * <ol>
 *   <li>{@code true} / {@code false} in any case: Boolean.
 *   <li>A signed integer literal that fits in a {@code long}: Integer.
 *   <li>A signed real literal (decimal point and/or exponent): Real.
 *   <li>An arithmetic expression whose names all resolve in the namespace: its result.
 *   <li>Anything else: the trimmed text as a String. A single quoted literal loses its quotes.
 * </ol>
 *
 * <p>Text that fails to parse, or references an unknown name, falls through to rule 5. In strict
 * mode, used for constants, an unknown name is an {@link UnresolvedIdentifierException} instead.
 * Once an expression is accepted its evaluation failures are always {@link EvaluationException}s.
 *
 * <p>The evaluator is stateless and a pure function of its inputs.
 */
public class ExpressionEvaluator {
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern REAL =
      Pattern.compile("[+-]?(?:\\d+\\.\\d*|\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?");

  public Value evaluate(String rawText, Namespace namespace) {
    return evaluate(rawText, namespace, false);
  }

  /** Like {@link #evaluate} but unknown names are errors rather than plain strings. */
  public Value evaluateStrict(String rawText, Namespace namespace) {
    return evaluate(rawText, namespace, true);
  }

  private Value evaluate(String rawText, Namespace namespace, boolean strict) {
    String text = rawText == null ? "" : rawText.strip();

    if (text.equalsIgnoreCase("true")) return BooleanValue.TRUE;
    if (text.equalsIgnoreCase("false")) return BooleanValue.FALSE;

    if (INTEGER.matcher(text).matches()) {
      try {
        return new IntegerValue(Long.parseLong(text));
      } catch (NumberFormatException e) {
        // Too large for a long; read it as a real below.
      }
    }
    if (REAL.matcher(text).matches()) {
      return new RealValue(Double.parseDouble(text));
    }

    Expression expression = tryParse(text);
    if (expression != null) {
      String unresolved = firstUnresolved(expression, namespace);
      if (unresolved == null) {
        return interpret(expression, namespace);
      }
      if (strict) {
        throw new UnresolvedIdentifierException(
            unresolved,
            "Unresolved identifier '%s' in '%s'".formatted(unresolved, text),
            Map.of("name", unresolved, "raw", text));
      }
    }
    return new StringValue(unquote(text));
  }

  /** Parsed tree, or {@code null} when the text is not an expression. */
  private static Expression tryParse(String text) {
    if (text.isEmpty()) return null;
    try {
      return ExpressionParser.parse(text);
    } catch (ExpressionSyntaxException e) {
      return null;
    }
  }

  private static String firstUnresolved(Expression expression, Namespace namespace) {
    Set<String> constants = new LinkedHashSet<>();
    Set<String> functions = new LinkedHashSet<>();
    expression.collectNames(constants, functions);
    for (String name : constants) {
      if (!namespace.hasConstant(name)) return name;
    }
    for (String name : functions) {
      if (!namespace.hasFunction(name)) return name;
    }
    return null;
  }

  private static Value interpret(Expression e, Namespace ns) {
    if (e instanceof Expression.Literal literal) {
      return literal.value();
    }
    if (e instanceof Expression.Identifier id) {
      return ns.constant(id.name())
          .orElseThrow(() -> new IllegalStateException("Unresolved " + id.name()));
    }
    if (e instanceof Expression.Sign sign) {
      Value operand = interpret(sign.operand(), ns);
      return sign.negative() ? Arithmetic.negate(operand) : Arithmetic.plus(operand);
    }
    if (e instanceof Expression.Binary binary) {
      return Arithmetic.apply(
          binary.operator(), interpret(binary.left(), ns), interpret(binary.right(), ns));
    }
    if (e instanceof Expression.Call call) {
      NumericFunction f =
          ns.function(call.function())
              .orElseThrow(() -> new IllegalStateException("Unresolved " + call.function()));
      if (call.arguments().size() != f.arity()) {
        throw new EvaluationException(
            "%s() takes %d argument(s) but %d were given"
                .formatted(f.name(), f.arity(), call.arguments().size()),
            Map.of("function", f.name()));
      }
      List<Value> args = new ArrayList<>(call.arguments().size());
      for (Expression arg : call.arguments()) {
        args.add(interpret(arg, ns));
      }
      return f.apply(args);
    }
    throw new IllegalStateException("Unknown expression node " + e.getClass().getSimpleName());
  }

  /**
   * Strips one pair of matching outer quotes, but only from a single quoted literal: text such as
   * {@code "a" + "b"} is returned as is. A backslash escapes the next character.
   */
  private static String unquote(String text) {
    if (text.length() < 2) return text;
    char quote = text.charAt(0);
    if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
      return text;
    }
    int end = text.length() - 1;
    int i = 1;
    while (i < end) {
      char c = text.charAt(i);
      if (c == quote) return text;
      i += c == '\\' ? 2 : 1;
    }
    // i == end + 1 when a backslash escaped the closing quote.
    return i == end ? text.substring(1, end) : text;
  }
}
