package com.gentoro.configreader.expression;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.exception.UnresolvedIdentifierException;
import com.gentoro.configreader.value.BooleanValue;
import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import com.gentoro.configreader.value.StringValue;
import com.gentoro.configreader.value.Value;
import com.gentoro.configreader.value.ValueType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

  private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
  private final Namespace builtIns = Namespace.builtIns();

  private Value eval(String text) {
    return evaluator.evaluate(text, builtIns);
  }

  private static Namespace with(String name, Value value) {
    Map<String, Value> m = new LinkedHashMap<>();
    m.put(name, value);
    return Namespace.builtIns().withConstants(m);
  }

  @Test
  @DisplayName("boolean spellings are case-insensitive")
  void booleans() {
    assertEquals(BooleanValue.TRUE, eval("true"));
    assertEquals(BooleanValue.TRUE, eval("True"));
    assertEquals(BooleanValue.FALSE, eval(" FALSE "));
  }

  @Test
  void integerLiterals() {
    assertEquals(new IntegerValue(42), eval("42"));
    assertEquals(new IntegerValue(-7), eval("-7"));
    assertEquals(new IntegerValue(3), eval("+3"));
  }

  @Test
  void realLiterals() {
    assertEquals(new RealValue(1.5), eval("1.5"));
    assertEquals(new RealValue(0.5), eval(".5"));
    assertEquals(new RealValue(1000.0), eval("1e3"));
    assertEquals(new RealValue(-2.5e-3), eval("-2.5E-3"));
    assertEquals(ValueType.REAL, eval("99999999999999999999").type());
  }

  @Test
  @DisplayName("integer arithmetic stays integral")
  void integerExpressions() {
    assertEquals(new IntegerValue(300_000_000L), eval("3 * 10 ** 8"));
    assertEquals(new IntegerValue(14), eval("2 + 3 * 4"));
    assertEquals(new IntegerValue(20), eval("(2 + 3) * 4"));
    assertEquals(new IntegerValue(3), eval("7 // 2"));
    assertEquals(new IntegerValue(-4), eval("-7 // 2"));
    assertEquals(new IntegerValue(2), eval("-7 % 3"));
    assertEquals(new IntegerValue(-4), eval("-2 ** 2"));
    assertEquals(new IntegerValue(512), eval("2 ** 3 ** 2"));
    assertEquals(new IntegerValue(1024), eval("pow(2, 10)"));
    assertEquals(new IntegerValue(3), eval("abs(-3)"));
    assertEquals(new IntegerValue(2), eval("int(2.9)"));
  }

  @Test
  @DisplayName("division, negative exponents and real functions produce reals")
  void realExpressions() {
    assertEquals(new RealValue(2.0), eval("4 / 2"));
    assertEquals(new RealValue(0.5), eval("2 ** -1"));
    assertEquals(new RealValue(3.0), eval("7.5 // 2"));
    assertEquals(new RealValue(4.0), eval("root(16)"));
    assertEquals(new RealValue(1.0), eval("exp(0)"));
    assertEquals(new RealValue(2.0), eval("float(2)"));
    assertEquals(new RealValue(Math.sin(Math.PI / 4)), eval("sin(pi / 4)"));
    assertEquals(new RealValue(Math.E), eval("e"));
  }

  @Test
  void constantsFromNamespace() {
    Namespace ns = with("c", new IntegerValue(300_000_000L));

    Value half = evaluator.evaluate("c / 2", ns);
    assertEquals(new RealValue(150_000_000.0), half);
    assertEquals("150000000.0", half.toString());
    assertEquals(new IntegerValue(600_000_000L), evaluator.evaluate("c * 2", ns));
  }

  @Test
  void userConstantShadowsBuiltInOnlyInItsLayer() {
    Namespace ns = with("pi", new IntegerValue(3));

    assertEquals(new IntegerValue(6), evaluator.evaluate("pi * 2", ns));
    assertEquals(new RealValue(Math.PI), eval("pi"));
  }

  @Test
  void identifierCanYieldNonNumericConstant() {
    Namespace ns = with("label", new StringValue("custom"));

    assertEquals(new StringValue("custom"), evaluator.evaluate("label", ns));
  }

  @Test
  @DisplayName("text that is not a resolvable expression is a string")
  void fallsThroughToString() {
    assertEquals(new StringValue("custom"), eval("custom"));
    assertEquals(new StringValue("hello world"), eval("  hello world  "));
    assertEquals(new StringValue("a + b"), eval("a + b"));
    assertEquals(new StringValue("foo(1)"), eval("foo(1)"));
    assertEquals(new StringValue("1 +"), eval("1 +"));
    assertEquals(new StringValue("x = [1, 2]"), eval("x = [1, 2]"));
    assertEquals(new StringValue(""), eval(""));
  }

  @Test
  void quotedTextLosesItsQuotes() {
    assertEquals(new StringValue("abc"), eval("'abc'"));
    assertEquals(new StringValue("two words"), eval("\"two words\""));
    assertEquals(new StringValue("'unbalanced\""), eval("'unbalanced\""));
  }

  @Test
  void quotesAreKeptUnlessTheWholeTextIsOneLiteral() {
    assertEquals(new StringValue("\"a\" + \"b\""), eval("\"a\" + \"b\""));
    assertEquals(new StringValue("'x', 'y'"), eval("'x', 'y'"));
    assertEquals(new StringValue("it\\'s"), eval("'it\\'s'"));
    assertEquals(new StringValue("'ends with \\'"), eval("'ends with \\'"));
    assertEquals(new StringValue(""), eval("''"));
  }

  @Test
  @DisplayName("digits outside ASCII are not numbers")
  void nonAsciiDigitsAreText() {
    assertEquals(new StringValue("\u0663.5"), eval("\u0663.5"));
    assertEquals(new StringValue("\u0663 + 1"), eval("\u0663 + 1"));
    assertEquals(new StringValue("\uff11"), evaluator.evaluateStrict("\uff11", builtIns));
  }

  @Test
  @DisplayName("overly deep or long expressions are plain strings")
  void deepNestingFallsThroughToString() {
    String parens = "(".repeat(20_000) + "1" + ")".repeat(20_000);
    assertEquals(new StringValue(parens), eval(parens));

    String signs = "-".repeat(20_000) + "1";
    assertEquals(new StringValue(signs), eval(signs));

    String chain = "1" + " + 1".repeat(20_000);
    assertEquals(new StringValue(chain), eval(chain));

    String shallow = "(".repeat(30) + "1" + ")".repeat(30);
    assertEquals(new IntegerValue(1), eval(shallow));
  }

  @Test
  void evaluationErrors() {
    assertThrows(EvaluationException.class, () -> eval("1 / 0"));
    assertThrows(EvaluationException.class, () -> eval("5 // 0"));
    assertThrows(EvaluationException.class, () -> eval("5 % 0"));
    assertThrows(EvaluationException.class, () -> eval("sqrt(-1)"));
    assertThrows(EvaluationException.class, () -> eval("log(0)"));
    assertThrows(EvaluationException.class, () -> eval("sin(1, 2)"));
    assertThrows(EvaluationException.class, () -> eval("9223372036854775807 + 1"));
    assertThrows(EvaluationException.class, () -> eval("10 ** 100"));
  }

  @Test
  void nonNumericOperandIsAnEvaluationError() {
    Namespace ns = with("flag", BooleanValue.TRUE);

    EvaluationException ex =
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("flag + 1", ns));
    assertEquals("BOOLEAN", ex.getContext().get("operandType"));
    assertThrows(EvaluationException.class, () -> evaluator.evaluate("sin(flag)", ns));
  }

  @Test
  @DisplayName("strict mode reports unknown names instead of returning a string")
  void strictMode() {
    UnresolvedIdentifierException ex =
        assertThrows(
            UnresolvedIdentifierException.class,
            () -> evaluator.evaluateStrict("b * 2", builtIns));
    assertEquals("b", ex.getIdentifier());

    assertThrows(
        UnresolvedIdentifierException.class, () -> evaluator.evaluateStrict("custom", builtIns));
    assertEquals(new StringValue("hello world"), evaluator.evaluateStrict("hello world", builtIns));
    assertEquals(new StringValue("custom"), evaluator.evaluateStrict("'custom'", builtIns));
  }

  @Test
  void evaluationIsIdempotent() {
    Namespace ns = with("c", new IntegerValue(7));
    for (String text : List.of("c / 3", "sin(c)", "c ** 2 - 1", "label", "true", "2.5")) {
      assertEquals(evaluator.evaluate(text, ns), evaluator.evaluate(text, ns), text);
    }
  }

  @Test
  @DisplayName("every text maps to exactly one variant")
  void inferenceIsTotal() {
    for (String text :
        List.of("", "1", "1.0", "TRUE", "x", "pi", "1 + 1", "((", "sin(pi)", "a b c", "'q'")) {
      Value v = eval(text);
      assertNotNull(v.type(), text);
      int matches = 0;
      if (v instanceof IntegerValue) matches++;
      if (v instanceof RealValue) matches++;
      if (v instanceof BooleanValue) matches++;
      if (v instanceof StringValue) matches++;
      assertEquals(1, matches, text);
    }
  }
}
