package com.gentoro.configreader.expression;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

  @Test
  void buildsTreeWithPrecedence() {
    Expression e = ExpressionParser.parse("1 + 2 * x");

    Expression.Binary add = assertInstanceOf(Expression.Binary.class, e);
    assertEquals(BinaryOperator.ADD, add.operator());
    assertEquals(new Expression.Literal(new IntegerValue(1)), add.left());
    Expression.Binary mul = assertInstanceOf(Expression.Binary.class, add.right());
    assertEquals(BinaryOperator.MULTIPLY, mul.operator());
    assertEquals(new Expression.Identifier("x"), mul.right());
  }

  @Test
  void powerIsRightAssociativeAndBindsTighterThanSign() {
    Expression.Sign sign =
        assertInstanceOf(Expression.Sign.class, ExpressionParser.parse("-2 ** 2"));
    assertTrue(sign.negative());
    assertInstanceOf(Expression.Binary.class, sign.operand());

    Expression.Binary outer =
        assertInstanceOf(Expression.Binary.class, ExpressionParser.parse("2 ** 3 ** 2"));
    assertEquals(new Expression.Literal(new IntegerValue(2)), outer.left());
    assertInstanceOf(Expression.Binary.class, outer.right());
  }

  @Test
  void parsesCallsAndCollectsNames() {
    Expression e = ExpressionParser.parse("pow(a, sin(b)) + .5e1");

    Set<String> constants = new LinkedHashSet<>();
    Set<String> functions = new LinkedHashSet<>();
    e.collectNames(constants, functions);
    assertEquals(Set.of("a", "b"), constants);
    assertEquals(Set.of("pow", "sin"), functions);

    Expression.Binary add = (Expression.Binary) e;
    assertEquals(new Expression.Literal(new RealValue(5.0)), add.right());
    Expression.Call call = assertInstanceOf(Expression.Call.class, add.left());
    assertEquals(2, call.arguments().size());
  }

  @Test
  void emptyArgumentListIsAllowedSyntactically() {
    Expression.Call call = assertInstanceOf(Expression.Call.class, ExpressionParser.parse("f()"));
    assertEquals(List.of(), call.arguments());
  }

  @Test
  void rejectsNonArithmeticText() {
    for (String text :
        List.of(
            "1 +", "(1", "1)", "a b", "x = 1", "__import__('os')", "[1, 2]", "f(1,)", "2 ^ 3")) {
      assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse(text), text);
    }
  }

  @Test
  void nestingIsLimited() {
    int ok = ExpressionParser.MAX_NESTING - 1;
    assertEquals(
        new Expression.Literal(new IntegerValue(1)),
        ExpressionParser.parse("(".repeat(ok) + "1" + ")".repeat(ok)));
    assertThrows(
        ExpressionSyntaxException.class,
        () -> ExpressionParser.parse("(".repeat(ok + 1) + "1" + ")".repeat(ok + 1)));

    assertInstanceOf(Expression.Sign.class, ExpressionParser.parse("-".repeat(ok) + "1"));
    assertThrows(
        ExpressionSyntaxException.class, () -> ExpressionParser.parse("-".repeat(ok + 1) + "1"));
    assertThrows(
        ExpressionSyntaxException.class, () -> ExpressionParser.parse("2" + " ** 2".repeat(70)));
  }

  @Test
  void lengthIsLimited() {
    assertInstanceOf(Expression.Binary.class, ExpressionParser.parse("1" + " + 1".repeat(500)));
    assertThrows(
        ExpressionSyntaxException.class, () -> ExpressionParser.parse("1" + " + 1".repeat(600)));
  }

  @Test
  void onlyAsciiDigitsAreNumbers() {
    assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse("\u0663.5"));
    assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse("1 + \u0663"));
    assertEquals(new Expression.Identifier("x\u0663"), ExpressionParser.parse("x\u0663"));
  }
}
