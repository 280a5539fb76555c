package com.gentoro.configreader.expression;

import com.gentoro.configreader.value.IntegerValue;
import com.gentoro.configreader.value.RealValue;
import com.gentoro.configreader.value.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the arithmetic subset, with the usual precedence:
 *
 * <pre>
 * expression     := additive END
 * additive       := multiplicative (("+" | "-") multiplicative)*
 * multiplicative := unary (("*" | "/" | "//" | "%") unary)*
 * unary          := ("+" | "-") unary | power
 * power          := primary ("**" unary)?
 * primary        := NUMBER | IDENTIFIER | IDENTIFIER "(" [additive ("," additive)*] ")"
 *                 | "(" additive ")"
 * </pre>
 *
 * {@code **} binds tighter than a sign on its left and is right-associative, so {@code -2 ** 2} is
 * {@code -4} and {@code 2 ** 3 ** 2} is {@code 512}.
 *
 * <p>Text nested deeper than {@link #MAX_NESTING} levels or longer than {@link #MAX_TOKENS} tokens
 * is rejected like any other syntax error.
 */
public final class ExpressionParser {
  /** Deepest allowed nesting of parentheses, signs, powers and call arguments. */
  static final int MAX_NESTING = 64;

  /** Longest accepted expression, in tokens; bounds the height of operator chains. */
  static final int MAX_TOKENS = 1024;

  private final List<Token> tokens;
  private int index = 0;
  private int depth = 0;

  private ExpressionParser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parse {@code text} into a syntax tree.
   *
   * @throws ExpressionSyntaxException when the text is not an expression
   */
  static Expression parse(String text) {
    List<Token> tokens = new ExpressionLexer(text).tokenize();
    if (tokens.size() > MAX_TOKENS) {
      throw new ExpressionSyntaxException(
          "Expression longer than " + MAX_TOKENS + " tokens", tokens.get(MAX_TOKENS).position());
    }
    ExpressionParser parser = new ExpressionParser(tokens);
    Expression e = parser.additive();
    parser.expect(TokenType.END, "end of expression");
    return e;
  }

  private Expression additive() {
    Expression left = multiplicative();
    while (true) {
      if (accept(TokenType.PLUS)) {
        left = new Expression.Binary(BinaryOperator.ADD, left, multiplicative());
      } else if (accept(TokenType.MINUS)) {
        left = new Expression.Binary(BinaryOperator.SUBTRACT, left, multiplicative());
      } else {
        return left;
      }
    }
  }

  private Expression multiplicative() {
    Expression left = unary();
    while (true) {
      BinaryOperator op;
      if (accept(TokenType.STAR)) op = BinaryOperator.MULTIPLY;
      else if (accept(TokenType.SLASH)) op = BinaryOperator.DIVIDE;
      else if (accept(TokenType.DOUBLE_SLASH)) op = BinaryOperator.FLOOR_DIVIDE;
      else if (accept(TokenType.PERCENT)) op = BinaryOperator.MODULO;
      else return left;
      left = new Expression.Binary(op, left, unary());
    }
  }

  // Every nested construct re-enters through here, so this is where depth is counted.
  private Expression unary() {
    if (++depth > MAX_NESTING) {
      throw new ExpressionSyntaxException(
          "Expression nested deeper than " + MAX_NESTING, current().position());
    }
    try {
      if (accept(TokenType.MINUS)) return new Expression.Sign(true, unary());
      if (accept(TokenType.PLUS)) return new Expression.Sign(false, unary());
      return power();
    } finally {
      depth--;
    }
  }

  private Expression power() {
    Expression base = primary();
    if (accept(TokenType.DOUBLE_STAR)) {
      return new Expression.Binary(BinaryOperator.POWER, base, unary());
    }
    return base;
  }

  private Expression primary() {
    Token t = current();
    switch (t.type()) {
      case NUMBER:
        index++;
        return new Expression.Literal(number(t));
      case IDENTIFIER:
        index++;
        if (accept(TokenType.LEFT_PAREN)) {
          return new Expression.Call(t.text(), arguments());
        }
        return new Expression.Identifier(t.text());
      case LEFT_PAREN:
        index++;
        Expression inner = additive();
        expect(TokenType.RIGHT_PAREN, "')'");
        return inner;
      default:
        throw new ExpressionSyntaxException("Unexpected '" + t.text() + "'", t.position());
    }
  }

  private List<Expression> arguments() {
    List<Expression> args = new ArrayList<>();
    if (accept(TokenType.RIGHT_PAREN)) return args;
    do {
      args.add(additive());
    } while (accept(TokenType.COMMA));
    expect(TokenType.RIGHT_PAREN, "')'");
    return args;
  }

  private static Value number(Token t) {
    String text = t.text();
    if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
      return new RealValue(Double.parseDouble(text));
    }
    try {
      return new IntegerValue(Long.parseLong(text));
    } catch (NumberFormatException e) {
      // Beyond the long range; same treatment as a bare literal of that size.
      return new RealValue(Double.parseDouble(text));
    }
  }

  private Token current() {
    return tokens.get(index);
  }

  private boolean accept(TokenType type) {
    if (current().is(type)) {
      index++;
      return true;
    }
    return false;
  }

  private void expect(TokenType type, String what) {
    if (!accept(type)) {
      Token t = current();
      throw new ExpressionSyntaxException(
          "Expected " + what + " but found '" + t.text() + "'", t.position());
    }
  }
}
