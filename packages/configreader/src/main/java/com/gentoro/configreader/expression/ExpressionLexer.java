package com.gentoro.configreader.expression;

import java.util.ArrayList;
import java.util.List;

/** Splits expression text into tokens. Anything outside the arithmetic alphabet is rejected. */
final class ExpressionLexer {
  private final String text;
  private int pos = 0;

  ExpressionLexer(String text) {
    this.text = text;
  }

  List<Token> tokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= text.length()) {
        tokens.add(new Token(TokenType.END, "", pos));
        return tokens;
      }
      char c = text.charAt(pos);
      int start = pos;
      if (isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
        tokens.add(new Token(TokenType.NUMBER, readNumber(), start));
      } else if (Character.isLetter(c) || c == '_') {
        tokens.add(new Token(TokenType.IDENTIFIER, readIdentifier(), start));
      } else {
        tokens.add(readOperator(c, start));
      }
    }
  }

  private Token readOperator(char c, int start) {
    switch (c) {
      case '+':
        pos++;
        return new Token(TokenType.PLUS, "+", start);
      case '-':
        pos++;
        return new Token(TokenType.MINUS, "-", start);
      case '*':
        if (peek(1) == '*') {
          pos += 2;
          return new Token(TokenType.DOUBLE_STAR, "**", start);
        }
        pos++;
        return new Token(TokenType.STAR, "*", start);
      case '/':
        if (peek(1) == '/') {
          pos += 2;
          return new Token(TokenType.DOUBLE_SLASH, "//", start);
        }
        pos++;
        return new Token(TokenType.SLASH, "/", start);
      case '%':
        pos++;
        return new Token(TokenType.PERCENT, "%", start);
      case '(':
        pos++;
        return new Token(TokenType.LEFT_PAREN, "(", start);
      case ')':
        pos++;
        return new Token(TokenType.RIGHT_PAREN, ")", start);
      case ',':
        pos++;
        return new Token(TokenType.COMMA, ",", start);
      default:
        throw new ExpressionSyntaxException("Unexpected character '" + c + "'", start);
    }
  }

  private String readNumber() {
    int start = pos;
    while (isDigitAt(pos)) pos++;
    if (pos < text.length() && text.charAt(pos) == '.') {
      pos++;
      while (isDigitAt(pos)) pos++;
    }
    if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      int mark = pos;
      pos++;
      if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
      if (!isDigitAt(pos)) {
        // Not an exponent after all; leave the letter for the next token.
        pos = mark;
      } else {
        while (isDigitAt(pos)) pos++;
      }
    }
    return text.substring(start, pos);
  }

  private String readIdentifier() {
    int start = pos;
    while (pos < text.length()
        && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
      pos++;
    }
    return text.substring(start, pos);
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
  }

  private boolean isDigitAt(int i) {
    return i < text.length() && isDigit(text.charAt(i));
  }

  /** ASCII only; other Unicode digits are not number syntax. */
  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < text.length() ? text.charAt(i) : '\0';
  }
}
