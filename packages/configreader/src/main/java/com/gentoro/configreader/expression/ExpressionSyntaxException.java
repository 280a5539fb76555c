package com.gentoro.configreader.expression;

/**
 * Raised by the lexer and parser when text is not an expression. Never escapes the evaluator: such
 * text is a plain string value.
 */
class ExpressionSyntaxException extends RuntimeException {
  ExpressionSyntaxException(String message, int position) {
    super(message + " at offset " + position, null, false, false);
  }
}
