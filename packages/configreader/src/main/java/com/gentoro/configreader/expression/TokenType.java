package com.gentoro.configreader.expression;

enum TokenType {
  NUMBER,
  IDENTIFIER,
  PLUS,
  MINUS,
  STAR,
  DOUBLE_STAR,
  SLASH,
  DOUBLE_SLASH,
  PERCENT,
  LEFT_PAREN,
  RIGHT_PAREN,
  COMMA,
  END
}
