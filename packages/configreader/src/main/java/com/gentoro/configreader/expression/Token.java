package com.gentoro.configreader.expression;

record Token(TokenType type, String text, int position) {

  boolean is(TokenType t) {
    return type == t;
  }
}
