package com.ospicorp.tstoolbox.series.expression;

enum TokenType {
  NUMBER,
  IDENTIFIER,
  PLUS,
  MINUS,
  STAR,
  SLASH,
  PERCENT,
  POWER,
  LPAREN,
  RPAREN,
  LBRACKET,
  RBRACKET,
  COMMA,
  EOF
}
