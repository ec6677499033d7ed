package com.ospicorp.tstoolbox.series.expression;

record Token(TokenType type, String text, int position) {
  @Override
  public String toString() {
    return type == TokenType.EOF ? "end of expression" : "'" + text + "' at " + position;
  }
}
