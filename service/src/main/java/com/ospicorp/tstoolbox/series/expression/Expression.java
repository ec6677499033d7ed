package com.ospicorp.tstoolbox.series.expression;

import java.util.List;

/**
 * Parsed formula node. Trees are immutable and built once per request.
 */
public interface Expression {

  /** Column slot of a bare variable: the column currently being computed. */
  int IMPLICIT_COLUMN = -1;

  record Literal(double value) implements Expression {}

  /** The current step {@code t}. */
  record TimeIndex() implements Expression {}

  /** Value of a column at the current step; {@code column} is zero-based or IMPLICIT_COLUMN. */
  record CurrentValue(int column) implements Expression {}

  /** Value of a column at the row computed by {@code row}, e.g. {@code x[t-1]}. */
  record LaggedValue(int column, Expression row) implements Expression {}

  record FunctionCall(MathFunction function, List<Expression> arguments) implements Expression {
    public FunctionCall {
      arguments = List.copyOf(arguments);
    }
  }

  record Negation(Expression operand) implements Expression {}

  record BinaryOperation(Operator operator, Expression left, Expression right)
      implements Expression {}
}
