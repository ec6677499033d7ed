package com.ospicorp.tstoolbox.series.expression;

import java.util.function.DoubleBinaryOperator;

public enum Operator implements DoubleBinaryOperator {
  ADD {
    @Override
    public double applyAsDouble(double left, double right) {
      return left + right;
    }
  },
  SUBTRACT {
    @Override
    public double applyAsDouble(double left, double right) {
      return left - right;
    }
  },
  MULTIPLY {
    @Override
    public double applyAsDouble(double left, double right) {
      return left * right;
    }
  },
  DIVIDE {
    @Override
    public double applyAsDouble(double left, double right) {
      return left / right;
    }
  },
  /** Floored modulo: the result takes the sign of the divisor. */
  MODULO {
    @Override
    public double applyAsDouble(double left, double right) {
      double r = left % right;
      return (r != 0 && (r < 0) != (right < 0)) ? r + right : r;
    }
  },
  POWER {
    @Override
    public double applyAsDouble(double left, double right) {
      return Math.pow(left, right);
    }
  };
}
