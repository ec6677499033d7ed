package com.ospicorp.tstoolbox.series.model.enums;

import java.util.function.DoubleBinaryOperator;

public enum PointwiseDistance implements DoubleBinaryOperator {
  ABSOLUTE {
    @Override
    public double applyAsDouble(double x, double y) {
      return Math.abs(x - y);
    }
  },
  SQUARED {
    @Override
    public double applyAsDouble(double x, double y) {
      double d = x - y;
      return d * d;
    }
  }
}
