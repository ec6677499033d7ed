package com.ospicorp.tstoolbox.series.expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Scalar functions callable by name inside an expression. {@code maxArity} of -1 means variadic.
 */
public enum MathFunction {
  SIN(1, 1, a -> Math.sin(a[0]), "sin"),
  COS(1, 1, a -> Math.cos(a[0]), "cos"),
  TAN(1, 1, a -> Math.tan(a[0]), "tan"),
  ARCSIN(1, 1, a -> Math.asin(a[0]), "arcsin", "asin"),
  ARCCOS(1, 1, a -> Math.acos(a[0]), "arccos", "acos"),
  ARCTAN(1, 1, a -> Math.atan(a[0]), "arctan", "atan"),
  ARCTAN2(2, 2, a -> Math.atan2(a[0], a[1]), "arctan2", "atan2"),
  SINH(1, 1, a -> Math.sinh(a[0]), "sinh"),
  COSH(1, 1, a -> Math.cosh(a[0]), "cosh"),
  TANH(1, 1, a -> Math.tanh(a[0]), "tanh"),
  EXP(1, 1, a -> Math.exp(a[0]), "exp"),
  EXPM1(1, 1, a -> Math.expm1(a[0]), "expm1"),
  LOG(1, 1, a -> Math.log(a[0]), "log"),
  LOG10(1, 1, a -> Math.log10(a[0]), "log10"),
  LOG2(1, 1, a -> Math.log(a[0]) / Math.log(2.0), "log2"),
  LOG1P(1, 1, a -> Math.log1p(a[0]), "log1p"),
  SQRT(1, 1, a -> Math.sqrt(a[0]), "sqrt"),
  CBRT(1, 1, a -> Math.cbrt(a[0]), "cbrt"),
  ABS(1, 1, a -> Math.abs(a[0]), "abs", "fabs"),
  FLOOR(1, 1, a -> Math.floor(a[0]), "floor"),
  CEIL(1, 1, a -> Math.ceil(a[0]), "ceil"),
  // half to even
  ROUND(1, 1, a -> Math.rint(a[0]), "round", "rint"),
  TRUNC(1, 1, a -> a[0] < 0 ? Math.ceil(a[0]) : Math.floor(a[0]), "trunc"),
  SIGN(1, 1, a -> Math.signum(a[0]), "sign"),
  HYPOT(2, 2, a -> Math.hypot(a[0], a[1]), "hypot"),
  POWER(2, 2, a -> Math.pow(a[0], a[1]), "power", "pow"),
  DEG2RAD(1, 1, a -> Math.toRadians(a[0]), "deg2rad", "radians"),
  RAD2DEG(1, 1, a -> Math.toDegrees(a[0]), "rad2deg", "degrees"),
  MIN(1, -1, MathFunction::minimum, "min", "minimum"),
  MAX(1, -1, MathFunction::maximum, "max", "maximum");

  private static final Map<String, MathFunction> BY_NAME;

  static {
    Map<String, MathFunction> names = new HashMap<>();
    for (MathFunction f : values()) {
      for (String alias : f.aliases) {
        names.put(alias, f);
      }
    }
    BY_NAME = Collections.unmodifiableMap(names);
  }

  private final int minArity;
  private final int maxArity;
  private final ToDoubleFunction<double[]> body;
  private final List<String> aliases;

  MathFunction(int minArity, int maxArity, ToDoubleFunction<double[]> body, String... aliases) {
    this.minArity = minArity;
    this.maxArity = maxArity;
    this.body = body;
    this.aliases = List.of(aliases);
  }

  public static Optional<MathFunction> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  public boolean accepts(int arity) {
    return arity >= minArity && (maxArity < 0 || arity <= maxArity);
  }

  public String arityDescription() {
    if (maxArity < 0) {
      return "at least " + minArity;
    }
    return minArity == maxArity ? String.valueOf(minArity) : minArity + "-" + maxArity;
  }

  public double apply(double... arguments) {
    return body.applyAsDouble(arguments);
  }

  private static double minimum(double[] a) {
    double m = a[0];
    for (int i = 1; i < a.length; i++) {
      m = Math.min(m, a[i]);
    }
    return m;
  }

  private static double maximum(double[] a) {
    double m = a[0];
    for (int i = 1; i < a.length; i++) {
      m = Math.max(m, a[i]);
    }
    return m;
  }
}
