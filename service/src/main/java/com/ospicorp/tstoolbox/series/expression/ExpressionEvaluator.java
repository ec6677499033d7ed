package com.ospicorp.tstoolbox.series.expression;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.expression.Expression.BinaryOperation;
import com.ospicorp.tstoolbox.series.expression.Expression.CurrentValue;
import com.ospicorp.tstoolbox.series.expression.Expression.FunctionCall;
import com.ospicorp.tstoolbox.series.expression.Expression.LaggedValue;
import com.ospicorp.tstoolbox.series.expression.Expression.Literal;
import com.ospicorp.tstoolbox.series.expression.Expression.Negation;
import com.ospicorp.tstoolbox.series.expression.Expression.TimeIndex;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking evaluator for {@link ParsedExpression}s over a {@link TimeSeries}.
 *
 * <p>Every operator and function is scalar, so the element-wise shapes are computed by the same
 * walk applied row by row. Only lag/lead references can fail at run time; such a failure turns
 * that single row into NaN.
 */
public class ExpressionEvaluator {
  /** Column name of the single result produced from numbered column references. */
  public static final String DERIVED_COLUMN = "_";

  private final ExpressionParser parser;

  public ExpressionEvaluator() {
    this(new ExpressionParser());
  }

  public ExpressionEvaluator(ExpressionParser parser) {
    this.parser = parser;
  }

  public TimeSeries evaluate(TimeSeries series, String source) {
    return evaluate(series, parser.parse(source)).series();
  }

  public Evaluation evaluate(TimeSeries series, ParsedExpression expression) {
    validateColumns(series, expression);
    Map<String, double[]> out = new LinkedHashMap<>();
    int faults = 0;
    if (expression.columns().isEmpty()) {
      for (int c = 0; c < series.columnCount(); c++) {
        double[] values = new double[series.size()];
        faults += evaluateRows(series, expression.root(), c, values);
        out.put(series.columnNames().get(c), values);
      }
    } else {
      double[] values = new double[series.size()];
      faults += evaluateRows(series, expression.root(), Expression.IMPLICIT_COLUMN, values);
      out.put(DERIVED_COLUMN, values);
    }
    return new Evaluation(series.withColumns(out), expression.shape(), faults);
  }

  public ParsedExpression parse(String source) {
    return parser.parse(source);
  }

  private static void validateColumns(TimeSeries series, ParsedExpression expression) {
    if (expression.columns().isEmpty()) {
      return;
    }
    int highest = expression.columns().last();
    if (highest >= series.columnCount()) {
      throw new ValidationException("Column reference " + (highest + 1L)
          + " is outside the available columns 1-" + series.columnCount() + ".", 3003);
    }
  }

  private static int evaluateRows(TimeSeries series, Expression root, int implicitColumn,
      double[] target) {
    int faults = 0;
    Scope scope = new Scope(series, implicitColumn);
    for (int t = 0; t < target.length; t++) {
      scope.row = t;
      try {
        target[t] = eval(root, scope);
      } catch (RowOutOfRange ex) {
        target[t] = Double.NaN;
        faults++;
      }
    }
    return faults;
  }

  private static double eval(Expression node, Scope scope) {
    if (node instanceof Literal literal) {
      return literal.value();
    }
    if (node instanceof TimeIndex) {
      return scope.row;
    }
    if (node instanceof CurrentValue value) {
      return scope.cell(scope.row, value.column());
    }
    if (node instanceof LaggedValue lagged) {
      double index = eval(lagged.row(), scope);
      if (Double.isNaN(index) || index != Math.rint(index) || index < 0
          || index >= scope.series.size()) {
        throw RowOutOfRange.INSTANCE;
      }
      return scope.cell((int) index, lagged.column());
    }
    if (node instanceof Negation negation) {
      return -eval(negation.operand(), scope);
    }
    if (node instanceof BinaryOperation binary) {
      return binary.operator().applyAsDouble(eval(binary.left(), scope),
          eval(binary.right(), scope));
    }
    if (node instanceof FunctionCall call) {
      List<Expression> arguments = call.arguments();
      double[] values = new double[arguments.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = eval(arguments.get(i), scope);
      }
      return call.function().apply(values);
    }
    throw new IllegalStateException("Unhandled expression node " + node);
  }

  /**
   * Result of an evaluation.
   *
   * @param faultedRows rows set to NaN because a lag/lead reference left the series
   */
  public record Evaluation(TimeSeries series, ExpressionShape shape, int faultedRows) {}

  private static final class Scope {
    private final TimeSeries series;
    private final int implicitColumn;
    private int row;

    Scope(TimeSeries series, int implicitColumn) {
      this.series = series;
      this.implicitColumn = implicitColumn;
    }

    double cell(int row, int column) {
      return series.value(row, column == Expression.IMPLICIT_COLUMN ? implicitColumn : column);
    }
  }

  // control flow only: carries no stack trace
  private static final class RowOutOfRange extends RuntimeException {
    static final RowOutOfRange INSTANCE = new RowOutOfRange();

    private RowOutOfRange() {
      super("row reference outside of series", null, false, false);
    }
  }
}
