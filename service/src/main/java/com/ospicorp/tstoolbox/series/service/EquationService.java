package com.ospicorp.tstoolbox.series.service;

import com.ospicorp.tstoolbox.series.expression.ExpressionEvaluator;
import com.ospicorp.tstoolbox.series.expression.ExpressionEvaluator.Evaluation;
import com.ospicorp.tstoolbox.series.expression.ExpressionParser;
import com.ospicorp.tstoolbox.series.expression.ParsedExpression;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class EquationService {
  static final String SUFFIX = "_equation";

  private static final Logger log = LoggerFactory.getLogger(EquationService.class);

  private final ExpressionEvaluator evaluator;

  public EquationService(@Value("${tstoolbox.equation.variable:x}") String variable,
      @Value("${tstoolbox.equation.time-variable:t}") String timeVariable) {
    this.evaluator = new ExpressionEvaluator(new ExpressionParser(variable, timeVariable));
  }

  public TimeSeries evaluate(TimeSeries series, String equation, boolean printInput) {
    ParsedExpression parsed = evaluator.parse(equation);
    Evaluation evaluation = evaluator.evaluate(series, parsed);
    log.debug("Evaluated '{}' as {} over {} rows, {} row(s) outside the series", equation,
        evaluation.shape(), series.size(), evaluation.faultedRows());
    return printInput ? series.join(evaluation.series(), SUFFIX) : evaluation.series();
  }
}
