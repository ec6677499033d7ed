package com.ospicorp.tstoolbox.series.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tstoolbox.series.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ExpressionParserTest {

  private final ExpressionParser parser = new ExpressionParser();

  @Test
  void bracketReferenceMakesExpressionTimeIndexed() {
    ParsedExpression parsed = parser.parse("x[t] + max(x[t-1], x[t+1]) * 0.6");

    assertThat(parsed.shape()).isEqualTo(ExpressionShape.TIME_INDEXED);
    assertThat(parsed.implicitColumn()).isTrue();
    assertThat(parsed.columns()).isEmpty();
  }

  @Test
  void numberedColumnsAreCollectedZeroBased() {
    ParsedExpression parsed = parser.parse("(x1 - x3) / x2");

    assertThat(parsed.shape()).isEqualTo(ExpressionShape.COLUMN_INDEXED);
    assertThat(parsed.columns()).containsExactly(0, 1, 2);
  }

  @Test
  void plainFormulaIsVectorized() {
    assertThat(parser.parse("sin(x) ** 2 + 1e-3").shape()).isEqualTo(ExpressionShape.VECTORIZED);
    assertThat(parser.parse("x1[t-1] * 2").shape()).isEqualTo(ExpressionShape.TIME_INDEXED);
  }

  @Test
  void unaryMinusBindsLooserThanPower() {
    ParsedExpression parsed = parser.parse("-x**2");

    assertThat(parsed.root()).isInstanceOf(Expression.Negation.class);
  }

  @Test
  void placeholderNamesAreConfigurable() {
    ExpressionParser custom = new ExpressionParser("v", "i");

    assertThat(custom.parse("v[i-1]").shape()).isEqualTo(ExpressionShape.TIME_INDEXED);
    assertThatThrownBy(() -> custom.parse("x[t-1]"))
        .isInstanceOf(ValidationException.class)
        .extracting("errorCode").isEqualTo(3002);
  }

  @Test
  void deepNestingIsRejected() {
    String parens = "(".repeat(50_000) + "x" + ")".repeat(50_000);
    String signs = "-".repeat(50_000) + "x";
    String powers = "x".concat(" ** x".repeat(50_000));
    String chain = "x".concat(" + x".repeat(50_000));

    for (String source : new String[] {parens, signs, powers, chain}) {
      assertThatThrownBy(() -> parser.parse(source))
          .isInstanceOf(ValidationException.class)
          .extracting("errorCode").isEqualTo(3001);
    }
  }

  @Test
  void moderateNestingParses() {
    String nested = "(".repeat(100) + "-x" + ")".repeat(100);

    assertThat(parser.parse(nested).root()).isInstanceOf(Expression.Negation.class);
    assertThat(parser.parse("x".concat(" + x".repeat(200))).shape())
        .isEqualTo(ExpressionShape.VECTORIZED);
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "' '              | 3001",
      "x[t              | 3001",
      "(x + 1           | 3001",
      "x)               | 3001",
      "x $ 2            | 3001",
      "foo(x)           | 3002",
      "y + 1            | 3002",
      "sin + 1          | 3002",
      "x0 * 2           | 3003",
      "atan2(x)         | 3004",
      "max()            | 3004",
      "x + x1           | 3005",
      "t + 1            | 3005",
      "x[1]             | 3005",
      "(x + 1)[t]       | 3005"
  })
  void malformedExpressionsFailBeforeEvaluation(String source, int code) {
    assertThatThrownBy(() -> parser.parse(source))
        .isInstanceOf(ValidationException.class)
        .extracting("errorCode").isEqualTo(code);
  }
}
