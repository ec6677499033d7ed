package com.ospicorp.tstoolbox.series.expression;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.expression.Expression.BinaryOperation;
import com.ospicorp.tstoolbox.series.expression.Expression.CurrentValue;
import com.ospicorp.tstoolbox.series.expression.Expression.FunctionCall;
import com.ospicorp.tstoolbox.series.expression.Expression.LaggedValue;
import com.ospicorp.tstoolbox.series.expression.Expression.Literal;
import com.ospicorp.tstoolbox.series.expression.Expression.Negation;
import com.ospicorp.tstoolbox.series.expression.Expression.TimeIndex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Recursive-descent parser for row formulas such as {@code x[t] + max(x[t-1], x[t+1]) * 0.6} or
 * {@code (x1 - x2) / x3}.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := postfix (('**' | '^') unary)?
 * postfix    := primary ('[' expression ']')?
 * primary    := NUMBER | IDENT | IDENT '(' arguments ')' | '(' expression ')'
 * </pre>
 *
 * All structural checks happen here, so a formula that parses never fails for syntactic reasons
 * while rows are evaluated. Nesting, operator chains and repeated signs count towards a depth
 * limit of {@value #MAX_DEPTH}, which bounds both parsing and evaluation recursion.
 */
public class ExpressionParser {
  public static final String DEFAULT_VARIABLE = "x";
  public static final String DEFAULT_TIME_VARIABLE = "t";
  public static final int MAX_DEPTH = 500;

  private static final Map<String, Double> CONSTANTS = Map.of(
      "pi", Math.PI,
      "e", Math.E,
      "nan", Double.NaN,
      "inf", Double.POSITIVE_INFINITY);

  private final String variable;
  private final String timeVariable;

  public ExpressionParser() {
    this(DEFAULT_VARIABLE, DEFAULT_TIME_VARIABLE);
  }

  public ExpressionParser(String variable, String timeVariable) {
    if (variable.equals(timeVariable)) {
      throw new IllegalArgumentException("variable and time variable must differ");
    }
    this.variable = variable;
    this.timeVariable = timeVariable;
  }

  public ParsedExpression parse(String source) {
    if (source == null || source.isBlank()) {
      throw new ValidationException("The equation must not be empty.", 3001);
    }
    Cursor cursor = new Cursor(ExpressionLexer.tokenize(source));
    Expression root = cursor.expression();
    Token trailing = cursor.peek();
    if (trailing.type() != TokenType.EOF) {
      String hint = trailing.type() == TokenType.RPAREN || trailing.type() == TokenType.RBRACKET
          ? "Unbalanced brackets: unexpected " : "Unexpected ";
      throw new ValidationException(hint + trailing + " in expression.", 3001);
    }

    if (cursor.implicitColumn && !cursor.columns.isEmpty()) {
      throw new ValidationException("Cannot mix '" + variable + "' with numbered columns '"
          + variable + "1', '" + variable + "2', ... in one expression.", 3005);
    }
    if (cursor.usesTime && !cursor.hasLag) {
      throw new ValidationException("'" + timeVariable + "' can only be used together with a "
          + "bracket reference such as " + variable + "[" + timeVariable + "-1].", 3005);
    }

    ExpressionShape shape;
    if (cursor.hasLag) {
      shape = ExpressionShape.TIME_INDEXED;
    } else if (!cursor.columns.isEmpty()) {
      shape = ExpressionShape.COLUMN_INDEXED;
    } else {
      shape = ExpressionShape.VECTORIZED;
    }
    return new ParsedExpression(source, root, shape,
        Collections.unmodifiableSortedSet(cursor.columns), cursor.implicitColumn);
  }

  private final class Cursor {
    private final List<Token> tokens;
    private int pos;
    private final SortedSet<Integer> columns = new TreeSet<>();
    private boolean implicitColumn;
    private boolean usesTime;
    private boolean hasLag;
    private int depth;

    Cursor(List<Token> tokens) {
      this.tokens = tokens;
    }

    Token peek() {
      return tokens.get(pos);
    }

    private boolean at(TokenType type) {
      return peek().type() == type;
    }

    private Token advance() {
      return tokens.get(pos++);
    }

    private void expect(TokenType type, String what) {
      if (!at(type)) {
        throw new ValidationException("Unbalanced brackets: expected " + what + " but found "
            + peek() + ".", 3001);
      }
      advance();
    }

    private void descend() {
      if (++depth > MAX_DEPTH) {
        throw new ValidationException("Expression is nested more than " + MAX_DEPTH
            + " levels deep.", 3001);
      }
    }

    Expression expression() {
      int entry = depth;
      descend();
      Expression left = term();
      while (at(TokenType.PLUS) || at(TokenType.MINUS)) {
        Operator op = advance().type() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
        descend();
        left = new BinaryOperation(op, left, term());
      }
      depth = entry;
      return left;
    }

    private Expression term() {
      int entry = depth;
      Expression left = unary();
      while (at(TokenType.STAR) || at(TokenType.SLASH) || at(TokenType.PERCENT)) {
        Operator op = switch (advance().type()) {
          case STAR -> Operator.MULTIPLY;
          case SLASH -> Operator.DIVIDE;
          default -> Operator.MODULO;
        };
        descend();
        left = new BinaryOperation(op, left, unary());
      }
      depth = entry;
      return left;
    }

    private Expression unary() {
      if (at(TokenType.MINUS) || at(TokenType.PLUS)) {
        boolean negate = advance().type() == TokenType.MINUS;
        int entry = depth;
        descend();
        Expression operand = unary();
        depth = entry;
        return negate ? new Negation(operand) : operand;
      }
      return power();
    }

    private Expression power() {
      Expression base = postfix();
      if (at(TokenType.POWER)) {
        advance();
        int entry = depth;
        descend();
        Expression exponent = unary();
        depth = entry;
        return new BinaryOperation(Operator.POWER, base, exponent);
      }
      return base;
    }

    private Expression postfix() {
      Token start = peek();
      Expression primary = primary();
      if (!at(TokenType.LBRACKET)) {
        return primary;
      }
      if (!(primary instanceof CurrentValue value)) {
        throw new ValidationException("Only a column can be indexed with brackets, near "
            + start + ".", 3005);
      }
      advance();
      usesTime = false;
      Expression row = expression();
      expect(TokenType.RBRACKET, "']'");
      if (!usesTime) {
        throw new ValidationException("The bracket index after " + start + " must reference '"
            + timeVariable + "'.", 3005);
      }
      usesTime = true;
      hasLag = true;
      return new LaggedValue(value.column(), row);
    }

    private Expression primary() {
      Token token = advance();
      switch (token.type()) {
        case NUMBER -> {
          try {
            return new Literal(Double.parseDouble(token.text()));
          } catch (NumberFormatException ex) {
            throw new ValidationException("Malformed number " + token + ".", 3001);
          }
        }
        case LPAREN -> {
          Expression inner = expression();
          expect(TokenType.RPAREN, "')'");
          return inner;
        }
        case IDENTIFIER -> {
          if (at(TokenType.LPAREN)) {
            return call(token);
          }
          return identifier(token);
        }
        default -> throw new ValidationException("Unexpected " + token + " in expression.", 3001);
      }
    }

    private Expression call(Token name) {
      MathFunction function = MathFunction.byName(name.text())
          .orElseThrow(() -> new ValidationException("Unknown function " + name + ".", 3002));
      advance();
      List<Expression> arguments = new ArrayList<>();
      if (!at(TokenType.RPAREN)) {
        arguments.add(expression());
        while (at(TokenType.COMMA)) {
          advance();
          arguments.add(expression());
        }
      }
      expect(TokenType.RPAREN, "')'");
      if (!function.accepts(arguments.size())) {
        throw new ValidationException("Function " + name.text() + " takes "
            + function.arityDescription() + " argument(s), got " + arguments.size() + ".", 3004);
      }
      return new FunctionCall(function, arguments);
    }

    private Expression identifier(Token token) {
      String name = token.text();
      if (name.equals(variable)) {
        implicitColumn = true;
        return new CurrentValue(Expression.IMPLICIT_COLUMN);
      }
      if (name.equals(timeVariable)) {
        usesTime = true;
        return new TimeIndex();
      }
      if (name.length() > variable.length() && name.startsWith(variable)
          && name.substring(variable.length()).chars().allMatch(Character::isDigit)) {
        int position;
        try {
          position = Integer.parseInt(name.substring(variable.length()));
        } catch (NumberFormatException ex) {
          position = Integer.MAX_VALUE;
        }
        if (position < 1) {
          throw new ValidationException("Column references start at " + variable + "1, got "
              + token + ".", 3003);
        }
        columns.add(position - 1);
        return new CurrentValue(position - 1);
      }
      Double constant = CONSTANTS.get(name);
      if (constant != null) {
        return new Literal(constant);
      }
      if (MathFunction.byName(name).isPresent()) {
        throw new ValidationException("Function " + token + " must be called with "
            + "parentheses.", 3002);
      }
      throw new ValidationException("Unknown name " + token + ". Use '" + variable + "', '"
          + variable + "1', '" + variable + "2', ... or '" + timeVariable + "'.", 3002);
    }
  }
}
