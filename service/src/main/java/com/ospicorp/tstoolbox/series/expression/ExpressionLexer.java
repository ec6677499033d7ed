package com.ospicorp.tstoolbox.series.expression;

import com.ospicorp.tstoolbox.series.ValidationException;
import java.util.ArrayList;
import java.util.List;

final class ExpressionLexer {
  private ExpressionLexer() {
  }

  static List<Token> tokenize(String source) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isDigit(c) || (c == '.' && i + 1 < source.length()
          && Character.isDigit(source.charAt(i + 1)))) {
        int end = scanNumber(source, i);
        tokens.add(new Token(TokenType.NUMBER, source.substring(i, end), i));
        i = end;
      } else if (Character.isLetter(c) || c == '_') {
        int end = i + 1;
        while (end < source.length()
            && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
          end++;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, source.substring(i, end), i));
        i = end;
      } else if (c == '*' && i + 1 < source.length() && source.charAt(i + 1) == '*') {
        tokens.add(new Token(TokenType.POWER, "**", i));
        i += 2;
      } else {
        TokenType type = switch (c) {
          case '+' -> TokenType.PLUS;
          case '-' -> TokenType.MINUS;
          case '*' -> TokenType.STAR;
          case '/' -> TokenType.SLASH;
          case '%' -> TokenType.PERCENT;
          case '^' -> TokenType.POWER;
          case '(' -> TokenType.LPAREN;
          case ')' -> TokenType.RPAREN;
          case '[' -> TokenType.LBRACKET;
          case ']' -> TokenType.RBRACKET;
          case ',' -> TokenType.COMMA;
          default -> throw new ValidationException(
              "Unexpected character '" + c + "' at " + i + " in expression.", 3001);
        };
        tokens.add(new Token(type, String.valueOf(c), i));
        i++;
      }
    }
    tokens.add(new Token(TokenType.EOF, "", source.length()));
    return tokens;
  }

  private static int scanNumber(String s, int start) {
    int i = start;
    while (i < s.length() && Character.isDigit(s.charAt(i))) {
      i++;
    }
    if (i < s.length() && s.charAt(i) == '.') {
      i++;
      while (i < s.length() && Character.isDigit(s.charAt(i))) {
        i++;
      }
    }
    if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      int exp = i + 1;
      if (exp < s.length() && (s.charAt(exp) == '+' || s.charAt(exp) == '-')) {
        exp++;
      }
      if (exp < s.length() && Character.isDigit(s.charAt(exp))) {
        i = exp;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
          i++;
        }
      }
    }
    return i;
  }
}
