package csflow;

import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Splits the argument text of a command into literal, identifier and operator tokens. Holds no
 * state between calls; unrecognised characters are skipped and reported.
 */
final class ExpressionTokenizer {
  // Longest spelling first.
  private static final ImmutableMap<String, Token.Type> MARKERS =
      ImmutableMap.<String, Token.Type>builder()
          .put("$!!{", Token.Type.OPEN_PRINT_UPPERCASE)
          .put("$!{", Token.Type.OPEN_PRINT_CAPITALIZED)
          .put("${", Token.Type.OPEN_PRINT)
          .put("@{", Token.Type.OPEN_MULTI_REPLACE)
          .build();

  private static final ImmutableList<String> TWO_CHAR_OPERATORS =
      ImmutableList.of("%+", "%-", ">=", "<=", "!=");

  private final String scene;
  private final Diagnostics diagnostics;

  ExpressionTokenizer(String scene, Diagnostics diagnostics) {
    this.scene = scene;
    this.diagnostics = diagnostics;
  }

  ImmutableList<Token> tokenize(String text, int line, int columnOffset, double indent) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      Scanner.Pos pos = new Scanner.Pos(scene, line, columnOffset + i);

      if (Character.isWhitespace(ch)) {
        i++;
        continue;
      }

      if (Character.isDigit(ch) || (ch == '.' && i + 1 < text.length()
          && Character.isDigit(text.charAt(i + 1)))) {
        int start = i;
        boolean seenPoint = false;
        while (i < text.length()) {
          char c = text.charAt(i);
          if (c == '.' && !seenPoint) {
            seenPoint = true;
          } else if (!Character.isDigit(c)) {
            break;
          }
          i++;
        }
        String number = text.substring(start, i);
        tokens.add(Token.create(Token.Type.NUMBER, pos, indent, number, number));
        continue;
      }

      if (ch == '"' || ch == '\'') {
        int start = i++;
        StringBuilder value = new StringBuilder();
        boolean closed = false;
        while (i < text.length()) {
          char c = text.charAt(i++);
          if (c == '\\' && i < text.length()) {
            value.append(text.charAt(i++));
          } else if (c == ch) {
            closed = true;
            break;
          } else {
            value.append(c);
          }
        }
        if (!closed) {
          diagnostics.warn(Diagnostic.Kind.LEXICAL, pos, "unterminated string literal");
        }
        tokens.add(
            Token.create(Token.Type.STRING, pos, indent, text.substring(start, i), value.toString()));
        continue;
      }

      if (ch == '(' || ch == ')') {
        Token.Type type = ch == '(' ? Token.Type.OPEN_PAREN : Token.Type.CLOSE_PAREN;
        tokens.add(Token.create(type, pos, indent, String.valueOf(ch), String.valueOf(ch)));
        i++;
        continue;
      }

      Optional<String> marker = matchAt(text, i, MARKERS.keySet());
      if (marker.isPresent()) {
        String m = marker.get();
        tokens.add(Token.create(MARKERS.get(m), pos, indent, m, m));
        i += m.length();
        continue;
      }

      Optional<String> twoChar = matchAt(text, i, TWO_CHAR_OPERATORS);
      if (twoChar.isPresent()) {
        String op = twoChar.get();
        tokens.add(Token.operator(Operator.forSymbol(op).get(), pos, indent, op));
        i += 2;
        continue;
      }

      if ("+-*/%&=<>".indexOf(ch) >= 0) {
        String op = String.valueOf(ch);
        tokens.add(Token.operator(Operator.forSymbol(op).get(), pos, indent, op));
        i++;
        continue;
      }

      if (ch == '|' || ch == '}') {
        Token.Type type = ch == '|' ? Token.Type.MULTI_REPLACE_SEPARATOR : Token.Type.CLOSE_BRACE;
        tokens.add(Token.create(type, pos, indent, String.valueOf(ch), String.valueOf(ch)));
        i++;
        continue;
      }

      if (isIdentifierChar(ch)) {
        int start = i;
        while (i < text.length() && isIdentifierChar(text.charAt(i))) {
          i++;
        }
        tokens.add(word(text.substring(start, i), pos, indent));
        continue;
      }

      diagnostics.warn(
          Diagnostic.Kind.LEXICAL, pos, String.format("unexpected character '%c' in expression", ch));
      i++;
    }

    return tokens.build();
  }

  private static Token word(String word, Scanner.Pos pos, double indent) {
    switch (word) {
      case "true":
      case "false":
        return Token.create(Token.Type.BOOLEAN, pos, indent, word, word);
      case "and":
      case "or":
      case "not":
      case "round":
      case "modulo":
        return Token.operator(Operator.forSymbol(word).get(), pos, indent, word);
      default:
        return Token.create(Token.Type.IDENTIFIER, pos, indent, word, word);
    }
  }

  private static boolean isIdentifierChar(char ch) {
    return ch == '_' || Character.isLetterOrDigit(ch);
  }

  private static Optional<String> matchAt(String text, int index, Iterable<String> candidates) {
    for (String candidate : candidates) {
      if (text.startsWith(candidate, index)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
