package csflow;

import java.util.Arrays;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/** One lexical unit of a scene. Tokens are immutable once emitted by the {@link Scanner}. */
@AutoValue
public abstract class Token {
  /** How the scanner reads the rest of a command's line. */
  enum Tail {
    NONE,
    // Expression tokens follow the command token.
    EXPRESSION,
    // The rest of the line is kept verbatim in the command token's text.
    TEXT,
    COMMENT,
    // Like TEXT, then every deeper-indented line becomes a BLOCK_LINE token.
    BLOCK,
    // The line continues with another command or a choice option.
    PREFIX;
  }

  public enum Type {
    SCENE_START,
    SCENE_END,
    PROSE,
    BLOCK_LINE,
    CHOICE_OPTION,

    LABEL("label", Tail.EXPRESSION),
    GOTO("goto", Tail.EXPRESSION),
    GOTO_SCENE("goto_scene", Tail.EXPRESSION),
    GOTO_RANDOM_SCENE("goto_random_scene", Tail.BLOCK),
    GOSUB("gosub", Tail.EXPRESSION),
    GOSUB_SCENE("gosub_scene", Tail.EXPRESSION),
    RETURN("return", Tail.TEXT),
    CHOICE("choice", Tail.TEXT),
    FAKE_CHOICE("fake_choice", Tail.TEXT),
    HIDE_REUSE("hide_reuse", Tail.PREFIX),
    DISABLE_REUSE("disable_reuse", Tail.PREFIX),
    ALLOW_REUSE("allow_reuse", Tail.PREFIX),
    SELECTABLE_IF("selectable_if", Tail.EXPRESSION),
    IF("if", Tail.EXPRESSION),
    ELSEIF("elseif", Tail.EXPRESSION),
    ELSE("else", Tail.TEXT),
    ENDIF("endif", Tail.TEXT),
    CREATE("create", Tail.EXPRESSION),
    TEMP("temp", Tail.EXPRESSION),
    SET("set", Tail.EXPRESSION),
    INPUT_TEXT("input_text", Tail.EXPRESSION),
    FINISH("finish", Tail.TEXT),
    PAGE_BREAK("page_break", Tail.TEXT),
    COMMENT("comment", Tail.COMMENT),
    SCENE_LIST("scene_list", Tail.BLOCK),
    ACHIEVEMENT("achievement", Tail.BLOCK),
    STAT_CHART("stat_chart", Tail.BLOCK),
    TITLE("title", Tail.TEXT),
    AUTHOR("author", Tail.TEXT),
    // A ChoiceScript command with no flow semantics of its own, e.g. *image.
    COMMAND(Tail.TEXT),
    // '*word' where word is not a command at all.
    UNKNOWN_COMMAND(Tail.TEXT),

    NUMBER,
    STRING,
    BOOLEAN,
    IDENTIFIER,
    OPERATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_MULTI_REPLACE,
    OPEN_PRINT,
    OPEN_PRINT_CAPITALIZED,
    OPEN_PRINT_UPPERCASE,
    MULTI_REPLACE_SEPARATOR,
    CLOSE_BRACE;

    private final Optional<String> keyword;
    private final Tail tail;

    Type() {
      this.keyword = Optional.empty();
      this.tail = Tail.NONE;
    }

    Type(Tail tail) {
      this.keyword = Optional.empty();
      this.tail = tail;
    }

    Type(String keyword, Tail tail) {
      this.keyword = Optional.of(keyword);
      this.tail = tail;
    }

    public Optional<String> keyword() {
      return keyword;
    }

    Tail tail() {
      return tail;
    }

    public boolean isCommand() {
      return tail != Tail.NONE;
    }

    public boolean isExpression() {
      return compareTo(NUMBER) >= 0;
    }
  }

  private static final ImmutableMap<String, Type> KEYWORDS =
      Arrays.asList(Type.values())
          .stream()
          .filter(t -> t.keyword().isPresent())
          .collect(ImmutableMap.toImmutableMap(t -> t.keyword().get(), t -> t));

  /** Returns the command type spelled {@code *keyword}, accepting {@code elsif} for elseif. */
  static Optional<Type> forKeyword(String keyword) {
    if (keyword.equals("elsif")) return Optional.of(Type.ELSEIF);
    return Optional.ofNullable(KEYWORDS.get(keyword));
  }

  public abstract Type type();

  public abstract Scanner.Pos pos();

  /** Fractional indent of the token's line: a tab counts 1.0 and a space 0.5. */
  public abstract double indent();

  /** The token's spelling in the source, e.g. {@code *goto}, {@code #} or {@code %+}. */
  public abstract String lexeme();

  /**
   * Kind-specific payload: narrative text for prose, options and text-tail commands, the raw
   * argument text for expression-tail commands, the value of a literal or the name of an
   * identifier.
   */
  public abstract String text();

  public abstract Optional<Operator> operator();

  public static Token create(Type type, Scanner.Pos pos, double indent, String lexeme, String text) {
    return new AutoValue_Token(type, pos, indent, lexeme, text, Optional.empty());
  }

  public static Token operator(Operator operator, Scanner.Pos pos, double indent, String lexeme) {
    return new AutoValue_Token(
        Type.OPERATOR, pos, indent, lexeme, operator.symbol(), Optional.of(operator));
  }

  /** The command name without the leading '*'. */
  public String commandName() {
    Preconditions.checkState(type().isCommand(), "Not a command: %s", this);
    return lexeme().substring(1);
  }

  public double numberValue() {
    Preconditions.checkState(type() == Type.NUMBER, "Not a number: %s", this);
    return Double.parseDouble(text());
  }

  public boolean booleanValue() {
    Preconditions.checkState(type() == Type.BOOLEAN, "Not a boolean: %s", this);
    return Boolean.parseBoolean(text());
  }

  public boolean isOperator(Operator op) {
    return operator().isPresent() && operator().get() == op;
  }

  static String formatIndent(double indent) {
    return indent == Math.rint(indent) ? Integer.toString((int) indent) : Double.toString(indent);
  }

  @Override
  public String toString() {
    return String.format("%s '%s' at %s", type(), lexeme(), pos());
  }
}
