package csflow;

import com.google.auto.value.AutoValue;

/** Expression tree produced by the {@link Parser}. Each node is owned by one statement. */
public abstract class Expression {
  public enum Type {
    LITERAL,
    IDENTIFIER,
    UNARY,
    BINARY,
    GROUPING;
  }

  public abstract Type type();

  public abstract Scanner.Pos pos();

  /** Renders the expression back to ChoiceScript syntax with canonical spacing. */
  public abstract String toSource();

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  /** Strips redundant outer parentheses, as in {@code *if (gold > 5)}. */
  public Expression unwrap() {
    Expression expr = this;
    while (expr.type() == Type.GROUPING) {
      Grouping grouping = expr.cast();
      expr = grouping.inner();
    }
    return expr;
  }

  @AutoValue
  public abstract static class Literal extends Expression {
    public enum Kind {
      NUMBER,
      STRING,
      BOOLEAN;
    }

    public abstract Kind kind();

    // Unquoted.
    public abstract String value();

    @Override
    public Type type() {
      return Type.LITERAL;
    }

    @Override
    public String toSource() {
      if (kind() != Kind.STRING) return value();
      return '"' + value().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    public static Literal create(Scanner.Pos pos, Kind kind, String value) {
      return new AutoValue_Expression_Literal(pos, kind, value);
    }
  }

  @AutoValue
  public abstract static class Identifier extends Expression {
    public abstract String name();

    @Override
    public Type type() {
      return Type.IDENTIFIER;
    }

    @Override
    public String toSource() {
      return name();
    }

    public static Identifier create(Scanner.Pos pos, String name) {
      return new AutoValue_Expression_Identifier(pos, name);
    }
  }

  @AutoValue
  public abstract static class Unary extends Expression {
    public abstract Operator operator();

    public abstract Expression operand();

    @Override
    public Type type() {
      return Type.UNARY;
    }

    @Override
    public String toSource() {
      String separator = operator().isWord() && operand().type() != Type.GROUPING ? " " : "";
      return operator().symbol() + separator + operand().toSource();
    }

    public static Unary create(Scanner.Pos pos, Operator operator, Expression operand) {
      return new AutoValue_Expression_Unary(pos, operator, operand);
    }
  }

  @AutoValue
  public abstract static class Binary extends Expression {
    public abstract Expression left();

    public abstract Operator operator();

    public abstract Expression right();

    @Override
    public Type type() {
      return Type.BINARY;
    }

    @Override
    public String toSource() {
      return left().toSource() + " " + operator().symbol() + " " + right().toSource();
    }

    public static Binary create(
        Scanner.Pos pos, Expression left, Operator operator, Expression right) {
      return new AutoValue_Expression_Binary(pos, left, operator, right);
    }
  }

  @AutoValue
  public abstract static class Grouping extends Expression {
    public abstract Expression inner();

    @Override
    public Type type() {
      return Type.GROUPING;
    }

    @Override
    public String toSource() {
      return "(" + inner().toSource() + ")";
    }

    public static Grouping create(Scanner.Pos pos, Expression inner) {
      return new AutoValue_Expression_Grouping(pos, inner);
    }
  }
}
