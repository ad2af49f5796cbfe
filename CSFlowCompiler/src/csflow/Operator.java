package csflow;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Operators recognised by the {@link ExpressionTokenizer}. */
public enum Operator {
  ADD("+", Category.ARITHMETIC),
  SUBTRACT("-", Category.ARITHMETIC),
  MULTIPLY("*", Category.ARITHMETIC),
  DIVIDE("/", Category.ARITHMETIC),
  MODULO("%", Category.ARITHMETIC),
  CONCATENATE("&", Category.ARITHMETIC),
  FAIRMATH_ADD("%+", Category.FAIRMATH),
  FAIRMATH_SUBTRACT("%-", Category.FAIRMATH),
  EQUALS("=", Category.COMPARISON),
  NOT_EQUALS("!=", Category.COMPARISON),
  GREATER(">", Category.COMPARISON),
  GREATER_EQUALS(">=", Category.COMPARISON),
  LESS("<", Category.COMPARISON),
  LESS_EQUALS("<=", Category.COMPARISON),
  AND("and", Category.LOGICAL),
  OR("or", Category.LOGICAL),
  NOT("not", Category.UNARY),
  ROUND("round", Category.UNARY);

  public enum Category {
    ARITHMETIC,
    FAIRMATH,
    COMPARISON,
    LOGICAL,
    UNARY;
  }

  private final String symbol;
  private final Category category;

  Operator(String symbol, Category category) {
    this.symbol = symbol;
    this.category = category;
  }

  public String symbol() {
    return symbol;
  }

  public Category category() {
    return category;
  }

  public boolean isWord() {
    return Character.isLetter(symbol.charAt(0));
  }

  private static final ImmutableMap<String, Operator> BY_SYMBOL =
      Arrays.asList(values()).stream().collect(ImmutableMap.toImmutableMap(Operator::symbol, o -> o));

  /** Looks up an operator by its source spelling; {@code modulo} is an alias of {@code %}. */
  public static Optional<Operator> forSymbol(String symbol) {
    if (symbol.equals("modulo")) return Optional.of(MODULO);
    return Optional.ofNullable(BY_SYMBOL.get(symbol));
  }
}
