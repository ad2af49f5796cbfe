package csflow;

import java.util.Optional;

import com.google.common.base.Preconditions;

/** How a {@code *set} changes its variable. */
public enum SetOperation {
  SET("set"),
  ADD("add"),
  SUBTRACT("subtract"),
  FAIRMATH_ADD("fairmath_add"),
  FAIRMATH_SUBTRACT("fairmath_subtract");

  private final String label;

  SetOperation(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean isFairmath() {
    return this == FAIRMATH_ADD || this == FAIRMATH_SUBTRACT;
  }

  /** The operation selected by a leading operator in {@code *set name <op>value}, if any. */
  public static Optional<SetOperation> forOperator(Operator operator) {
    switch (operator) {
      case ADD:
        return Optional.of(ADD);
      case SUBTRACT:
        return Optional.of(SUBTRACT);
      case FAIRMATH_ADD:
        return Optional.of(FAIRMATH_ADD);
      case FAIRMATH_SUBTRACT:
        return Optional.of(FAIRMATH_SUBTRACT);
      default:
        return Optional.empty();
    }
  }

  /**
   * Applies the operation to a numeric stat. Fairmath moves a 0-100 value toward its bound by the
   * given percentage of the remaining distance.
   */
  public double apply(double current, double operand) {
    switch (this) {
      case SET:
        return operand;
      case ADD:
        return current + operand;
      case SUBTRACT:
        return current - operand;
      case FAIRMATH_ADD:
        Preconditions.checkArgument(current >= 0 && current <= 100, "Not a percentage: %s", current);
        return current + (100 - current) * operand / 100;
      case FAIRMATH_SUBTRACT:
        Preconditions.checkArgument(current >= 0 && current <= 100, "Not a percentage: %s", current);
        return current - current * operand / 100;
    }
    throw new AssertionError(this);
  }
}
