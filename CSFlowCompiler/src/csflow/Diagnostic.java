package csflow;

import com.google.auto.value.AutoValue;

/** A non-fatal problem found while scanning, parsing, building or analysing a story. */
@AutoValue
public abstract class Diagnostic {
  public enum Kind {
    LEXICAL,
    INDENTATION,
    SYNTAX,
    UNRESOLVED_REFERENCE,
    INVALID_DECLARATION,
    DUPLICATE_LABEL,
    ANALYSIS;
  }

  public abstract Kind kind();

  public abstract Scanner.Pos pos();

  public abstract String message();

  public static Diagnostic create(Kind kind, Scanner.Pos pos, String message) {
    return new AutoValue_Diagnostic(kind, pos, message);
  }

  @Override
  public String toString() {
    return String.format("WARNING(%s): %s %s", kind(), pos(), message());
  }
}
