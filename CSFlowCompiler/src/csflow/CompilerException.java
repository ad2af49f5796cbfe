package csflow;

/** A fatal problem that aborts the current build. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Scanner.Pos pos;
  private final String errorMsg;

  public CompilerException(Scanner.Pos pos, String errorMsg) {
    this(pos, pos.toString(), errorMsg);
  }

  protected CompilerException(Scanner.Pos pos, String location, String errorMsg) {
    super(location + " " + errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Scanner.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }
}
