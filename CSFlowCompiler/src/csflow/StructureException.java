package csflow;

/**
 * Block structure that cannot be repaired: a dangling {@code *elseif}, {@code *else} or {@code
 * *endif}, or a {@code *return} with no pending {@code *gosub}.
 */
public class StructureException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public StructureException(Scanner.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
