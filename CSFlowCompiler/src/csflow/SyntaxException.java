package csflow;

/** Thrown by the {@link Parser} when a token cannot appear at its grammar position. */
public class SyntaxException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final Token token;

  public SyntaxException(Token token, String errorMsg) {
    super(token.pos(), location(token), errorMsg);
    this.token = token;
  }

  public Token token() {
    return token;
  }

  // scene:line:position:indent
  private static String location(Token token) {
    return String.format(
        "%s:%d:%d:%s",
        token.pos().scene(),
        token.pos().lineNumber() + 1,
        token.pos().column(),
        Token.formatIndent(token.indent()));
  }
}
