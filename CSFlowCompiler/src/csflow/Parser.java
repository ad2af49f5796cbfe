package csflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Recursive-descent parser from one scene's tokens to statements. Blocks are delimited by
 * indentation: a statement's body is every following statement indented deeper than it.
 */
public class Parser {
  @FunctionalInterface
  private interface StatementParser {
    Statement parse() throws CompilerException;
  }

  private static final Pattern ACHIEVEMENT_HEADER =
      Pattern.compile("(\\w+)\\s+(visible|hidden)\\s+(\\d{1,9})\\s+(.+)");
  // Matches any header; used to salvage the id and title of a malformed one.
  private static final Pattern LOOSE_ACHIEVEMENT_HEADER =
      Pattern.compile("(\\S*)\\s*(?:(visible|hidden)\\b)?\\s*(?:\\d+\\b)?\\s*(.*)");

  private final ImmutableList<Token> tokens;
  private final Diagnostics diagnostics;
  private final boolean strict;
  private int current = 0;
  // Expression tokens are only read from this line.
  private int expressionLine = -1;

  public Parser(List<Token> tokens, Diagnostics diagnostics, boolean strict) {
    this.tokens = ImmutableList.copyOf(tokens);
    this.diagnostics = diagnostics;
    this.strict = strict;
  }

  /**
   * Parses the whole scene. In strict mode the first syntax error is thrown; otherwise it is
   * recorded and parsing resumes at the next reliable statement boundary.
   */
  public ImmutableList<Statement> parse() throws CompilerException {
    List<Statement> statements = new ArrayList<>();
    if (check(Token.Type.SCENE_START)) {
      advance();
    }

    double sceneIndent = -1;
    while (!isAtEnd()) {
      if (sceneIndent < 0) {
        sceneIndent = peek().indent();
      } else {
        checkIndent(peek(), sceneIndent);
      }

      try {
        statements.add(statement());
      } catch (SyntaxException ex) {
        if (strict) throw ex;
        diagnostics.warn(Diagnostic.Kind.SYNTAX, ex.pos(), ex.errorMsg());
        synchronize();
      }
    }

    return ImmutableList.copyOf(statements);
  }

  private Statement statement() throws CompilerException {
    Token token = peek();
    switch (token.type()) {
      case PROSE:
        advance();
        return new Statement.Prose(token);
      case CHOICE:
      case FAKE_CHOICE:
        return choice();
      case IF:
        return ifStatement(this::statement);
      case ELSEIF:
      case ELSE:
      case ENDIF:
        throw new StructureException(
            token.pos(), String.format("%s without a matching *if", token.lexeme()));
      case LABEL:
        advance();
        return endOfLine(new Statement.Label(token, labelName(token)));
      case GOTO:
        advance();
        return endOfLine(new Statement.GotoLabel(token, labelName(token)));
      case GOTO_SCENE:
        {
          advance();
          String scene = identifier(token, "scene name");
          return endOfLine(new Statement.GotoScene(token, scene, optionalLabel(token)));
        }
      case GOTO_RANDOM_SCENE:
        advance();
        return new Statement.GotoRandomScene(token, blockLines());
      case GOSUB:
        {
          advance();
          String label = labelName(token);
          return new Statement.GoSub(token, label, arguments(token));
        }
      case GOSUB_SCENE:
        {
          advance();
          String scene = identifier(token, "scene name");
          Optional<String> label = optionalLabel(token);
          return new Statement.GoSubScene(token, scene, label, arguments(token));
        }
      case RETURN:
        advance();
        return new Statement.Return(token);
      case CREATE:
      case TEMP:
        return declaration();
      case SET:
        return set();
      case INPUT_TEXT:
        advance();
        return endOfLine(new Statement.InputText(token, identifier(token, "variable name")));
      case FINISH:
      case PAGE_BREAK:
        advance();
        return new Statement.Break(token);
      case COMMENT:
        advance();
        return new Statement.Comment(token);
      case SCENE_LIST:
        advance();
        return new Statement.SceneList(token, blockLines());
      case ACHIEVEMENT:
        return achievement();
      case STAT_CHART:
        advance();
        return new Statement.StatChart(token, blockLines());
      case TITLE:
      case AUTHOR:
        advance();
        return new Statement.Metadata(token);
      case COMMAND:
        advance();
        return new Statement.Command(token);
      case UNKNOWN_COMMAND:
        throw syntax(token, "unknown command " + token.lexeme());
      case CHOICE_OPTION:
      case HIDE_REUSE:
      case DISABLE_REUSE:
      case ALLOW_REUSE:
      case SELECTABLE_IF:
        throw syntax(token, describe(token) + " outside of a *choice");
      default:
        throw syntax(token, "unexpected " + describe(token));
    }
  }

  private Statement choice() throws CompilerException {
    Token token = advance();
    ImmutableList<Statement> body = requiredBlock(token, this::choiceBodyStatement);
    return new Statement.Choice(token, body);
  }

  private Statement choiceBodyStatement() throws CompilerException {
    Token token = peek();
    switch (token.type()) {
      case CHOICE_OPTION:
      case HIDE_REUSE:
      case DISABLE_REUSE:
      case ALLOW_REUSE:
      case SELECTABLE_IF:
        return option();
      case IF:
        if (optionFollowsOnLine()) {
          return option();
        }
        return ifStatement(this::choiceBodyStatement);
      case COMMENT:
        advance();
        return new Statement.Comment(token);
      default:
        throw syntax(token, "expected a #choice option but found " + describe(token));
    }
  }

  // Distinguishes '*if (x) #Text' from an *if block wrapping options.
  private boolean optionFollowsOnLine() {
    int line = peek().pos().lineNumber();
    for (int i = current + 1; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.pos().lineNumber() != line) return false;
      if (token.type() == Token.Type.CHOICE_OPTION) return true;
    }
    return false;
  }

  private Statement option() throws CompilerException {
    Token first = peek();
    Optional<Statement.ChoiceOption.ReusePolicy> reusePolicy = Optional.empty();
    Optional<Expression> condition = Optional.empty();
    Optional<Expression> selectableIf = Optional.empty();

    while (!check(Token.Type.CHOICE_OPTION)) {
      Token prefix = advance();
      switch (prefix.type()) {
        case HIDE_REUSE:
          reusePolicy = Optional.of(Statement.ChoiceOption.ReusePolicy.HIDE_REUSE);
          break;
        case DISABLE_REUSE:
          reusePolicy = Optional.of(Statement.ChoiceOption.ReusePolicy.DISABLE_REUSE);
          break;
        case ALLOW_REUSE:
          reusePolicy = Optional.of(Statement.ChoiceOption.ReusePolicy.ALLOW_REUSE);
          break;
        case IF:
          condition = Optional.of(expression(prefix));
          break;
        case SELECTABLE_IF:
          selectableIf = Optional.of(expression(prefix));
          break;
        default:
          throw syntax(prefix, "expected #option text but found " + describe(prefix));
      }

      if (!onLine(first)) {
        throw syntax(prefix, prefix.lexeme() + " must be followed by #option text on the same line");
      }
    }

    Token option = advance();
    List<Token> markup = new ArrayList<>();
    while (onLine(option) && peek().type().isExpression()) {
      markup.add(advance());
    }
    ImmutableList<Statement> body = block(option, this::statement);
    return new Statement.ChoiceOption(option, reusePolicy, condition, selectableIf, markup, body);
  }

  private Statement ifStatement(StatementParser bodyParser) throws CompilerException {
    Token token = advance();
    Expression condition = expression(token);
    endOfLine(token);
    ImmutableList<Statement> body = requiredBlock(token, bodyParser);

    List<Statement.ElseIf> elseIfs = new ArrayList<>();
    while (check(Token.Type.ELSEIF) && siblingScope(token.indent())) {
      Token elseIf = advance();
      Expression elseIfCondition = expression(elseIf);
      endOfLine(elseIf);
      elseIfs.add(new Statement.ElseIf(elseIf, elseIfCondition, requiredBlock(elseIf, bodyParser)));
    }

    Optional<Statement.Else> otherwise = Optional.empty();
    if (check(Token.Type.ELSE) && siblingScope(token.indent())) {
      Token elseToken = advance();
      otherwise = Optional.of(new Statement.Else(elseToken, requiredBlock(elseToken, bodyParser)));
    }

    boolean explicitEnd = false;
    if (check(Token.Type.ENDIF) && siblingScope(token.indent())) {
      advance();
      explicitEnd = true;
    }

    return new Statement.If(token, condition, body, elseIfs, otherwise, explicitEnd);
  }

  private Statement declaration() throws CompilerException {
    Token token = advance();
    Optional<String> name = Optional.empty();
    Optional<Expression> initializer = Optional.empty();

    if (checkOnLine(Token.Type.IDENTIFIER, token)) {
      name = Optional.of(advance().text());
      if (onLine(token)) {
        initializer = Optional.of(expression(token));
      }
    } else {
      // Reported by the builder, which still records the declaration.
      skipLine(token);
    }

    return endOfLine(new Statement.DeclareVariable(token, name, initializer));
  }

  private Statement set() throws CompilerException {
    Token token = advance();
    if (!checkOnLine(Token.Type.IDENTIFIER, token)) {
      skipLine(token);
      return new Statement.SetVariable(token, Optional.empty(), SetOperation.SET, Optional.empty());
    }

    Token name = advance();
    SetOperation operation = SetOperation.SET;
    Optional<Expression> value = Optional.empty();
    if (checkOnLine(Token.Type.OPERATOR, token)) {
      Operator leading = peek().operator().get();
      Optional<SetOperation> leadingOperation = SetOperation.forOperator(leading);
      if (leadingOperation.isPresent()) {
        advance();
        operation = leadingOperation.get();
      } else if (leading.category() == Operator.Category.ARITHMETIC) {
        // '*set x *2' means '*set x x * 2'.
        Token op = advance();
        Expression right = expression(token);
        value =
            Optional.of(
                Expression.Binary.create(
                    op.pos(),
                    Expression.Identifier.create(name.pos(), name.text()),
                    leading,
                    right));
      }
    }
    if (!value.isPresent() && onLine(token)) {
      value = Optional.of(expression(token));
    }

    return endOfLine(
        new Statement.SetVariable(token, Optional.of(name.text()), operation, value));
  }

  private Statement achievement() {
    Token token = advance();
    ImmutableList<String> lines = blockLines();
    Matcher matcher = ACHIEVEMENT_HEADER.matcher(token.text());
    if (!matcher.matches()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          token.pos(),
          "expected *achievement <id> visible|hidden <points> <title>");
      Matcher loose = LOOSE_ACHIEVEMENT_HEADER.matcher(token.text());
      Verify.verify(loose.matches());
      String id = loose.group(1);
      String title = loose.group(3).trim().isEmpty() ? id : loose.group(3).trim();
      boolean visible = !"hidden".equals(loose.group(2));
      return achievement(token, id, visible, 0, title, lines);
    }

    return achievement(
        token,
        matcher.group(1),
        matcher.group(2).equals("visible"),
        Integer.parseInt(matcher.group(3)),
        matcher.group(4).trim(),
        lines);
  }

  private Statement achievement(
      Token token, String id, boolean visible, int points, String title, List<String> lines) {
    if (lines.isEmpty()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          token.pos(),
          "*achievement " + id + " needs an indented description");
    }
    return new Statement.Achievement(
        token,
        id,
        visible,
        points,
        title,
        lines.isEmpty() ? "" : lines.get(0),
        lines.size() > 1 ? Optional.of(lines.get(1)) : Optional.empty());
  }

  private ImmutableList<String> blockLines() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    while (check(Token.Type.BLOCK_LINE)) {
      lines.add(advance().text());
    }
    return lines.build();
  }

  private ImmutableList<Expression> arguments(Token command) throws SyntaxException {
    ImmutableList.Builder<Expression> arguments = ImmutableList.builder();
    while (onLine(command)) {
      arguments.add(expression(command));
    }
    return arguments.build();
  }

  private String identifier(Token command, String what) throws SyntaxException {
    if (!checkOnLine(Token.Type.IDENTIFIER, command)) {
      throw syntax(command, command.lexeme() + " expects a " + what);
    }
    return advance().text();
  }

  // Labels are case-insensitive.
  private String labelName(Token command) throws SyntaxException {
    return identifier(command, "label name").toLowerCase(Locale.ROOT);
  }

  private Optional<String> optionalLabel(Token command) {
    if (checkOnLine(Token.Type.IDENTIFIER, command)) {
      return Optional.of(advance().text().toLowerCase(Locale.ROOT));
    }
    return Optional.empty();
  }

  private ImmutableList<Statement> requiredBlock(Token owner, StatementParser parser)
      throws CompilerException {
    ImmutableList<Statement> body = block(owner, parser);
    if (body.isEmpty()) {
      diagnostics.warn(
          Diagnostic.Kind.INDENTATION,
          owner.pos(),
          "expected an indented block after " + owner.lexeme());
    }
    return body;
  }

  private ImmutableList<Statement> block(Token owner, StatementParser parser)
      throws CompilerException {
    ImmutableList.Builder<Statement> body = ImmutableList.builder();
    double blockIndent = -1;
    while (childScope(owner.indent())) {
      if (blockIndent < 0) {
        blockIndent = peek().indent();
      } else {
        checkIndent(peek(), blockIndent);
      }
      body.add(parser.parse());
    }
    return body.build();
  }

  private void checkIndent(Token token, double expected) {
    if (token.indent() != expected) {
      diagnostics.warn(
          Diagnostic.Kind.INDENTATION,
          token.pos(),
          String.format(
              "indent %s does not match the enclosing block's indent %s",
              Token.formatIndent(token.indent()),
              Token.formatIndent(expected)));
    }
  }

  // Expressions, lowest precedence first.

  private Expression expression(Token command) throws SyntaxException {
    expressionLine = command.pos().lineNumber();
    return logical();
  }

  private Expression logical() throws SyntaxException {
    Expression expr = equality();
    while (matchOperator(Operator.AND, Operator.OR)) {
      Token op = previous();
      expr = Expression.Binary.create(op.pos(), expr, op.operator().get(), equality());
    }
    return expr;
  }

  private Expression equality() throws SyntaxException {
    Expression expr = comparison();
    while (matchOperator(Operator.EQUALS, Operator.NOT_EQUALS)) {
      Token op = previous();
      expr = Expression.Binary.create(op.pos(), expr, op.operator().get(), comparison());
    }
    return expr;
  }

  private Expression comparison() throws SyntaxException {
    Expression expr = term();
    while (matchOperator(
        Operator.GREATER, Operator.GREATER_EQUALS, Operator.LESS, Operator.LESS_EQUALS)) {
      Token op = previous();
      expr = Expression.Binary.create(op.pos(), expr, op.operator().get(), term());
    }
    return expr;
  }

  private Expression term() throws SyntaxException {
    Expression expr = factor();
    while (matchOperator(Operator.ADD, Operator.SUBTRACT, Operator.CONCATENATE)) {
      Token op = previous();
      expr = Expression.Binary.create(op.pos(), expr, op.operator().get(), factor());
    }
    return expr;
  }

  private Expression factor() throws SyntaxException {
    Expression expr = unary();
    while (matchOperator(Operator.MULTIPLY, Operator.DIVIDE, Operator.MODULO)) {
      Token op = previous();
      expr = Expression.Binary.create(op.pos(), expr, op.operator().get(), unary());
    }
    return expr;
  }

  private Expression unary() throws SyntaxException {
    if (matchOperator(
        Operator.NOT,
        Operator.ROUND,
        Operator.SUBTRACT,
        Operator.ADD,
        Operator.FAIRMATH_ADD,
        Operator.FAIRMATH_SUBTRACT)) {
      Token op = previous();
      return Expression.Unary.create(op.pos(), op.operator().get(), unary());
    }
    return primary();
  }

  private Expression primary() throws SyntaxException {
    if (!onExpressionLine()) {
      throw syntax(errorToken(), "expected an expression");
    }

    Token token = advance();
    switch (token.type()) {
      case NUMBER:
        return Expression.Literal.create(
            token.pos(), Expression.Literal.Kind.NUMBER, token.text());
      case STRING:
        return Expression.Literal.create(
            token.pos(), Expression.Literal.Kind.STRING, token.text());
      case BOOLEAN:
        return Expression.Literal.create(
            token.pos(), Expression.Literal.Kind.BOOLEAN, token.text());
      case IDENTIFIER:
        return Expression.Identifier.create(token.pos(), token.text());
      case OPEN_PAREN:
        {
          Expression inner = logical();
          if (!onExpressionLine() || peek().type() != Token.Type.CLOSE_PAREN) {
            throw syntax(errorToken(), "expected ')' to close the '(' at " + token.pos());
          }
          advance();
          return Expression.Grouping.create(token.pos(), inner);
        }
      default:
        throw syntax(token, "expected an expression but found " + describe(token));
    }
  }

  // Token primitives.

  private boolean isAtEnd() {
    return current >= tokens.size() || tokens.get(current).type() == Token.Type.SCENE_END;
  }

  private Token peek() {
    return tokens.get(Math.min(current, tokens.size() - 1));
  }

  private Token previous() {
    return tokens.get(Math.max(current - 1, 0));
  }

  private Token advance() {
    if (!isAtEnd()) {
      current++;
    }
    return previous();
  }

  private boolean check(Token.Type type) {
    return !isAtEnd() && peek().type() == type;
  }

  /**
   * Checks the next token's type, optionally requiring it to share the previous token's line or
   * indent.
   */
  private boolean check(Token.Type type, boolean requireSameLine, boolean requireSameIndent) {
    if (!check(type)) return false;
    if (requireSameLine && peek().pos().lineNumber() != previous().pos().lineNumber()) {
      return false;
    }
    return !requireSameIndent || peek().indent() == previous().indent();
  }

  private boolean checkOnLine(Token.Type type, Token anchor) {
    return check(type) && onLine(anchor);
  }

  private boolean onLine(Token anchor) {
    return !isAtEnd() && peek().pos().lineNumber() == anchor.pos().lineNumber();
  }

  private boolean onExpressionLine() {
    return !isAtEnd()
        && peek().pos().lineNumber() == expressionLine
        && peek().type().isExpression();
  }

  private boolean matchOperator(Operator... operators) {
    if (!onExpressionLine() || !check(Token.Type.OPERATOR, true, false)) return false;
    if (Arrays.asList(operators).contains(peek().operator().get())) {
      advance();
      return true;
    }
    return false;
  }

  // The next token is a block child when it is indented deeper than its parent.
  private boolean childScope(double parentIndent) {
    return !isAtEnd() && peek().indent() > parentIndent;
  }

  // *elseif, *else and *endif continue a cascade only at exactly the *if's indent.
  private boolean siblingScope(double parentIndent) {
    return !isAtEnd() && peek().indent() == parentIndent;
  }

  private <T extends Statement> T endOfLine(T statement) throws SyntaxException {
    endOfLine(statement.token());
    return statement;
  }

  private void endOfLine(Token command) throws SyntaxException {
    if (onLine(command)) {
      throw syntax(peek(), "unexpected " + describe(peek()) + " after " + command.lexeme());
    }
  }

  private void skipLine(Token command) {
    while (onLine(command)) {
      advance();
    }
  }

  private Token errorToken() {
    return onExpressionLine() ? peek() : previous();
  }

  /** Skips ahead to a statement that can safely start a fresh parse. */
  private void synchronize() {
    advance();
    while (!isAtEnd()) {
      switch (peek().type()) {
        case RETURN:
        case GOTO:
        case GOTO_SCENE:
          return;
        default:
          advance();
      }
    }
  }

  private static SyntaxException syntax(Token token, String msg) {
    return new SyntaxException(token, msg);
  }

  private static String describe(Token token) {
    return token.lexeme().isEmpty() ? token.type().toString() : "'" + token.lexeme() + "'";
  }
}
