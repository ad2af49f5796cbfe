package csflow;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Converts the text of one scene into a flat token stream in a single pass. Scanning never fails;
 * malformed input produces best-effort tokens and warnings.
 */
public class Scanner {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String scene;
    private final int lineNumber;
    private final int column;

    public Pos(String scene, int lineNumber, int column) {
      this.scene = scene;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String scene() {
      return scene;
    }

    // 0-based.
    public int lineNumber() {
      return lineNumber;
    }

    // 0-based.
    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparing(Pos::scene)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos that = (Pos) o;
      return scene.equals(that.scene) && lineNumber == that.lineNumber && column == that.column;
    }

    @Override
    public int hashCode() {
      return (scene.hashCode() * 31 + lineNumber) * 31 + column;
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", scene, lineNumber + 1, column + 1);
    }
  }

  private enum Mode {
    INDENTATION,
    PROSE,
    TOKEN,
    EXPRESSION,
    PROSE_TO_EOL,
    COMMENT,
    CHOICE_OPTION;
  }

  // ChoiceScript commands with no flow semantics of their own.
  private static final ImmutableSet<String> OTHER_COMMANDS =
      ImmutableSet.of(
          "abort",
          "achieve",
          "advertisement",
          "bug",
          "check_achievements",
          "check_purchase",
          "check_registration",
          "delay_break",
          "delay_ending",
          "ending",
          "feedback",
          "gotoref",
          "ifid",
          "image",
          "input_number",
          "kindle_search",
          "line_break",
          "link",
          "link_button",
          "looplimit",
          "more_games",
          "params",
          "print",
          "product",
          "purchase",
          "rand",
          "redirect_scene",
          "restart",
          "restore_checkpoint",
          "restore_game",
          "save_checkpoint",
          "save_game",
          "script",
          "setref",
          "share_this_game",
          "show_password",
          "sound",
          "text_image",
          "youtube");

  // Commands that may precede a choice option on the same line.
  private static final ImmutableSet<String> OPTION_PREFIXES =
      ImmutableSet.of("if", "selectable_if", "hide_reuse", "disable_reuse", "allow_reuse");

  private static final Pattern MARKUP = Pattern.compile("@\\{|\\$!{0,2}\\{");

  private final String scene;
  private final String text;
  private final Diagnostics diagnostics;
  private final ExpressionTokenizer expressionTokenizer;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private boolean scanned = false;

  // Line state.
  private String lineText;
  private int lineNumber;
  private int column;
  private Mode mode;
  private double indent;
  private boolean lineUsesTabs;
  private boolean lineUsesSpaces;
  // True where '*' or '#' may begin a command or an option.
  private boolean segmentStart;

  // Scene state.
  private boolean sceneUsesTabs = false;
  private boolean sceneUsesSpaces = false;
  private boolean mixedIndentReported = false;
  private boolean insideMultiLineToken = false;
  private double multiLineIndent;

  private final StringBuilder prose = new StringBuilder();
  private Pos proseStart;
  private double proseIndent;
  private boolean proseOnLine;

  // Command being read; commandPos is null when there is none.
  private final StringBuilder keyword = new StringBuilder();
  private Pos commandPos = null;
  private Token.Type commandType;
  private String commandLexeme;
  private final StringBuilder tail = new StringBuilder();
  private int tailColumn;
  private int parenDepth;
  private char quote;

  public Scanner(String scene, String text, Diagnostics diagnostics) {
    this.scene = scene;
    this.text = text;
    this.diagnostics = diagnostics;
    this.expressionTokenizer = new ExpressionTokenizer(scene, diagnostics);
  }

  public ImmutableList<Token> scan() {
    Preconditions.checkState(!scanned, "Scene %s was already scanned", scene);
    scanned = true;

    tokens.add(Token.create(Token.Type.SCENE_START, new Pos(scene, 0, 0), 0, "", scene));
    List<String> lines = Splitter.on('\n').splitToList(text);
    for (lineNumber = 0; lineNumber < lines.size(); lineNumber++) {
      scanLine(CharMatcher.is('\r').trimTrailingFrom(lines.get(lineNumber)));
    }
    flushProse();
    tokens.add(Token.create(Token.Type.SCENE_END, new Pos(scene, lines.size(), 0), 0, "", scene));

    return tokens.build();
  }

  private Pos pos() {
    return new Pos(scene, lineNumber, column);
  }

  private void scanLine(String line) {
    lineText = line;
    column = 0;
    indent = 0;
    mode = Mode.INDENTATION;
    lineUsesTabs = false;
    lineUsesSpaces = false;
    segmentStart = true;
    proseOnLine = false;

    while (column < lineText.length()) {
      char ch = lineText.charAt(column);
      switch (mode) {
        case INDENTATION:
          scanIndentation(ch);
          break;
        case PROSE:
          scanProse(ch);
          break;
        case TOKEN:
          scanKeyword(ch);
          break;
        case EXPRESSION:
          scanExpression(ch);
          break;
        case PROSE_TO_EOL:
        case COMMENT:
        case CHOICE_OPTION:
          tail.append(lineText, column, lineText.length());
          column = lineText.length();
          break;
      }
    }

    endLine();
  }

  private void scanIndentation(char ch) {
    if (ch == '\t') {
      indent += 1.0;
      lineUsesTabs = true;
      column++;
    } else if (ch == ' ') {
      indent += 0.5;
      lineUsesSpaces = true;
      column++;
    } else {
      startLine();
    }
  }

  // Called at the first non-blank character of a line.
  private void startLine() {
    checkMixedIndentation();

    if (insideMultiLineToken) {
      if (indent > multiLineIndent) {
        String content = lineText.substring(column);
        tokens.add(Token.create(Token.Type.BLOCK_LINE, pos(), indent, content, content.trim()));
        column = lineText.length();
        mode = Mode.TOKEN;
        return;
      }
      insideMultiLineToken = false;
    }

    if (prose.length() > 0 && indent != proseIndent) {
      flushProse();
    }
    mode = Mode.PROSE;
  }

  private void checkMixedIndentation() {
    boolean mixed =
        (lineUsesTabs && lineUsesSpaces)
            || (lineUsesTabs && sceneUsesSpaces)
            || (lineUsesSpaces && sceneUsesTabs);
    sceneUsesTabs |= lineUsesTabs;
    sceneUsesSpaces |= lineUsesSpaces;
    if (mixed && !mixedIndentReported) {
      mixedIndentReported = true;
      diagnostics.warn(
          Diagnostic.Kind.INDENTATION,
          new Pos(scene, lineNumber, 0),
          "scene mixes tabs and spaces for indentation");
    }
  }

  private void scanProse(char ch) {
    if (segmentStart) {
      if (ch == ' ' || ch == '\t') {
        column++;
        return;
      }
      if (ch == '*' && column + 1 < lineText.length()
          && Character.isLetter(lineText.charAt(column + 1))) {
        flushProse();
        commandPos = pos();
        keyword.setLength(0);
        column++;
        mode = Mode.TOKEN;
        return;
      }
      if (ch == '#') {
        flushProse();
        commandPos = pos();
        commandType = Token.Type.CHOICE_OPTION;
        commandLexeme = "#";
        column++;
        startTail(Mode.CHOICE_OPTION);
        return;
      }
    }

    // Anywhere else '*' and '#' are literal, so the rest of the line is narrative text.
    if (prose.length() == 0) {
      proseStart = pos();
      proseIndent = indent;
    }
    prose.append(lineText, column, lineText.length());
    proseOnLine = true;
    column = lineText.length();
  }

  private void scanKeyword(char ch) {
    if (ch == '_' || Character.isLetterOrDigit(ch)) {
      keyword.append(ch);
      column++;
    } else {
      finishKeyword();
    }
  }

  private void finishKeyword() {
    String name = keyword.toString();
    keyword.setLength(0);
    commandLexeme = "*" + name;

    String lookup = name.toLowerCase(Locale.ROOT);
    Optional<Token.Type> type = Token.forKeyword(lookup);
    if (type.isPresent()) {
      commandType = type.get();
    } else if (OTHER_COMMANDS.contains(lookup)) {
      commandType = Token.Type.COMMAND;
    } else {
      commandType = Token.Type.UNKNOWN_COMMAND;
    }

    switch (commandType.tail()) {
      case EXPRESSION:
        parenDepth = 0;
        quote = 0;
        startTail(Mode.EXPRESSION);
        break;
      case COMMENT:
        startTail(Mode.COMMENT);
        break;
      case BLOCK:
        insideMultiLineToken = true;
        multiLineIndent = indent;
        startTail(Mode.PROSE_TO_EOL);
        break;
      case PREFIX:
        emitCommand("");
        segmentStart = true;
        mode = Mode.PROSE;
        break;
      default:
        startTail(Mode.PROSE_TO_EOL);
        break;
    }
  }

  private void startTail(Mode tailMode) {
    tail.setLength(0);
    tailColumn = column;
    segmentStart = false;
    mode = tailMode;
  }

  private void scanExpression(char ch) {
    if (quote != 0) {
      if (ch == '\\' && column + 1 < lineText.length()) {
        tail.append(ch).append(lineText.charAt(column + 1));
        column += 2;
        return;
      }
      if (ch == quote) {
        quote = 0;
      }
    } else if (ch == '"' || ch == '\'') {
      quote = ch;
    } else if (ch == '(') {
      parenDepth++;
    } else if (ch == ')') {
      parenDepth--;
    } else if (endsOptionCondition(ch)) {
      finishExpression();
      segmentStart = true;
      mode = Mode.PROSE;
      return;
    }

    tail.append(ch);
    column++;
  }

  // '*if (x) #Text' and '*selectable_if (x) *hide_reuse #Text' continue after the condition.
  private boolean endsOptionCondition(char ch) {
    if (commandType != Token.Type.IF && commandType != Token.Type.SELECTABLE_IF) return false;
    if (ch == '#') return true;
    if (ch != '*' || parenDepth > 0) return false;

    int end = column + 1;
    while (end < lineText.length()
        && (lineText.charAt(end) == '_' || Character.isLetter(lineText.charAt(end)))) {
      end++;
    }
    return OPTION_PREFIXES.contains(lineText.substring(column + 1, end).toLowerCase(Locale.ROOT));
  }

  private void finishExpression() {
    String raw = tail.toString();
    emitCommand(raw.trim());
    tokens.addAll(expressionTokenizer.tokenize(raw, lineNumber, tailColumn, indent));
  }

  private void emitCommand(String argument) {
    tokens.add(Token.create(commandType, commandPos, indent, commandLexeme, argument));
    commandPos = null;
    commandType = null;
  }

  private void emitOption() {
    String raw = tail.toString();
    emitCommand(raw.trim());

    Matcher matcher = MARKUP.matcher(raw);
    int from = 0;
    while (from < raw.length() && matcher.find(from)) {
      int end =
          raw.charAt(matcher.start()) == '@'
              ? selectorEnd(raw, matcher.end())
              : closingBrace(raw, matcher.end());
      tokens.addAll(
          expressionTokenizer.tokenize(
              raw.substring(matcher.start(), end), lineNumber, tailColumn + matcher.start(), indent));
      from = end;
    }
  }

  private static int closingBrace(String raw, int from) {
    int close = raw.indexOf('}', from);
    return close < 0 ? raw.length() : close + 1;
  }

  // Multi-replace alternatives are literal text; only the selector is an expression.
  private static int selectorEnd(String raw, int from) {
    if (from < raw.length() && raw.charAt(from) == '(') {
      int depth = 0;
      for (int i = from; i < raw.length(); i++) {
        char ch = raw.charAt(i);
        if (ch == '(') {
          depth++;
        } else if (ch == ')' && --depth == 0) {
          return i + 1;
        }
      }
      return raw.length();
    }
    int end = CharMatcher.anyOf(" \t|}").indexIn(raw, from);
    return end < 0 ? raw.length() : end;
  }

  private void endLine() {
    switch (mode) {
      case INDENTATION:
        // Blank line: paragraph break inside a prose block.
        if (prose.length() > 0) {
          prose.append('\n');
        }
        break;
      case PROSE:
        if (proseOnLine) {
          prose.append('\n');
        }
        break;
      case TOKEN:
        if (commandPos != null) {
          finishKeyword();
          endLine();
        }
        break;
      case EXPRESSION:
        finishExpression();
        break;
      case PROSE_TO_EOL:
        emitCommand(tail.toString().trim());
        break;
      case COMMENT:
        emitCommand(CharMatcher.whitespace().trimLeadingFrom(tail.toString()));
        break;
      case CHOICE_OPTION:
        emitOption();
        break;
    }
  }

  private void flushProse() {
    if (prose.length() == 0) return;

    String content = CharMatcher.whitespace().trimTrailingFrom(prose.toString());
    prose.setLength(0);
    if (!content.isEmpty()) {
      tokens.add(Token.create(Token.Type.PROSE, proseStart, proseIndent, content, content));
    }
  }
}
