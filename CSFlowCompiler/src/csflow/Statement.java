package csflow;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Statement tree produced by the {@link Parser}. Every statement owns its body. */
public abstract class Statement {
  public enum Type {
    PROSE,
    CHOICE,
    CHOICE_OPTION,
    IF,
    ELSE_IF,
    ELSE,
    LABEL,
    GOTO_LABEL,
    GOTO_SCENE,
    GOTO_RANDOM_SCENE,
    GOSUB,
    GOSUB_SCENE,
    RETURN,
    DECLARE_VARIABLE,
    SET_VARIABLE,
    INPUT_TEXT,
    FINISH,
    PAGE_BREAK,
    COMMENT,
    SCENE_LIST,
    ACHIEVEMENT,
    STAT_CHART,
    METADATA,
    COMMAND;
  }

  private final Type type;
  private final Token token;

  protected Statement(Type type, Token token) {
    this.type = type;
    this.token = token;
  }

  public final Type type() {
    return type;
  }

  /** The token the statement starts with. */
  public final Token token() {
    return token;
  }

  public final Scanner.Pos pos() {
    return token.pos();
  }

  public final double indent() {
    return token.indent();
  }

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return type + " at " + pos();
  }

  public static class Prose extends Statement {
    private final String text;

    Prose(Token token) {
      super(Type.PROSE, token);
      this.text = token.text();
    }

    public String text() {
      return text;
    }
  }

  public static class Choice extends Statement {
    private final ImmutableList<Statement> body;

    Choice(Token token, List<Statement> body) {
      super(Type.CHOICE, token);
      this.body = ImmutableList.copyOf(body);
    }

    public boolean isFake() {
      return token().type() == Token.Type.FAKE_CHOICE;
    }

    /** Options, plus {@code *if} blocks guarding options and comments. */
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  public static class ChoiceOption extends Statement {
    public enum ReusePolicy {
      HIDE_REUSE("hide_reuse"),
      DISABLE_REUSE("disable_reuse"),
      ALLOW_REUSE("allow_reuse");

      private final String label;

      ReusePolicy(String label) {
        this.label = label;
      }

      public String label() {
        return label;
      }
    }

    private final Optional<ReusePolicy> reusePolicy;
    private final Optional<Expression> condition;
    private final Optional<Expression> selectableIf;
    private final ImmutableList<Token> markup;
    private final ImmutableList<Statement> body;

    ChoiceOption(
        Token token,
        Optional<ReusePolicy> reusePolicy,
        Optional<Expression> condition,
        Optional<Expression> selectableIf,
        List<Token> markup,
        List<Statement> body) {
      super(Type.CHOICE_OPTION, token);
      this.reusePolicy = reusePolicy;
      this.condition = condition;
      this.selectableIf = selectableIf;
      this.markup = ImmutableList.copyOf(markup);
      this.body = ImmutableList.copyOf(body);
    }

    public String text() {
      return token().text();
    }

    public Optional<ReusePolicy> reusePolicy() {
      return reusePolicy;
    }

    /** From an {@code *if} prefix: the option is hidden unless this holds. */
    public Optional<Expression> condition() {
      return condition;
    }

    /** From a {@code *selectable_if} prefix: the option is shown but disabled unless this holds. */
    public Optional<Expression> selectableIf() {
      return selectableIf;
    }

    /** Multi-replace and print markup tokens found in the option text. */
    public ImmutableList<Token> markup() {
      return markup;
    }

    public ImmutableList<Statement> body() {
      return body;
    }
  }

  public static class If extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> body;
    private final ImmutableList<ElseIf> elseIfs;
    private final Optional<Else> otherwise;
    private final boolean explicitEnd;

    If(
        Token token,
        Expression condition,
        List<Statement> body,
        List<ElseIf> elseIfs,
        Optional<Else> otherwise,
        boolean explicitEnd) {
      super(Type.IF, token);
      this.condition = condition;
      this.body = ImmutableList.copyOf(body);
      this.elseIfs = ImmutableList.copyOf(elseIfs);
      this.otherwise = otherwise;
      this.explicitEnd = explicitEnd;
    }

    public Expression condition() {
      return condition;
    }

    public ImmutableList<Statement> body() {
      return body;
    }

    public ImmutableList<ElseIf> elseIfs() {
      return elseIfs;
    }

    public Optional<Else> otherwise() {
      return otherwise;
    }

    /** Whether the cascade was closed with {@code *endif}. */
    public boolean explicitEnd() {
      return explicitEnd;
    }
  }

  public static class ElseIf extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> body;

    ElseIf(Token token, Expression condition, List<Statement> body) {
      super(Type.ELSE_IF, token);
      this.condition = condition;
      this.body = ImmutableList.copyOf(body);
    }

    public Expression condition() {
      return condition;
    }

    public ImmutableList<Statement> body() {
      return body;
    }
  }

  public static class Else extends Statement {
    private final ImmutableList<Statement> body;

    Else(Token token, List<Statement> body) {
      super(Type.ELSE, token);
      this.body = ImmutableList.copyOf(body);
    }

    public ImmutableList<Statement> body() {
      return body;
    }
  }

  public static class Label extends Statement {
    private final String name;

    Label(Token token, String name) {
      super(Type.LABEL, token);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  public static class GotoLabel extends Statement {
    private final String label;

    GotoLabel(Token token, String label) {
      super(Type.GOTO_LABEL, token);
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  public static class GotoScene extends Statement {
    private final String scene;
    private final Optional<String> label;

    GotoScene(Token token, String scene, Optional<String> label) {
      super(Type.GOTO_SCENE, token);
      this.scene = scene;
      this.label = label;
    }

    public String scene() {
      return scene;
    }

    public Optional<String> label() {
      return label;
    }
  }

  public static class GotoRandomScene extends Statement {
    private final ImmutableList<String> scenes;

    GotoRandomScene(Token token, List<String> scenes) {
      super(Type.GOTO_RANDOM_SCENE, token);
      this.scenes = ImmutableList.copyOf(scenes);
    }

    public ImmutableList<String> scenes() {
      return scenes;
    }
  }

  public static class GoSub extends Statement {
    private final String label;
    private final ImmutableList<Expression> arguments;

    GoSub(Token token, String label, List<Expression> arguments) {
      super(Type.GOSUB, token);
      this.label = label;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String label() {
      return label;
    }

    public ImmutableList<Expression> arguments() {
      return arguments;
    }
  }

  public static class GoSubScene extends Statement {
    private final String scene;
    private final Optional<String> label;
    private final ImmutableList<Expression> arguments;

    GoSubScene(Token token, String scene, Optional<String> label, List<Expression> arguments) {
      super(Type.GOSUB_SCENE, token);
      this.scene = scene;
      this.label = label;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String scene() {
      return scene;
    }

    public Optional<String> label() {
      return label;
    }

    public ImmutableList<Expression> arguments() {
      return arguments;
    }
  }

  public static class Return extends Statement {
    Return(Token token) {
      super(Type.RETURN, token);
    }
  }

  public static class DeclareVariable extends Statement {
    public enum Scope {
      GLOBAL("create"),
      TEMPORARY("temp");

      private final String label;

      Scope(String label) {
        this.label = label;
      }

      public String label() {
        return label;
      }
    }

    private final Optional<String> name;
    private final Optional<Expression> initializer;

    DeclareVariable(Token token, Optional<String> name, Optional<Expression> initializer) {
      super(Type.DECLARE_VARIABLE, token);
      this.name = name;
      this.initializer = initializer;
    }

    public Scope scope() {
      return token().type() == Token.Type.CREATE ? Scope.GLOBAL : Scope.TEMPORARY;
    }

    /** Empty when the declaration is malformed. */
    public Optional<String> name() {
      return name;
    }

    public Optional<Expression> initializer() {
      return initializer;
    }

    public String rawArguments() {
      return token().text();
    }
  }

  public static class SetVariable extends Statement {
    private final Optional<String> name;
    private final SetOperation operation;
    private final Optional<Expression> value;

    SetVariable(
        Token token, Optional<String> name, SetOperation operation, Optional<Expression> value) {
      super(Type.SET_VARIABLE, token);
      this.name = name;
      this.operation = operation;
      this.value = value;
    }

    public Optional<String> name() {
      return name;
    }

    public SetOperation operation() {
      return operation;
    }

    public Optional<Expression> value() {
      return value;
    }

    public String rawArguments() {
      return token().text();
    }
  }

  public static class InputText extends Statement {
    private final String variable;

    InputText(Token token, String variable) {
      super(Type.INPUT_TEXT, token);
      this.variable = variable;
    }

    public String variable() {
      return variable;
    }
  }

  /** {@code *finish} and {@code *page_break}, with their optional button text. */
  public static class Break extends Statement {
    Break(Token token) {
      super(token.type() == Token.Type.FINISH ? Type.FINISH : Type.PAGE_BREAK, token);
    }

    public String buttonText() {
      return token().text();
    }
  }

  public static class Comment extends Statement {
    Comment(Token token) {
      super(Type.COMMENT, token);
    }

    public String text() {
      return token().text();
    }
  }

  public static class SceneList extends Statement {
    private final ImmutableList<String> scenes;

    SceneList(Token token, List<String> scenes) {
      super(Type.SCENE_LIST, token);
      this.scenes = ImmutableList.copyOf(scenes);
    }

    public ImmutableList<String> scenes() {
      return scenes;
    }
  }

  public static class Achievement extends Statement {
    private final String id;
    private final boolean visible;
    private final int points;
    private final String title;
    private final String preEarnedDescription;
    private final Optional<String> postEarnedDescription;

    Achievement(
        Token token,
        String id,
        boolean visible,
        int points,
        String title,
        String preEarnedDescription,
        Optional<String> postEarnedDescription) {
      super(Type.ACHIEVEMENT, token);
      this.id = id;
      this.visible = visible;
      this.points = points;
      this.title = title;
      this.preEarnedDescription = preEarnedDescription;
      this.postEarnedDescription = postEarnedDescription;
    }

    public String id() {
      return id;
    }

    public boolean visible() {
      return visible;
    }

    public int points() {
      return points;
    }

    public String title() {
      return title;
    }

    public String preEarnedDescription() {
      return preEarnedDescription;
    }

    public Optional<String> postEarnedDescription() {
      return postEarnedDescription;
    }
  }

  public static class StatChart extends Statement {
    private final ImmutableList<String> entries;

    StatChart(Token token, List<String> entries) {
      super(Type.STAT_CHART, token);
      this.entries = ImmutableList.copyOf(entries);
    }

    public ImmutableList<String> entries() {
      return entries;
    }
  }

  /** {@code *title} and {@code *author}. */
  public static class Metadata extends Statement {
    Metadata(Token token) {
      super(Type.METADATA, token);
    }

    public String field() {
      return token().type().keyword().get();
    }

    public String value() {
      return token().text();
    }
  }

  /** A ChoiceScript command without flow semantics, e.g. {@code *image}. */
  public static class Command extends Statement {
    Command(Token token) {
      super(Type.COMMAND, token);
    }

    public String name() {
      return token().commandName();
    }

    public String arguments() {
      return token().text();
    }
  }
}
