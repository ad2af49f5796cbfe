package csflow;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Builds the {@link FlowGraph} of a story, starting from one scene and loading every scene it
 * reaches through {@code *scene_list}, {@code *goto_scene} and {@code *gosub_scene}. Jumps are
 * linked once every reachable scene is in the graph.
 *
 * <p>Not thread-safe: scene texts may load in parallel, but scenes are walked one at a time on the
 * calling thread.
 */
public class FlowGraphBuilder {
  private static final Logger logger = Logger.getLogger(FlowGraphBuilder.class.getName());

  private static final Joiner COMMA = Joiner.on(',');

  private static final ImmutableSet<Token.Type> MARKUP_OPENERS =
      ImmutableSet.of(
          Token.Type.OPEN_PRINT,
          Token.Type.OPEN_PRINT_CAPITALIZED,
          Token.Type.OPEN_PRINT_UPPERCASE,
          Token.Type.OPEN_MULTI_REPLACE);

  // A goto or gosub waiting for its target to be known.
  private static final class Jump {
    private final int node;
    private final String scene;
    private final Optional<String> label;
    private final Scanner.Pos pos;

    Jump(int node, String scene, Optional<String> label, Scanner.Pos pos) {
      this.node = node;
      this.scene = scene;
      this.label = label;
      this.pos = pos;
    }
  }

  private static final class ConditionalFrame {
    private final Optional<Integer> nodeBeforeIf;
    private final List<Integer> branchTerminals = new ArrayList<>();
    // Disjunction of every condition seen so far in the cascade.
    private String condition;

    ConditionalFrame(Optional<Integer> nodeBeforeIf) {
      this.nodeBeforeIf = nodeBeforeIf;
    }
  }

  private final SceneLoader loader;
  private final BuildOptions options;
  private final Diagnostics diagnostics = new Diagnostics();
  private final FlowGraph.Builder graph = new FlowGraph.Builder();
  private final GameMetadata.Builder metadata = GameMetadata.builder();
  private final Map<String, GameMetadata.Variable> variables = new LinkedHashMap<>();
  private ImmutableList<String> sceneList = ImmutableList.of();

  private final Set<String> processedScenes = new HashSet<>();
  private final Set<String> referencedScenes = new LinkedHashSet<>();
  private final Set<String> listedScenes = new HashSet<>();
  private final Deque<String> listedQueue = new ArrayDeque<>();
  private final Deque<String> discoveredQueue = new ArrayDeque<>();
  private final List<Jump> jumps = new ArrayList<>();
  private final List<Jump> finishes = new ArrayList<>();
  private boolean built = false;

  // Traversal state for the scene being walked.
  private String scene;
  private Optional<Integer> currentNode = Optional.empty();
  private int lastEmitted = -1;
  private final List<String> textBuffer = new ArrayList<>();
  private Scanner.Pos textPos;
  private final Deque<Integer> choiceNodeStack = new ArrayDeque<>();
  private final Deque<ConditionalFrame> conditionalStack = new ArrayDeque<>();
  // Shared by all scenes so that *gosub_scene can return across scenes.
  private final Deque<Integer> subroutineStack = new ArrayDeque<>();

  public FlowGraphBuilder(SceneProvider provider) {
    this(provider, BuildOptions.defaults());
  }

  public FlowGraphBuilder(SceneProvider provider, BuildOptions options) {
    this.loader = new SceneLoader(provider, options.sceneLoadExecutor());
    this.options = options;
  }

  /**
   * Builds the graph of every scene reachable from {@code entryScene}. Fatal errors abort the whole
   * build; warnings are reported on the returned graph.
   */
  public FlowGraph build(String entryScene) throws CompilerException, IOException {
    Preconditions.checkState(!built, "FlowGraphBuilder instances are single-use");
    built = true;

    reference(entryScene, listedQueue, Scanner.Pos.internal());
    drainQueues(entryScene);

    if (options.includeUnlistedScenes()) {
      for (String name : loader.listScenes()) {
        reference(name, discoveredQueue, Scanner.Pos.internal());
      }
      drainQueues(entryScene);
    }

    link();

    return graph.build(
        metadata.setSceneList(sceneList).setVariables(variables).build(),
        diagnostics.diagnostics());
  }

  // Loads and walks queued scenes until no new scene name turns up.
  private void drainQueues(String entryScene) throws CompilerException, IOException {
    int rounds = 0;
    while (!listedQueue.isEmpty() || !discoveredQueue.isEmpty()) {
      Verify.verify(rounds++ <= referencedScenes.size(), "Scene discovery did not converge");

      // Scene list order first, then discovery order.
      List<String> batch = new ArrayList<>(listedQueue);
      batch.addAll(discoveredQueue);
      listedQueue.clear();
      discoveredQueue.clear();

      ImmutableMap<String, Optional<String>> texts = loader.loadAll(batch);
      for (String name : batch) {
        Optional<String> text = texts.get(name);
        if (text.isPresent()) {
          processScene(name, text.get());
        } else if (name.equals(entryScene)) {
          throw new IOException("Entry scene " + entryScene + " does not exist");
        } else if (listedScenes.contains(name)) {
          diagnostics.warn(
              Diagnostic.Kind.UNRESOLVED_REFERENCE,
              Scanner.Pos.internal(),
              String.format("scene %s in *scene_list does not exist", name));
        }
      }
    }
  }

  private void reference(String name, Deque<String> queue, Scanner.Pos pos) {
    if (referencedScenes.add(name)) {
      logger.fine(String.format("Discovered scene %s at %s", name, pos));
      queue.add(name);
    }
  }

  /** Walks one scene into the graph. A scene that was already processed is ignored. */
  void processScene(String name, String sourceText) throws CompilerException {
    if (!processedScenes.add(name)) {
      logger.fine("Skipping already processed scene " + name);
      return;
    }
    logger.fine("Processing scene " + name);

    Scene source = Scene.scan(name, sourceText, diagnostics);
    ImmutableList<Statement> statements =
        new Parser(source.tokens(), diagnostics, options.strict()).parse();

    int firstNode = graph.nodeCount();
    scene = name;
    choiceNodeStack.clear();
    conditionalStack.clear();
    currentNode = Optional.empty();

    FlowGraph.Node entry =
        emit(NodeKind.SCENE_ENTRY, name, ImmutableMap.of("scene", name), new Scanner.Pos(name, 0, 0));
    graph.putEntryPoint(name, entry.id());

    walk(statements);
    flushText();

    for (FlowGraph.Node node : graph.nodesSince(firstNode)) {
      node.attribute("targetScene").ifPresent(s -> reference(s, discoveredQueue, node.pos()));
      node.attribute("targetScenes")
          .ifPresent(
              all -> Splitter.on(',').split(all).forEach(s -> reference(s, discoveredQueue, node.pos())));
    }
  }

  private void walk(List<Statement> statements) throws CompilerException {
    for (Statement statement : statements) {
      visit(statement);
    }
  }

  private void visit(Statement statement) throws CompilerException {
    if (statement.type() != Statement.Type.PROSE) {
      flushText();
    }

    switch (statement.type()) {
      case PROSE:
        {
          Statement.Prose prose = statement.cast();
          if (textBuffer.isEmpty()) {
            textPos = prose.pos();
          }
          textBuffer.add(prose.text());
          break;
        }
      case CHOICE:
        choice(statement.cast());
        break;
      case IF:
        conditional(statement.cast());
        break;
      case LABEL:
        label(statement.cast());
        break;
      case GOTO_LABEL:
        {
          Statement.GotoLabel gotoLabel = statement.cast();
          FlowGraph.Node node =
              emit(NodeKind.GOTO, "", ImmutableMap.of("label", gotoLabel.label()), gotoLabel.pos());
          jumps.add(new Jump(node.id(), scene, Optional.of(gotoLabel.label()), gotoLabel.pos()));
          currentNode = Optional.empty();
          break;
        }
      case GOTO_SCENE:
        {
          Statement.GotoScene gotoScene = statement.cast();
          FlowGraph.Node node =
              emit(NodeKind.GOTO, "", targetAttributes(gotoScene.scene(), gotoScene.label()), gotoScene.pos());
          jumps.add(new Jump(node.id(), gotoScene.scene(), gotoScene.label(), gotoScene.pos()));
          currentNode = Optional.empty();
          break;
        }
      case GOTO_RANDOM_SCENE:
        {
          Statement.GotoRandomScene random = statement.cast();
          FlowGraph.Node node =
              emit(
                  NodeKind.GOTO,
                  "",
                  ImmutableMap.of("targetScenes", COMMA.join(random.scenes())),
                  random.pos());
          for (String target : random.scenes()) {
            jumps.add(new Jump(node.id(), target, Optional.empty(), random.pos()));
          }
          currentNode = Optional.empty();
          break;
        }
      case GOSUB:
        {
          Statement.GoSub goSub = statement.cast();
          subroutineCall(
              goSub,
              scene,
              Optional.of(goSub.label()),
              ImmutableMap.<String, String>builder()
                  .put("label", goSub.label())
                  .putAll(argumentAttributes(goSub.arguments()))
                  .build());
          break;
        }
      case GOSUB_SCENE:
        {
          Statement.GoSubScene goSub = statement.cast();
          subroutineCall(
              goSub,
              goSub.scene(),
              goSub.label(),
              ImmutableMap.<String, String>builder()
                  .putAll(targetAttributes(goSub.scene(), goSub.label()))
                  .putAll(argumentAttributes(goSub.arguments()))
                  .build());
          break;
        }
      case RETURN:
        {
          if (subroutineStack.isEmpty()) {
            throw new StructureException(statement.pos(), "*return without a matching *gosub");
          }
          FlowGraph.Node node = emit(NodeKind.RETURN, "", ImmutableMap.of(), statement.pos());
          graph.addEdge(node.id(), subroutineStack.pop(), statement.pos());
          currentNode = Optional.empty();
          break;
        }
      case DECLARE_VARIABLE:
        declaration(statement.cast());
        break;
      case SET_VARIABLE:
        set(statement.cast());
        break;
      case INPUT_TEXT:
        {
          Statement.InputText input = statement.cast();
          emit(
              NodeKind.SET,
              input.variable(),
              ImmutableMap.of(
                  "variable", input.variable(), "operation", SetOperation.SET.label(), "input", "text"),
              input.pos());
          break;
        }
      case FINISH:
        {
          Statement.Break finish = statement.cast();
          FlowGraph.Node node =
              emit(NodeKind.FINISH, finish.buttonText(), ImmutableMap.of(), finish.pos());
          finishes.add(new Jump(node.id(), scene, Optional.empty(), finish.pos()));
          currentNode = Optional.empty();
          break;
        }
      case PAGE_BREAK:
        {
          Statement.Break pageBreak = statement.cast();
          emit(NodeKind.PAGE_BREAK, pageBreak.buttonText(), ImmutableMap.of(), pageBreak.pos());
          break;
        }
      case COMMENT:
        {
          Statement.Comment comment = statement.cast();
          emit(NodeKind.COMMENT, comment.text(), ImmutableMap.of(), comment.pos());
          break;
        }
      case SCENE_LIST:
        sceneList(statement.cast());
        break;
      case ACHIEVEMENT:
        achievement(statement.cast());
        break;
      case STAT_CHART:
        {
          Statement.StatChart chart = statement.cast();
          emit(
              NodeKind.METADATA,
              "stat_chart",
              ImmutableMap.of("field", "stat_chart", "entries", Joiner.on('\n').join(chart.entries())),
              chart.pos());
          break;
        }
      case METADATA:
        {
          Statement.Metadata field = statement.cast();
          if (field.field().equals("title")) {
            metadata.setTitle(field.value());
          } else {
            metadata.setAuthor(field.value());
          }
          emit(NodeKind.METADATA, field.value(), ImmutableMap.of("field", field.field()), field.pos());
          break;
        }
      case COMMAND:
        {
          Statement.Command command = statement.cast();
          logger.fine(String.format("Keeping *%s at %s as an opaque command", command.name(), command.pos()));
          emit(
              NodeKind.UNKNOWN_COMMAND,
              command.arguments(),
              ImmutableMap.of("command", command.name()),
              command.pos());
          break;
        }
      case CHOICE_OPTION:
      case ELSE_IF:
      case ELSE:
        throw new AssertionError("Not a top-level statement: " + statement);
    }
  }

  private FlowGraph.Node emit(
      NodeKind kind, String text, Map<String, String> attributes, Scanner.Pos pos) {
    return emit(kind, text, attributes, pos, ImmutableList.of());
  }

  // Adds a node fed by the cursor, and moves the cursor to it.
  private FlowGraph.Node emit(
      NodeKind kind,
      String text,
      Map<String, String> attributes,
      Scanner.Pos pos,
      List<FlowGraph.StatChange> statChanges) {
    FlowGraph.Node node = graph.addNode(kind, text, attributes, pos);
    if (currentNode.isPresent()) {
      graph.addEdge(
          currentNode.get(), node.id(), Optional.empty(), statChanges, ImmutableMap.of(), pos);
    }
    currentNode = Optional.of(node.id());
    lastEmitted = node.id();
    return node;
  }

  private void flushText() {
    if (textBuffer.isEmpty()) return;

    String text = Joiner.on("\n\n").join(textBuffer);
    textBuffer.clear();
    emit(NodeKind.TEXT, text, ImmutableMap.of(), textPos);
  }

  private void choice(Statement.Choice choice) throws CompilerException {
    FlowGraph.Node node =
        emit(
            NodeKind.CHOICE,
            choice.token().text(),
            ImmutableMap.of("isFake", Boolean.toString(choice.isFake())),
            choice.pos());

    choiceNodeStack.push(node.id());
    List<Integer> fallThrough = new ArrayList<>();
    choiceBody(choice.body(), Optional.empty(), fallThrough);
    choiceNodeStack.pop();

    currentNode = Optional.empty();
    if (!fallThrough.isEmpty()) {
      FlowGraph.Node merge =
          graph.addNode(NodeKind.MERGE, "", ImmutableMap.of("joins", "choice"), choice.pos());
      for (int terminal : fallThrough) {
        graph.addEdge(terminal, merge.id(), choice.pos());
      }
      currentNode = Optional.of(merge.id());
      lastEmitted = merge.id();
    }
  }

  // Options nested in *if blocks carry the branch condition on their edge.
  private void choiceBody(List<Statement> body, Optional<String> guard, List<Integer> fallThrough)
      throws CompilerException {
    for (Statement statement : body) {
      switch (statement.type()) {
        case CHOICE_OPTION:
          option(statement.cast(), guard, fallThrough);
          break;
        case IF:
          {
            Statement.If cascade = statement.cast();
            String seen = conditionText(cascade.condition());
            choiceBody(cascade.body(), Optional.of(conjunction(guard, seen)), fallThrough);
            for (Statement.ElseIf elseIf : cascade.elseIfs()) {
              String condition = conditionText(elseIf.condition());
              choiceBody(
                  elseIf.body(),
                  Optional.of(conjunction(guard, elseIfCondition(seen, condition))),
                  fallThrough);
              seen = disjunction(seen, condition);
            }
            if (cascade.otherwise().isPresent()) {
              choiceBody(
                  cascade.otherwise().get().body(),
                  Optional.of(conjunction(guard, negation(seen))),
                  fallThrough);
            }
            break;
          }
        case COMMENT:
          break;
        default:
          throw new AssertionError("Unexpected statement in *choice: " + statement);
      }
    }
  }

  private void option(
      Statement.ChoiceOption option, Optional<String> guard, List<Integer> fallThrough)
      throws CompilerException {
    int choiceNode = choiceNodeStack.peek();

    ImmutableMap.Builder<String, String> nodeAttributes = ImmutableMap.builder();
    // The identifier right after '${' or '@{' names the variable; the rest is literal text.
    List<String> markupVariables = new ArrayList<>();
    ImmutableList<Token> markup = option.markup();
    for (int i = 0; i + 1 < markup.size(); i++) {
      Token next = markup.get(i + 1);
      if (MARKUP_OPENERS.contains(markup.get(i).type())
          && next.type() == Token.Type.IDENTIFIER
          && !markupVariables.contains(next.text())) {
        markupVariables.add(next.text());
      }
    }
    if (!markupVariables.isEmpty()) {
      nodeAttributes.put("markupVariables", COMMA.join(markupVariables));
    }
    FlowGraph.Node node =
        graph.addNode(NodeKind.OPTION, option.text(), nodeAttributes.build(), option.pos());

    Optional<String> condition = guard;
    ImmutableMap.Builder<String, String> edgeAttributes = ImmutableMap.builder();
    if (option.condition().isPresent()) {
      condition = Optional.of(conjunction(condition, conditionText(option.condition().get())));
    }
    if (option.selectableIf().isPresent()) {
      String selectable = conditionText(option.selectableIf().get());
      condition = Optional.of(conjunction(condition, selectable));
      edgeAttributes.put("selectableIf", selectable);
    }
    option.reusePolicy().ifPresent(p -> edgeAttributes.put("reuse", p.label()));
    graph.addEdge(
        choiceNode, node.id(), condition, ImmutableList.of(), edgeAttributes.build(), option.pos());

    currentNode = Optional.of(node.id());
    lastEmitted = node.id();
    walk(option.body());
    flushText();
    currentNode.ifPresent(fallThrough::add);
  }

  private void conditional(Statement.If cascade) throws CompilerException {
    ConditionalFrame frame = new ConditionalFrame(currentNode);
    conditionalStack.push(frame);

    frame.condition = conditionText(cascade.condition());
    branch(frame, frame.condition, "if", cascade.body(), cascade.pos());
    for (Statement.ElseIf elseIf : cascade.elseIfs()) {
      String condition = conditionText(elseIf.condition());
      branch(
          frame, elseIfCondition(frame.condition, condition), "elseif", elseIf.body(), elseIf.pos());
      frame.condition = disjunction(frame.condition, condition);
    }
    if (cascade.otherwise().isPresent()) {
      Statement.Else otherwise = cascade.otherwise().get();
      branch(frame, negation(frame.condition), "else", otherwise.body(), otherwise.pos());
    }

    Verify.verify(conditionalStack.pop() == frame);
    FlowGraph.Node merge =
        graph.addNode(NodeKind.MERGE, "", ImmutableMap.of("joins", "conditional"), cascade.pos());
    for (int terminal : frame.branchTerminals) {
      graph.addEdge(terminal, merge.id(), cascade.pos());
    }
    currentNode = Optional.of(merge.id());
    lastEmitted = merge.id();
  }

  private void branch(
      ConditionalFrame frame,
      String condition,
      String branchKind,
      List<Statement> body,
      Scanner.Pos pos)
      throws CompilerException {
    FlowGraph.Node node =
        graph.addNode(
            NodeKind.CONDITIONAL,
            condition,
            ImmutableMap.of("condition", condition, "branch", branchKind),
            pos);
    if (frame.nodeBeforeIf.isPresent()) {
      graph.addEdge(
          frame.nodeBeforeIf.get(),
          node.id(),
          Optional.of(condition),
          ImmutableList.of(),
          ImmutableMap.of(),
          pos);
    }

    currentNode = Optional.of(node.id());
    lastEmitted = node.id();
    walk(body);
    flushText();
    // A branch that jumps away still joins the merge through its last node.
    frame.branchTerminals.add(currentNode.orElse(lastEmitted));
  }

  private void label(Statement.Label label) {
    FlowGraph.Node node =
        emit(NodeKind.LABEL, label.name(), ImmutableMap.of("label", label.name()), label.pos());
    if (!graph.putLabel(scene, label.name(), node.id())) {
      diagnostics.warn(
          Diagnostic.Kind.DUPLICATE_LABEL,
          label.pos(),
          String.format("label %s is already defined in scene %s", label.name(), scene));
    }
  }

  private void subroutineCall(
      Statement call, String targetScene, Optional<String> label, Map<String, String> attributes) {
    Optional<Integer> preCall = currentNode;
    FlowGraph.Node node = emit(NodeKind.GOSUB, "", attributes, call.pos());
    subroutineStack.push(preCall.orElse(node.id()));
    jumps.add(new Jump(node.id(), targetScene, label, call.pos()));
  }

  private void declaration(Statement.DeclareVariable declaration) {
    Statement.DeclareVariable.Scope scope = declaration.scope();
    if (!declaration.name().isPresent()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          declaration.pos(),
          String.format("*%s needs a variable name: '%s'", scope.label(), declaration.rawArguments()));
    } else if (scope == Statement.DeclareVariable.Scope.GLOBAL
        && !declaration.initializer().isPresent()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          declaration.pos(),
          String.format("*create %s needs an initial value", declaration.name().get()));
    }

    String name = declaration.name().orElse("");
    GameMetadata.DataType dataType = inferType(declaration.initializer());
    String initialValue = initialValue(declaration.initializer());
    emit(
        NodeKind.VARIABLE,
        name,
        ImmutableMap.of(
            "variable", name,
            "scope", scope.label(),
            "dataType", dataType.label(),
            "initialValue", initialValue),
        declaration.pos());

    if (declaration.name().isPresent() && scope == Statement.DeclareVariable.Scope.GLOBAL) {
      variables.put(
          name,
          GameMetadata.Variable.create(name, scope, dataType, initialValue, declaration.pos()));
    }
  }

  private void set(Statement.SetVariable set) {
    if (!set.name().isPresent()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          set.pos(),
          String.format("*set needs a variable name: '%s'", set.rawArguments()));
    } else if (!set.value().isPresent()) {
      diagnostics.warn(
          Diagnostic.Kind.INVALID_DECLARATION,
          set.pos(),
          String.format("*set %s needs a value", set.name().get()));
    }

    String name = set.name().orElse("");
    String value = set.value().map(Expression::toSource).orElse("");
    emit(
        NodeKind.SET,
        name,
        ImmutableMap.of("variable", name, "operation", set.operation().label(), "value", value),
        set.pos(),
        ImmutableList.of(FlowGraph.StatChange.create(name, set.operation(), value)));
  }

  private void sceneList(Statement.SceneList list) {
    if (sceneList.isEmpty()) {
      sceneList = list.scenes();
    }
    for (String name : list.scenes()) {
      listedScenes.add(name);
      reference(name, listedQueue, list.pos());
    }
    emit(
        NodeKind.METADATA,
        "scene_list",
        ImmutableMap.of("field", "scene_list", "scenes", COMMA.join(list.scenes())),
        list.pos());
  }

  private void achievement(Statement.Achievement achievement) {
    metadata
        .achievementsBuilder()
        .add(
            GameMetadata.Achievement.create(
                achievement.id(),
                achievement.visible(),
                achievement.points(),
                achievement.title(),
                achievement.preEarnedDescription(),
                achievement.postEarnedDescription()));
    emit(
        NodeKind.METADATA,
        achievement.title(),
        ImmutableMap.of(
            "field", "achievement",
            "id", achievement.id(),
            "points", Integer.toString(achievement.points())),
        achievement.pos());
  }

  private void link() {
    for (Jump jump : jumps) {
      Optional<Integer> target =
          jump.label.isPresent()
              ? graph.label(jump.scene, jump.label.get())
              : graph.entryPoint(jump.scene);
      if (target.isPresent()) {
        graph.addEdge(jump.node, target.get(), jump.pos);
      } else if (jump.label.isPresent()) {
        diagnostics.warn(
            Diagnostic.Kind.UNRESOLVED_REFERENCE,
            jump.pos,
            String.format("no *label %s in scene %s", jump.label.get(), jump.scene));
      } else {
        diagnostics.warn(
            Diagnostic.Kind.UNRESOLVED_REFERENCE,
            jump.pos,
            String.format("scene %s does not exist", jump.scene));
      }
    }

    if (options.linkFinishToNextScene()) {
      for (Jump finish : finishes) {
        int index = sceneList.indexOf(finish.scene);
        if (index >= 0 && index + 1 < sceneList.size()) {
          graph
              .entryPoint(sceneList.get(index + 1))
              .ifPresent(next -> graph.addEdge(finish.node, next, finish.pos));
        }
      }
    }
  }

  private static ImmutableMap<String, String> targetAttributes(
      String targetScene, Optional<String> label) {
    ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();
    attributes.put("targetScene", targetScene);
    label.ifPresent(l -> attributes.put("label", l));
    return attributes.build();
  }

  private static ImmutableMap<String, String> argumentAttributes(List<Expression> arguments) {
    if (arguments.isEmpty()) return ImmutableMap.of();
    return ImmutableMap.of(
        "arguments",
        arguments.stream().map(Expression::toSource).collect(Collectors.joining(", ")));
  }

  static String conditionText(Expression condition) {
    return condition.unwrap().toSource();
  }

  static String elseIfCondition(String previous, String condition) {
    return "not(" + previous + ") and (" + condition + ")";
  }

  static String disjunction(String previous, String condition) {
    return "(" + previous + ") or (" + condition + ")";
  }

  static String negation(String previous) {
    return "not(" + previous + ")";
  }

  private static String conjunction(Optional<String> guard, String condition) {
    return guard.map(g -> "(" + g + ") and (" + condition + ")").orElse(condition);
  }

  static GameMetadata.DataType inferType(Optional<Expression> initializer) {
    if (!initializer.isPresent()) return GameMetadata.DataType.NUMERIC;

    Expression expr = initializer.get().unwrap();
    switch (expr.type()) {
      case LITERAL:
        {
          Expression.Literal literal = expr.cast();
          switch (literal.kind()) {
            case NUMBER:
              return GameMetadata.DataType.NUMERIC;
            case BOOLEAN:
              return GameMetadata.DataType.BOOLEAN;
            default:
              return GameMetadata.DataType.STRING;
          }
        }
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          return unary.operator() == Operator.NOT
              ? GameMetadata.DataType.BOOLEAN
              : GameMetadata.DataType.NUMERIC;
        }
      case BINARY:
        {
          Expression.Binary binary = expr.cast();
          switch (binary.operator().category()) {
            case COMPARISON:
            case LOGICAL:
              return GameMetadata.DataType.BOOLEAN;
            default:
              return binary.operator() == Operator.CONCATENATE
                  ? GameMetadata.DataType.STRING
                  : GameMetadata.DataType.NUMERIC;
          }
        }
      default:
        return GameMetadata.DataType.STRING;
    }
  }

  private static String initialValue(Optional<Expression> initializer) {
    if (!initializer.isPresent()) return "";

    Expression expr = initializer.get().unwrap();
    if (expr.type() == Expression.Type.LITERAL) {
      Expression.Literal literal = expr.cast();
      return literal.value();
    }
    return expr.toSource();
  }
}
