package csflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;

/** Read-only passes over a finished {@link FlowGraph}. Results are ordered by node id. */
public final class GraphAnalysis {
  private static final Pattern IDENTIFIER = Pattern.compile("\\b[a-zA-Z_]\\w*\\b");
  private static final Pattern QUOTED = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'");
  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("and", "or", "not", "true", "false", "round", "modulo");

  public static final int DEFAULT_MAX_PATHS = 100;

  /** Where one variable is declared, assigned and read. */
  @AutoValue
  public abstract static class VariableUsage {
    public abstract String name();

    /** {@code variable} node ids. */
    public abstract ImmutableList<Integer> declarations();

    /** {@code set} node ids. */
    public abstract ImmutableList<Integer> assignments();

    /** Source node ids of edges whose condition mentions the variable. */
    public abstract ImmutableList<Integer> usages();

    public boolean isDeclared() {
      return !declarations().isEmpty();
    }

    static VariableUsage create(
        String name, List<Integer> declarations, List<Integer> assignments, List<Integer> usages) {
      return new AutoValue_GraphAnalysis_VariableUsage(
          name,
          ImmutableList.copyOf(declarations),
          ImmutableList.copyOf(assignments),
          ImmutableList.copyOf(usages));
    }
  }

  private GraphAnalysis() {}

  /**
   * Finds cycles by depth-first search. Each back edge yields one cycle: the path from the node it
   * returns to, up to the node it leaves, without repeating the first node.
   */
  public static ImmutableList<ImmutableList<Integer>> findCycles(FlowGraph graph) {
    ImmutableList.Builder<ImmutableList<Integer>> cycles = ImmutableList.builder();
    Set<Integer> visited = new HashSet<>();

    for (int root : graph.nodes().keySet()) {
      if (visited.contains(root)) continue;

      // The recursion stack: path holds the nodes, iterators their unexplored successors.
      List<Integer> path = new ArrayList<>();
      Set<Integer> onPath = new HashSet<>();
      Deque<Iterator<Integer>> iterators = new ArrayDeque<>();

      visited.add(root);
      path.add(root);
      onPath.add(root);
      iterators.push(successors(graph, root).iterator());

      while (!iterators.isEmpty()) {
        Iterator<Integer> it = iterators.peek();
        if (!it.hasNext()) {
          iterators.pop();
          onPath.remove(path.remove(path.size() - 1));
          continue;
        }

        int next = it.next();
        if (onPath.contains(next)) {
          cycles.add(ImmutableList.copyOf(path.subList(path.indexOf(next), path.size())));
        } else if (visited.add(next)) {
          path.add(next);
          onPath.add(next);
          iterators.push(successors(graph, next).iterator());
        }
      }
    }
    return cycles.build();
  }

  /** Ids of nodes not reachable from any scene entry point. */
  public static ImmutableList<Integer> findUnreachableNodes(FlowGraph graph) {
    Set<Integer> reached = new HashSet<>(graph.entryPoints().values());
    Deque<Integer> queue = new ArrayDeque<>(graph.entryPoints().values());
    while (!queue.isEmpty()) {
      for (int next : successors(graph, queue.remove())) {
        if (reached.add(next)) {
          queue.add(next);
        }
      }
    }

    return graph
        .nodes()
        .keySet()
        .stream()
        .filter(id -> !reached.contains(id))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Ids of nodes where flow stops without finishing. Dangling gotos and gosubs are left to the
   * unresolved reference warnings.
   */
  public static ImmutableList<Integer> findDeadEnds(FlowGraph graph) {
    return graph
        .nodes()
        .values()
        .stream()
        .filter(n -> graph.outgoingEdges(n.id()).isEmpty())
        .filter(
            n -> n.kind() != NodeKind.FINISH && n.kind() != NodeKind.GOTO && n.kind() != NodeKind.GOSUB)
        .map(FlowGraph.Node::id)
        .collect(ImmutableList.toImmutableList());
  }

  /** Usage of every variable the graph mentions, keyed by lower-cased name. */
  public static ImmutableSortedMap<String, VariableUsage> extractVariableUsage(FlowGraph graph) {
    Map<String, List<Integer>> declarations = new TreeMap<>();
    Map<String, List<Integer>> assignments = new TreeMap<>();
    Map<String, List<Integer>> usages = new TreeMap<>();

    for (FlowGraph.Node node : graph.nodes().values()) {
      if (node.kind() != NodeKind.VARIABLE && node.kind() != NodeKind.SET) continue;

      String name = node.attribute("variable").orElse("").toLowerCase(Locale.ROOT);
      if (name.isEmpty()) continue;

      Map<String, List<Integer>> target =
          node.kind() == NodeKind.VARIABLE ? declarations : assignments;
      target.computeIfAbsent(name, k -> new ArrayList<>()).add(node.id());
    }

    for (FlowGraph.Edge edge : graph.edges()) {
      if (!edge.condition().isPresent()) continue;

      for (String name : identifiers(edge.condition().get())) {
        List<Integer> sources = usages.computeIfAbsent(name, k -> new ArrayList<>());
        if (!sources.contains(edge.source())) {
          sources.add(edge.source());
        }
      }
    }

    Set<String> names = new LinkedHashSet<>(declarations.keySet());
    names.addAll(assignments.keySet());
    names.addAll(usages.keySet());

    ImmutableSortedMap.Builder<String, VariableUsage> result = ImmutableSortedMap.naturalOrder();
    for (String name : names) {
      result.put(
          name,
          VariableUsage.create(
              name,
              declarations.getOrDefault(name, ImmutableList.of()),
              assignments.getOrDefault(name, ImmutableList.of()),
              usages.getOrDefault(name, ImmutableList.of())));
    }
    return result.build();
  }

  public static ImmutableList<ImmutableList<Integer>> findAllPaths(
      FlowGraph graph, int from, int to) {
    return findAllPaths(graph, from, to, DEFAULT_MAX_PATHS);
  }

  /** Up to {@code maxPaths} simple paths from {@code from} to {@code to}, in discovery order. */
  public static ImmutableList<ImmutableList<Integer>> findAllPaths(
      FlowGraph graph, int from, int to, int maxPaths) {
    Preconditions.checkArgument(maxPaths > 0, "maxPaths must be positive: %s", maxPaths);
    graph.node(from);
    graph.node(to);

    if (from == to) return ImmutableList.of(ImmutableList.of(from));

    List<ImmutableList<Integer>> paths = new ArrayList<>();
    List<Integer> path = Lists.newArrayList(from);
    Set<Integer> onPath = new HashSet<>(path);
    Deque<Iterator<Integer>> iterators = new ArrayDeque<>();
    iterators.push(successors(graph, from).iterator());

    while (!iterators.isEmpty() && paths.size() < maxPaths) {
      Iterator<Integer> it = iterators.peek();
      if (!it.hasNext()) {
        iterators.pop();
        onPath.remove(path.remove(path.size() - 1));
        continue;
      }

      int next = it.next();
      if (next == to) {
        List<Integer> found = new ArrayList<>(path);
        found.add(to);
        paths.add(ImmutableList.copyOf(found));
      } else if (onPath.add(next)) {
        path.add(next);
        iterators.push(successors(graph, next).iterator());
      }
    }
    return ImmutableList.copyOf(paths);
  }

  /** Runs every pass and reports what it finds as {@link Diagnostic.Kind#ANALYSIS} warnings. */
  public static ImmutableList<Diagnostic> validate(FlowGraph graph) {
    Diagnostics diagnostics = new Diagnostics();

    for (ImmutableList<Integer> cycle : findCycles(graph)) {
      diagnostics.warn(
          Diagnostic.Kind.ANALYSIS,
          graph.node(cycle.get(0)).pos(),
          String.format(
              "cycle through %s",
              cycle.stream().map(id -> graph.node(id).name()).reduce((a, b) -> a + " -> " + b).get()));
    }
    for (int id : findUnreachableNodes(graph)) {
      FlowGraph.Node node = graph.node(id);
      diagnostics.warn(
          Diagnostic.Kind.ANALYSIS,
          node.pos(),
          String.format("%s (%s) is unreachable", node.name(), node.kind().label()));
    }
    for (int id : findDeadEnds(graph)) {
      FlowGraph.Node node = graph.node(id);
      diagnostics.warn(
          Diagnostic.Kind.ANALYSIS,
          node.pos(),
          String.format("%s (%s) is a dead end", node.name(), node.kind().label()));
    }
    for (VariableUsage usage : extractVariableUsage(graph).values()) {
      if (usage.isDeclared()) continue;

      int first =
          usage.assignments().isEmpty() ? usage.usages().get(0) : usage.assignments().get(0);
      diagnostics.warn(
          Diagnostic.Kind.ANALYSIS,
          graph.node(first).pos(),
          String.format("variable %s is never declared", usage.name()));
    }
    return diagnostics.diagnostics();
  }

  // Distinct targets, in edge order.
  private static ImmutableList<Integer> successors(FlowGraph graph, int id) {
    return graph
        .outgoingEdges(id)
        .stream()
        .map(FlowGraph.Edge::target)
        .distinct()
        .collect(ImmutableList.toImmutableList());
  }

  static ImmutableSet<String> identifiers(String condition) {
    Matcher matcher = IDENTIFIER.matcher(QUOTED.matcher(condition).replaceAll(" "));
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    while (matcher.find()) {
      String name = matcher.group().toLowerCase(Locale.ROOT);
      if (!KEYWORDS.contains(name)) {
        names.add(name);
      }
    }
    return names.build();
  }
}
