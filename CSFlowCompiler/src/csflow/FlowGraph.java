package csflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;

/**
 * The control flow of a whole story: every narrative branch, variable change, subroutine call and
 * scene jump. Immutable; only {@link FlowGraphBuilder} creates one.
 */
@AutoValue
public abstract class FlowGraph {
  @AutoValue
  public abstract static class Node {
    public abstract int id();

    public abstract NodeKind kind();

    public abstract String text();

    public abstract ImmutableMap<String, String> attributes();

    public abstract Scanner.Pos pos();

    public String name() {
      return "node_" + id();
    }

    public Optional<String> attribute(String key) {
      return Optional.ofNullable(attributes().get(key));
    }

    static Node create(
        int id, NodeKind kind, String text, Map<String, String> attributes, Scanner.Pos pos) {
      return new AutoValue_FlowGraph_Node(id, kind, text, ImmutableMap.copyOf(attributes), pos);
    }
  }

  @AutoValue
  public abstract static class StatChange {
    public abstract String variable();

    public abstract SetOperation operation();

    public abstract String value();

    public static StatChange create(String variable, SetOperation operation, String value) {
      return new AutoValue_FlowGraph_StatChange(variable, operation, value);
    }
  }

  @AutoValue
  public abstract static class Edge {
    public abstract int source();

    public abstract int target();

    public abstract Optional<String> condition();

    public abstract ImmutableList<StatChange> statChanges();

    public abstract ImmutableMap<String, String> attributes();

    public abstract Scanner.Pos pos();

    public Optional<String> attribute(String key) {
      return Optional.ofNullable(attributes().get(key));
    }
  }

  /** Nodes by id, in creation order. */
  public abstract ImmutableMap<Integer, Node> nodes();

  public abstract ImmutableList<Edge> edges();

  /** Entry node of every processed scene. */
  public abstract ImmutableMap<String, Integer> entryPoints();

  /** Label nodes by scene, then lower-cased label name. */
  public abstract ImmutableTable<String, String, Integer> labels();

  public abstract GameMetadata metadata();

  public abstract ImmutableList<Diagnostic> diagnostics();

  public Node node(int id) {
    Node node = nodes().get(id);
    Preconditions.checkArgument(node != null, "No node %s", id);
    return node;
  }

  public ImmutableList<Node> nodesOfKind(NodeKind kind) {
    return nodes().values().stream().filter(n -> n.kind() == kind).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Edge> outgoingEdges(int id) {
    return outgoing().get(id);
  }

  public ImmutableList<Edge> incomingEdges(int id) {
    return incoming().get(id);
  }

  @Memoized
  ImmutableListMultimap<Integer, Edge> outgoing() {
    return Multimaps.index(edges(), Edge::source);
  }

  @Memoized
  ImmutableListMultimap<Integer, Edge> incoming() {
    return Multimaps.index(edges(), Edge::target);
  }

  /** The graph's shape without node or edge payloads; parallel edges collapse. */
  @Memoized
  public ImmutableGraph<Integer> topology() {
    MutableGraph<Integer> graph =
        GraphBuilder.directed().allowsSelfLoops(true).expectedNodeCount(nodes().size()).build();
    nodes().keySet().forEach(graph::addNode);
    edges().forEach(e -> graph.putEdge(e.source(), e.target()));
    return ImmutableGraph.copyOf(graph);
  }

  /** Mutable accumulator used while the graph is being built. */
  static final class Builder {
    private final Map<Integer, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Integer> entryPoints = new LinkedHashMap<>();
    private final Table<String, String, Integer> labels = TreeBasedTable.create();
    private int nextId = 0;

    Node addNode(NodeKind kind, String text, Map<String, String> attributes, Scanner.Pos pos) {
      Node node = Node.create(nextId++, kind, text, attributes, pos);
      nodes.put(node.id(), node);
      return node;
    }

    Node node(int id) {
      Node node = nodes.get(id);
      Preconditions.checkArgument(node != null, "No node %s", id);
      return node;
    }

    int nodeCount() {
      return nodes.size();
    }

    List<Node> nodesSince(int count) {
      return new ArrayList<>(nodes.values()).subList(count, nodes.size());
    }

    Edge addEdge(
        int source,
        int target,
        Optional<String> condition,
        List<StatChange> statChanges,
        Map<String, String> attributes,
        Scanner.Pos pos) {
      Preconditions.checkArgument(nodes.containsKey(source), "Edge from missing node %s", source);
      Preconditions.checkArgument(nodes.containsKey(target), "Edge to missing node %s", target);
      Edge edge =
          new AutoValue_FlowGraph_Edge(
              source,
              target,
              condition,
              ImmutableList.copyOf(statChanges),
              ImmutableMap.copyOf(attributes),
              pos);
      edges.add(edge);
      return edge;
    }

    Edge addEdge(int source, int target, Scanner.Pos pos) {
      return addEdge(source, target, Optional.empty(), ImmutableList.of(), ImmutableMap.of(), pos);
    }

    void putEntryPoint(String scene, int id) {
      Preconditions.checkState(
          entryPoints.putIfAbsent(scene, id) == null, "Scene %s already has an entry point", scene);
    }

    Optional<Integer> entryPoint(String scene) {
      return Optional.ofNullable(entryPoints.get(scene));
    }

    /** Returns false, keeping the first, if the scene already has this label. */
    boolean putLabel(String scene, String label, int id) {
      if (labels.contains(scene, label)) return false;
      labels.put(scene, label, id);
      return true;
    }

    Optional<Integer> label(String scene, String label) {
      return Optional.ofNullable(labels.get(scene, label));
    }

    FlowGraph build(GameMetadata metadata, List<Diagnostic> diagnostics) {
      return new AutoValue_FlowGraph(
          ImmutableMap.copyOf(nodes),
          ImmutableList.copyOf(edges),
          ImmutableMap.copyOf(entryPoints),
          ImmutableTable.copyOf(labels),
          metadata,
          ImmutableList.copyOf(diagnostics));
    }
  }
}
