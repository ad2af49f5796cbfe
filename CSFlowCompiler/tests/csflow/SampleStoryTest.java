package csflow;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

public class SampleStoryTest {
  /** Reads scenes from {@code scenes/<name>.txt} on the test classpath. */
  private static final class ResourceSceneProvider implements SceneProvider {
    private final ImmutableList<String> names;

    ResourceSceneProvider(String... names) {
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public ImmutableList<String> listScenes() {
      return names;
    }

    @Override
    public String loadScene(String name) throws IOException {
      return Resources.toString(url(name).get(), StandardCharsets.UTF_8);
    }

    @Override
    public boolean hasScene(String name) {
      return url(name).isPresent();
    }

    private static Optional<URL> url(String name) {
      try {
        return Optional.of(Resources.getResource("scenes/" + name + ".txt"));
      } catch (IllegalArgumentException ex) {
        return Optional.empty();
      }
    }
  }

  private static FlowGraph graph;

  @BeforeAll
  public static void buildStory() throws CompilerException, IOException {
    graph =
        new FlowGraphBuilder(
                new ResourceSceneProvider("startup", "chapter1", "chapter2", "secret"))
            .build("startup");
  }

  @Test
  public void buildsCleanly() {
    assertThat(graph.diagnostics()).isEmpty();
  }

  @Test
  public void scenesInDiscoveryOrder() {
    assertThat(graph.entryPoints().keySet())
        .containsExactly("startup", "chapter1", "chapter2", "secret")
        .inOrder();
  }

  @Test
  public void metadata() {
    GameMetadata metadata = graph.metadata();

    assertThat(metadata.title()).hasValue("The Lighthouse");
    assertThat(metadata.author()).hasValue("A. Keeper");
    assertThat(metadata.sceneList()).containsExactly("startup", "chapter1", "chapter2").inOrder();
    assertThat(metadata.variables().keySet())
        .containsExactly("courage", "lamp_lit", "name")
        .inOrder();
    assertThat(metadata.variables().get("lamp_lit").dataType())
        .isEqualTo(GameMetadata.DataType.BOOLEAN);
    assertThat(metadata.variables().get("name").dataType()).isEqualTo(GameMetadata.DataType.STRING);
    assertThat(metadata.achievements()).hasSize(1);
    assertThat(metadata.achievements().get(0).postEarnedDescription()).hasValue("You lit the lamp.");
  }

  @Test
  public void finishesLeadToNextChapter() {
    int chapter1 = graph.entryPoints().get("chapter1");
    long linked =
        graph
            .nodesOfKind(NodeKind.FINISH)
            .stream()
            .filter(n -> n.pos().scene().equals("startup"))
            .filter(n -> graph.outgoingEdges(n.id()).stream().anyMatch(e -> e.target() == chapter1))
            .count();

    assertThat(linked).isEqualTo(3);
  }

  @Test
  public void everyNodeIsReachable() {
    assertThat(GraphAnalysis.findUnreachableNodes(graph)).isEmpty();
  }

  @Test
  public void subroutineFormsCycle() {
    int ret = graph.nodesOfKind(NodeKind.RETURN).get(0).id();

    assertThat(GraphAnalysis.findCycles(graph).stream().anyMatch(c -> c.contains(ret))).isTrue();
  }

  @Test
  public void onlyTheEndingIsADeadEnd() {
    ImmutableList<Integer> deadEnds = GraphAnalysis.findDeadEnds(graph);

    assertThat(deadEnds).hasSize(1);
    assertThat(graph.node(deadEnds.get(0)).attribute("command")).hasValue("ending");
  }

  @Test
  public void variablesAreDeclared() {
    assertThat(GraphAnalysis.extractVariableUsage(graph).keySet())
        .containsExactly("courage", "fuel", "lamp_lit", "name");
    assertThat(GraphAnalysis.extractVariableUsage(graph).get("lamp_lit").usages()).isNotEmpty();
    for (GraphAnalysis.VariableUsage usage : GraphAnalysis.extractVariableUsage(graph).values()) {
      assertThat(usage.isDeclared()).isTrue();
    }
  }
}
