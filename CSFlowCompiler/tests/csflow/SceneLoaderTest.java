package csflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

public class SceneLoaderTest {
  private final ListeningExecutorService executor =
      MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(4));

  @AfterEach
  public void shutdown() {
    executor.shutdownNow();
  }

  @Test
  public void loadsInRequestOrder() throws IOException {
    FakeSceneProvider scenes = new FakeSceneProvider().add("a", "A.").add("b", "B.").add("c", "C.");
    SceneLoader loader = new SceneLoader(scenes, executor);

    ImmutableMap<String, Optional<String>> texts =
        loader.loadAll(ImmutableList.of("c", "missing", "a"));

    assertThat(texts.keySet()).containsExactly("c", "missing", "a").inOrder();
    assertThat(texts.get("c")).hasValue("C.\n");
    assertThat(texts.get("missing")).isEmpty();
    assertThat(texts.get("a")).hasValue("A.\n");
  }

  @Test
  public void providerFailuresPropagate() {
    SceneProvider broken =
        new SceneProvider() {
          @Override
          public ImmutableList<String> listScenes() {
            return ImmutableList.of("a");
          }

          @Override
          public String loadScene(String name) throws IOException {
            throw new IOException("disk on fire");
          }

          @Override
          public boolean hasScene(String name) {
            return true;
          }
        };
    SceneLoader loader = new SceneLoader(broken, executor);

    IOException ex = assertThrows(IOException.class, () -> loader.loadAll(ImmutableList.of("a")));
    assertThat(ex).hasMessageThat().isEqualTo("disk on fire");
  }

  @Test
  public void builderUsesConfiguredExecutor() throws Exception {
    FakeSceneProvider scenes =
        new FakeSceneProvider()
            .add("startup", "*scene_list", "  startup", "  one", "  two", "*finish")
            .add("one", "*finish")
            .add("two", "*finish");

    FlowGraph graph =
        new FlowGraphBuilder(scenes, BuildOptions.builder().setSceneLoadExecutor(executor).build())
            .build("startup");

    assertThat(graph.entryPoints().keySet()).containsExactly("startup", "one", "two").inOrder();
  }
}
