package csflow;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

/** Fetches a batch of scene texts from a {@link SceneProvider}, possibly in parallel. */
final class SceneLoader {
  private final SceneProvider provider;
  private final ListeningExecutorService executor;

  SceneLoader(SceneProvider provider, ListeningExecutorService executor) {
    this.provider = provider;
    this.executor = executor;
  }

  /** Returns texts keyed in request order; empty for scenes the provider does not have. */
  ImmutableMap<String, Optional<String>> loadAll(List<String> names) throws IOException {
    ImmutableList<ListenableFuture<Optional<String>>> futures =
        names
            .stream()
            .map(name -> executor.submit(() -> load(name)))
            .collect(ImmutableList.toImmutableList());

    List<Optional<String>> texts;
    try {
      texts = Futures.allAsList(futures).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while loading scenes " + names);
    } catch (ExecutionException ex) {
      Throwables.throwIfInstanceOf(ex.getCause(), IOException.class);
      Throwables.throwIfUnchecked(ex.getCause());
      throw new IOException("Failed to load scenes " + names, ex.getCause());
    }

    ImmutableMap.Builder<String, Optional<String>> result = ImmutableMap.builder();
    for (int i = 0; i < names.size(); i++) {
      result.put(names.get(i), texts.get(i));
    }
    return result.build();
  }

  ImmutableList<String> listScenes() throws IOException {
    return provider.listScenes();
  }

  private Optional<String> load(String name) throws IOException {
    if (!provider.hasScene(name)) {
      return Optional.empty();
    }
    return Optional.of(provider.loadScene(name));
  }
}
