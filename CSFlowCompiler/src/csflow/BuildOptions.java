package csflow;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

/** Knobs for one {@link FlowGraphBuilder} run. */
@AutoValue
public abstract class BuildOptions {
  /** When false, syntax errors become diagnostics and parsing resumes at the next boundary. */
  public abstract boolean strict();

  /** Whether {@code *finish} links to the next scene of {@code *scene_list}. */
  public abstract boolean linkFinishToNextScene();

  /** Whether provider scenes that nothing references are built too. */
  public abstract boolean includeUnlistedScenes();

  /** Runs scene loads; linking always happens on the calling thread. */
  public abstract ListeningExecutorService sceneLoadExecutor();

  public static BuildOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_BuildOptions.Builder()
        .setStrict(true)
        .setLinkFinishToNextScene(true)
        .setIncludeUnlistedScenes(false)
        .setSceneLoadExecutor(MoreExecutors.newDirectExecutorService());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStrict(boolean strict);

    public abstract Builder setLinkFinishToNextScene(boolean linkFinishToNextScene);

    public abstract Builder setIncludeUnlistedScenes(boolean includeUnlistedScenes);

    public abstract Builder setSceneLoadExecutor(ListeningExecutorService sceneLoadExecutor);

    public abstract BuildOptions build();
  }
}
