package csflow;

import java.io.IOException;

import com.google.common.collect.ImmutableList;

/**
 * Source of scene texts. Implementations own all I/O, caching, timeouts and retries; the builder
 * only calls these three methods.
 */
public interface SceneProvider {
  ImmutableList<String> listScenes() throws IOException;

  String loadScene(String name) throws IOException;

  boolean hasScene(String name) throws IOException;
}
