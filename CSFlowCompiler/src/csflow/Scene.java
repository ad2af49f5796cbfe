package csflow;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** One loaded scene and its tokens. Discarded once the builder has linked it into the graph. */
@AutoValue
public abstract class Scene {
  public abstract String name();

  public abstract String sourceText();

  public abstract ImmutableList<Token> tokens();

  public static Scene scan(String name, String sourceText, Diagnostics diagnostics) {
    return new AutoValue_Scene(
        name, sourceText, new Scanner(name, sourceText, diagnostics).scan());
  }
}
