package csflow;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Story-wide facts collected while building the flow graph. */
@AutoValue
public abstract class GameMetadata {
  public enum DataType {
    NUMERIC,
    STRING,
    BOOLEAN;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  @AutoValue
  public abstract static class Variable {
    public abstract String name();

    public abstract Statement.DeclareVariable.Scope scope();

    public abstract DataType dataType();

    public abstract String initialValue();

    public abstract Scanner.Pos pos();

    public static Variable create(
        String name,
        Statement.DeclareVariable.Scope scope,
        DataType dataType,
        String initialValue,
        Scanner.Pos pos) {
      return new AutoValue_GameMetadata_Variable(name, scope, dataType, initialValue, pos);
    }
  }

  @AutoValue
  public abstract static class Achievement {
    public abstract String id();

    public abstract boolean visible();

    public abstract int points();

    public abstract String title();

    public abstract String preEarnedDescription();

    public abstract Optional<String> postEarnedDescription();

    public static Achievement create(
        String id,
        boolean visible,
        int points,
        String title,
        String preEarnedDescription,
        Optional<String> postEarnedDescription) {
      return new AutoValue_GameMetadata_Achievement(
          id, visible, points, title, preEarnedDescription, postEarnedDescription);
    }
  }

  public abstract Optional<String> title();

  public abstract Optional<String> author();

  /** Scene order declared by {@code *scene_list}; empty if the story has none. */
  public abstract ImmutableList<String> sceneList();

  /** Global ({@code *create}) variables by name; a later declaration replaces an earlier one. */
  public abstract ImmutableMap<String, Variable> variables();

  public abstract ImmutableList<Achievement> achievements();

  public static Builder builder() {
    return new AutoValue_GameMetadata.Builder()
        .setSceneList(ImmutableList.of())
        .setVariables(ImmutableMap.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTitle(String title);

    public abstract Builder setAuthor(String author);

    public abstract Builder setSceneList(Iterable<String> sceneList);

    public abstract Builder setVariables(Map<String, Variable> variables);

    public abstract ImmutableList.Builder<Achievement> achievementsBuilder();

    public abstract GameMetadata build();
  }
}
