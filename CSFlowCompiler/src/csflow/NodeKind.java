package csflow;

import java.util.Locale;

/** The closed set of flow-graph node kinds. */
public enum NodeKind {
  SCENE_ENTRY,
  TEXT,
  CHOICE,
  OPTION,
  CONDITIONAL,
  MERGE,
  GOTO,
  GOSUB,
  RETURN,
  VARIABLE,
  SET,
  LABEL,
  FINISH,
  PAGE_BREAK,
  COMMENT,
  METADATA,
  UNKNOWN_COMMAND;

  /** Stable lower-case name for exporters, e.g. {@code scene_entry}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
