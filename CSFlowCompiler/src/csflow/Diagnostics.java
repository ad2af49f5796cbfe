package csflow;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Collects warnings for one build. Shared by the scanner, parser and builder of a single run; not
 * thread-safe.
 */
public final class Diagnostics {
  private static final Logger logger = Logger.getLogger(Diagnostics.class.getName());

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public void warn(Diagnostic.Kind kind, Scanner.Pos pos, String msg) {
    log(Diagnostic.create(kind, pos, msg));
  }

  public void log(Diagnostic diagnostic) {
    logger.warning(diagnostic.toString());
    diagnostics.add(diagnostic);
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public ImmutableList<Diagnostic> ofKind(Diagnostic.Kind kind) {
    return diagnostics.stream().filter(d -> d.kind() == kind).collect(ImmutableList.toImmutableList());
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }
}
