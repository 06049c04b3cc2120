package co.sqlgen.core.diagnostics;

import java.util.Objects;

/**
 * Position inside a named schema source. Lines and columns are 1-based.
 */
public record SourceLocation(String source, int line, int column) {

  public SourceLocation {
    Objects.requireNonNull(source, "source");
  }

  @Override
  public String toString() {
    return source + ":" + line + ":" + column;
  }
}
