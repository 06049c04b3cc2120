package co.sqlgen.core.diagnostics;

import java.util.Objects;

/**
 * A structured problem report. {@code location} is null when the problem is not tied
 * to a position in a schema source (for example a type mapping rule or an artifact name).
 */
public record Diagnostic(DiagnosticKind kind, SourceLocation location, String message) {

  public Diagnostic {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static Diagnostic of(DiagnosticKind kind, String message) {
    return new Diagnostic(kind, null, message);
  }

  public static Diagnostic at(DiagnosticKind kind, SourceLocation location, String message) {
    return new Diagnostic(kind, location, message);
  }

  public boolean isFatal() {
    return kind.isFatal();
  }

  @Override
  public String toString() {
    return location == null
        ? kind + ": " + message
        : kind + " at " + location + ": " + message;
  }
}
