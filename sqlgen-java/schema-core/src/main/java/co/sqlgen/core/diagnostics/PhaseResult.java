package co.sqlgen.core.diagnostics;

import java.util.List;

/**
 * Output of one pipeline phase: a value (null when the phase could not produce one)
 * and the diagnostics it reported, in discovery order.
 */
public record PhaseResult<T>(T value, List<Diagnostic> diagnostics) {

  public PhaseResult {
    diagnostics = List.copyOf(diagnostics);
  }

  public static <T> PhaseResult<T> of(T value, List<Diagnostic> diagnostics) {
    return new PhaseResult<>(value, diagnostics);
  }

  public static <T> PhaseResult<T> failed(List<Diagnostic> diagnostics) {
    return new PhaseResult<>(null, diagnostics);
  }

  public boolean hasFatal() {
    return diagnostics.stream().anyMatch(Diagnostic::isFatal);
  }
}
