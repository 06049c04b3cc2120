package co.sqlgen.core.diagnostics;

/**
 * Categories of problems reported by the generation pipeline.
 *
 * <p>A fatal kind stops the pipeline before the next phase starts. Non-fatal kinds
 * are returned alongside successful output and call for manual follow-up.
 */
public enum DiagnosticKind {
  PARSE_ERROR(true),
  DUPLICATE_DEFINITION(true),
  REFERENCE_ERROR(true),
  INVALID_INDEX(true),
  TYPE_RULE_COMPILATION(false),
  UNKNOWN_TYPE(false),
  INVALID_VALUE_SET(true),
  OUTPUT_COLLISION(true),
  GENERATION_ERROR(true),
  CANCELLED(true);

  private final boolean fatal;

  DiagnosticKind(boolean fatal) {
    this.fatal = fatal;
  }

  public boolean isFatal() {
    return fatal;
  }
}
