package co.sqlgen.core.typemap;

/**
 * Outcome of resolving one column's type.
 *
 * @param targetType the mapped target type, null when no rule matched
 * @param ruleIndex position of the winning rule in the list passed to
 *                  {@link TypeMapper#compile}, or -1
 * @param specificity number of patterns the winning rule declared, 0 when unmatched
 */
public record ResolvedType(String targetType, int ruleIndex, int specificity) {

  public static final ResolvedType UNKNOWN = new ResolvedType(null, -1, 0);

  public boolean isUnknown() {
    return targetType == null;
  }

  @Override
  public String toString() {
    return isUnknown() ? "<unknown>" : targetType;
  }
}
