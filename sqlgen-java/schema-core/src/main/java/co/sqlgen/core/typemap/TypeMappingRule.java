package co.sqlgen.core.typemap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One type mapping rule. {@code sourceType} and {@code targetType} are required; the
 * schema, table and column patterns are optional and narrow the rule when present.
 * Patterns are literal names unless {@code regex} is set.
 *
 * <pre>
 * { "table": "Orders", "column": "Status", "sourceType": "INT", "targetType": "com.acme.OrderStatus" }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TypeMappingRule(
    String schema,
    String table,
    String column,
    String sourceType,
    String targetType,
    boolean regex
) {

  public static TypeMappingRule of(String sourceType, String targetType) {
    return new TypeMappingRule(null, null, null, sourceType, targetType, false);
  }

  public TypeMappingRule forSchema(String pattern) {
    return new TypeMappingRule(pattern, table, column, sourceType, targetType, regex);
  }

  public TypeMappingRule forTable(String pattern) {
    return new TypeMappingRule(schema, pattern, column, sourceType, targetType, regex);
  }

  public TypeMappingRule forColumn(String pattern) {
    return new TypeMappingRule(schema, table, pattern, sourceType, targetType, regex);
  }

  public TypeMappingRule asRegex() {
    return new TypeMappingRule(schema, table, column, sourceType, targetType, true);
  }

  /** Number of declared patterns; the source-type pattern always counts. */
  public int specificity() {
    int n = 1;
    if (isDeclared(schema)) n++;
    if (isDeclared(table)) n++;
    if (isDeclared(column)) n++;
    return n;
  }

  static boolean isDeclared(String pattern) {
    return pattern != null && !pattern.isBlank();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (isDeclared(schema)) sb.append("schema=").append(schema).append(' ');
    if (isDeclared(table)) sb.append("table=").append(table).append(' ');
    if (isDeclared(column)) sb.append("column=").append(column).append(' ');
    sb.append("sourceType=").append(sourceType).append(" -> ").append(targetType);
    if (regex) sb.append(" (regex)");
    return sb.toString();
  }
}
