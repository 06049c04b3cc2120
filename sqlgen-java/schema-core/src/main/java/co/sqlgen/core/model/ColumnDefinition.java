package co.sqlgen.core.model;

import java.util.Objects;

/**
 * A column declared in a {@code CREATE TABLE} statement.
 *
 * @param ordinal zero-based position within the owning table
 * @param defaultExpression declared default, carried as source text (null when absent)
 */
public record ColumnDefinition(
    String name,
    SqlType type,
    boolean nullable,
    boolean primaryKey,
    int ordinal,
    boolean identity,
    String defaultExpression
) {

  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (ordinal < 0) throw new IllegalArgumentException("ordinal must be >= 0: " + ordinal);
  }

  public ColumnDefinition withPrimaryKey(boolean flag) {
    return new ColumnDefinition(name, type, nullable && !flag, flag, ordinal, identity, defaultExpression);
  }

  public boolean hasName(String other) {
    return name.equalsIgnoreCase(other);
  }
}
