package co.sqlgen.core.model;

import java.util.Objects;

/**
 * One column pair of a foreign-key constraint. Composite constraints are expanded into
 * one reference per column pair, sharing the constraint name.
 */
public record ForeignKeyReference(
    String constraintName,
    QualifiedName table,
    String column,
    QualifiedName targetTable,
    String targetColumn
) {

  public ForeignKeyReference {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(targetTable, "targetTable");
    Objects.requireNonNull(targetColumn, "targetColumn");
  }

  @Override
  public String toString() {
    return table + "." + column + " -> " + targetTable + "." + targetColumn;
  }
}
