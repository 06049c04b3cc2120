package co.sqlgen.core.model;

import co.sqlgen.core.diagnostics.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A table: ordered columns plus the indexes and foreign keys attached to it.
 * {@code location} points at the {@code CREATE TABLE} statement.
 */
public record TableDefinition(
    QualifiedName name,
    List<ColumnDefinition> columns,
    List<IndexDefinition> indexes,
    List<ForeignKeyReference> foreignKeys,
    SourceLocation location
) {

  public TableDefinition {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    indexes = List.copyOf(indexes);
    foreignKeys = List.copyOf(foreignKeys);
  }

  public Optional<ColumnDefinition> column(String columnName) {
    return columns.stream().filter(c -> c.hasName(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return column(columnName).isPresent();
  }

  /** Columns flagged as primary key, in ordinal order. */
  public List<ColumnDefinition> primaryKeyColumns() {
    return columns.stream().filter(ColumnDefinition::primaryKey).toList();
  }

  public TableDefinition withColumns(List<ColumnDefinition> newColumns) {
    return new TableDefinition(name, newColumns, indexes, foreignKeys, location);
  }

  public TableDefinition withIndexes(List<IndexDefinition> newIndexes) {
    return new TableDefinition(name, columns, newIndexes, foreignKeys, location);
  }

  public TableDefinition withForeignKeys(List<ForeignKeyReference> newForeignKeys) {
    return new TableDefinition(name, columns, indexes, newForeignKeys, location);
  }
}
