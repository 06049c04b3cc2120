package co.sqlgen.core.model;

import co.sqlgen.core.diagnostics.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Columns and constraints added to an existing table by {@code ALTER TABLE ... ADD}.
 * The target table may be declared in another source; alterations are applied while
 * merging. Column ordinals here are relative to the alteration and are renumbered when
 * the columns are appended to the table.
 */
public record TableAlteration(
    QualifiedName table,
    List<ColumnDefinition> columns,
    List<IndexDefinition> indexes,
    List<ForeignKeyReference> foreignKeys,
    SourceLocation location
) {

  public TableAlteration {
    Objects.requireNonNull(table, "table");
    columns = List.copyOf(columns);
    indexes = List.copyOf(indexes);
    foreignKeys = List.copyOf(foreignKeys);
  }
}
