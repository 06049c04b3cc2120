package co.sqlgen.core.model;

import co.sqlgen.core.diagnostics.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A view. The query text is carried through untouched. {@code declaredColumns} holds the
 * names listed in {@code CREATE VIEW v (a, b) AS ...}; {@code columns} is empty in raw
 * models and filled by the refiner from the declared names, with unknown types.
 */
public record ViewDefinition(
    QualifiedName name,
    List<String> declaredColumns,
    String queryText,
    SourceLocation location,
    List<ColumnDefinition> columns
) {

  public ViewDefinition {
    Objects.requireNonNull(name, "name");
    declaredColumns = List.copyOf(declaredColumns);
    Objects.requireNonNull(queryText, "queryText");
    columns = List.copyOf(columns);
  }

  public ViewDefinition(QualifiedName name, List<String> declaredColumns, String queryText, SourceLocation location) {
    this(name, declaredColumns, queryText, location, List.of());
  }

  public ViewDefinition withColumns(List<ColumnDefinition> newColumns) {
    return new ViewDefinition(name, declaredColumns, queryText, location, newColumns);
  }
}
