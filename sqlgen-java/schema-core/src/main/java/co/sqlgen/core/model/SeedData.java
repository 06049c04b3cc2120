package co.sqlgen.core.model;

import co.sqlgen.core.diagnostics.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Literal rows from an {@code INSERT INTO ... VALUES} statement. An empty
 * {@code columns} list means the statement relied on the table's column order.
 * Row values are literal text; SQL {@code NULL} is kept as {@code null}.
 */
public record SeedData(
    QualifiedName table,
    List<String> columns,
    List<List<String>> rows,
    SourceLocation location
) {

  public SeedData {
    Objects.requireNonNull(table, "table");
    columns = List.copyOf(columns);
    rows = rows.stream()
        .map(row -> Collections.unmodifiableList(new ArrayList<>(row)))
        .toList();
  }
}
