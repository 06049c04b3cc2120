package co.sqlgen.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An index or key constraint. Primary-key and unique constraints declared inside a
 * table body are represented as indexes too, with {@code primaryKey} set for the former.
 */
public record IndexDefinition(
    String name,
    QualifiedName table,
    boolean unique,
    boolean clustered,
    boolean primaryKey,
    List<String> columnNames
) {

  public IndexDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(table, "table");
    columnNames = List.copyOf(columnNames);
    if (columnNames.isEmpty()) {
      throw new IllegalArgumentException("index " + name + " must reference at least one column");
    }
  }

  /**
   * Identity used for de-duplication: two declarations with the same table, uniqueness
   * and column sequence describe the same index whatever they are called.
   */
  public String normalizedKey() {
    return table.key() + "|" + unique + "|"
        + String.join(",", columnNames).toLowerCase(Locale.ROOT);
  }
}
