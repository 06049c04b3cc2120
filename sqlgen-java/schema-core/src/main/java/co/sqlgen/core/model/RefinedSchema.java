package co.sqlgen.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merged, cross-referenced and validated schema. Tables and views keep declaration
 * order (source order, then statement order). Seed rows are keyed by table key.
 */
public record RefinedSchema(
    List<TableDefinition> tables,
    List<ViewDefinition> views,
    Map<String, List<SeedData>> seedData
) {

  public RefinedSchema {
    tables = List.copyOf(tables);
    views = List.copyOf(views);
    seedData = Map.copyOf(seedData);
  }

  public Optional<TableDefinition> table(QualifiedName name) {
    return tables.stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public List<SeedData> seedData(QualifiedName table) {
    return seedData.getOrDefault(table.key(), List.of());
  }
}
