package co.sqlgen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Unvalidated structure extracted from a single schema source.
 * {@code indexes} holds standalone {@code CREATE INDEX} statements only.
 */
public record RawSchemaModel(
    String sourceName,
    List<TableDefinition> tables,
    List<ViewDefinition> views,
    List<IndexDefinition> indexes,
    List<TableAlteration> alterations,
    List<SeedData> seedData
) {

  public RawSchemaModel {
    Objects.requireNonNull(sourceName, "sourceName");
    tables = List.copyOf(tables);
    views = List.copyOf(views);
    indexes = List.copyOf(indexes);
    alterations = List.copyOf(alterations);
    seedData = List.copyOf(seedData);
  }
}
