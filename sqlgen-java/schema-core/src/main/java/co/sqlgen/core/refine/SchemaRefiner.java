package co.sqlgen.core.refine;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.model.ColumnDefinition;
import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.IndexDefinition;
import co.sqlgen.core.model.RawSchemaModel;
import co.sqlgen.core.model.RefinedSchema;
import co.sqlgen.core.model.SeedData;
import co.sqlgen.core.model.SqlType;
import co.sqlgen.core.model.TableAlteration;
import co.sqlgen.core.model.TableDefinition;
import co.sqlgen.core.model.ViewDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Second pipeline phase: merges every raw model into one namespace and validates it.
 *
 * <ol>
 *   <li>Merge tables and views by (schema, name); apply alterations and standalone indexes.</li>
 *   <li>Resolve foreign keys and check seed rows against the merged tables. Skipped when
 *       the merge reported a fatal problem, since resolution needs a consistent namespace.</li>
 *   <li>Normalize indexes: drop duplicates, check their columns, and check primary-key
 *       indexes against the columns flagged as primary key.</li>
 * </ol>
 *
 * <p>Problems are collected rather than thrown so that a single run reports all of them.
 * The refiner needs every raw model at once, which makes it the synchronization point
 * between the concurrent ingestion and generation phases.
 */
public final class SchemaRefiner {

  private static final Logger log = LoggerFactory.getLogger(SchemaRefiner.class);

  public PhaseResult<RefinedSchema> refine(List<RawSchemaModel> models) {
    List<Diagnostic> diagnostics = new ArrayList<>();

    Map<String, TableDefinition> tables = new LinkedHashMap<>();
    Map<String, ViewDefinition> views = new LinkedHashMap<>();
    Map<String, List<SeedData>> seedData = new LinkedHashMap<>();
    merge(models, tables, views, seedData, diagnostics);

    boolean namespaceValid = diagnostics.stream().noneMatch(Diagnostic::isFatal);
    if (namespaceValid) {
      resolveForeignKeys(tables, diagnostics);
      validateSeedData(tables, seedData, diagnostics);
    } else {
      log.debug("Skipping foreign-key resolution: merged namespace has errors");
    }
    views.replaceAll((key, view) -> view.withColumns(declaredColumns(view)));

    tables.replaceAll((key, table) -> normalizeIndexes(table, diagnostics));

    log.debug("Refined schema: {} tables, {} views, {} diagnostics",
        tables.size(), views.size(), diagnostics.size());
    if (diagnostics.stream().anyMatch(Diagnostic::isFatal)) {
      return PhaseResult.failed(diagnostics);
    }
    return PhaseResult.of(new RefinedSchema(List.copyOf(tables.values()), List.copyOf(views.values()), seedData),
        diagnostics);
  }

  /** View query text is opaque: only a declared column list yields columns, all of unknown type. */
  private static List<ColumnDefinition> declaredColumns(ViewDefinition view) {
    List<ColumnDefinition> columns = new ArrayList<>();
    for (String name : view.declaredColumns()) {
      columns.add(new ColumnDefinition(name, SqlType.UNKNOWN, true, false, columns.size(), false, null));
    }
    return columns;
  }

  // =========================================================================
  // Step 1: merge
  // =========================================================================

  private void merge(List<RawSchemaModel> models, Map<String, TableDefinition> tables,
      Map<String, ViewDefinition> views, Map<String, List<SeedData>> seedData, List<Diagnostic> diagnostics) {
    for (RawSchemaModel model : models) {
      for (TableDefinition table : model.tables()) {
        String key = table.name().key();
        if (tables.containsKey(key) || views.containsKey(key)) {
          diagnostics.add(Diagnostic.at(DiagnosticKind.DUPLICATE_DEFINITION, table.location(),
              "Table " + table.name() + " is already declared" + declaredAt(tables, views, key)));
          continue;
        }
        tables.put(key, withUniqueColumns(table, diagnostics));
      }
      for (ViewDefinition view : model.views()) {
        String key = view.name().key();
        if (tables.containsKey(key) || views.containsKey(key)) {
          diagnostics.add(Diagnostic.at(DiagnosticKind.DUPLICATE_DEFINITION, view.location(),
              "View " + view.name() + " is already declared" + declaredAt(tables, views, key)));
          continue;
        }
        views.put(key, view);
      }
    }

    for (RawSchemaModel model : models) {
      for (TableAlteration alteration : model.alterations()) {
        TableDefinition table = tables.get(alteration.table().key());
        if (table == null) {
          diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, alteration.location(),
              "ALTER TABLE targets unknown table " + alteration.table()));
          continue;
        }
        tables.put(alteration.table().key(), applyAlteration(table, alteration, diagnostics));
      }
      for (IndexDefinition index : model.indexes()) {
        TableDefinition table = tables.get(index.table().key());
        if (table == null) {
          diagnostics.add(Diagnostic.of(DiagnosticKind.REFERENCE_ERROR,
              "Index " + index.name() + " in " + model.sourceName() + " targets unknown table " + index.table()));
          continue;
        }
        List<IndexDefinition> indexes = new ArrayList<>(table.indexes());
        indexes.add(index);
        tables.put(index.table().key(), table.withIndexes(indexes));
      }
      for (SeedData data : model.seedData()) {
        seedData.computeIfAbsent(data.table().key(), k -> new ArrayList<>()).add(data);
      }
    }
  }

  private static String declaredAt(Map<String, TableDefinition> tables, Map<String, ViewDefinition> views, String key) {
    Object location = tables.containsKey(key) ? tables.get(key).location() : views.get(key).location();
    return location == null ? "" : " at " + location;
  }

  private TableDefinition withUniqueColumns(TableDefinition table, List<Diagnostic> diagnostics) {
    Set<String> seen = new HashSet<>();
    List<ColumnDefinition> columns = new ArrayList<>();
    for (ColumnDefinition column : table.columns()) {
      if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.DUPLICATE_DEFINITION, table.location(),
            "Column " + column.name() + " is declared more than once in table " + table.name()));
        continue;
      }
      columns.add(renumber(column, columns.size()));
    }
    return table.withColumns(columns);
  }

  private TableDefinition applyAlteration(TableDefinition table, TableAlteration alteration, List<Diagnostic> diagnostics) {
    List<ColumnDefinition> columns = new ArrayList<>(table.columns());
    for (ColumnDefinition column : alteration.columns()) {
      if (table.hasColumn(column.name())) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.DUPLICATE_DEFINITION, alteration.location(),
            "Column " + column.name() + " already exists in table " + table.name()));
        continue;
      }
      columns.add(renumber(column, columns.size()));
    }

    Set<String> addedKey = alteration.indexes().stream()
        .filter(IndexDefinition::primaryKey)
        .flatMap(i -> i.columnNames().stream())
        .map(c -> c.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
    columns.replaceAll(c -> addedKey.contains(c.name().toLowerCase(Locale.ROOT)) ? c.withPrimaryKey(true) : c);

    List<IndexDefinition> indexes = new ArrayList<>(table.indexes());
    indexes.addAll(alteration.indexes());
    List<ForeignKeyReference> foreignKeys = new ArrayList<>(table.foreignKeys());
    foreignKeys.addAll(alteration.foreignKeys());
    return new TableDefinition(table.name(), columns, indexes, foreignKeys, table.location());
  }

  private static ColumnDefinition renumber(ColumnDefinition c, int ordinal) {
    if (c.ordinal() == ordinal) return c;
    return new ColumnDefinition(c.name(), c.type(), c.nullable(), c.primaryKey(), ordinal, c.identity(), c.defaultExpression());
  }

  // =========================================================================
  // Step 2: cross-references
  // =========================================================================

  private void resolveForeignKeys(Map<String, TableDefinition> tables, List<Diagnostic> diagnostics) {
    tables.replaceAll((key, table) -> {
      List<ForeignKeyReference> resolved = new ArrayList<>();
      for (ForeignKeyReference fk : table.foreignKeys()) {
        resolve(table, fk, tables, diagnostics).ifPresent(resolved::add);
      }
      return table.withForeignKeys(resolved);
    });
  }

  private Optional<ForeignKeyReference> resolve(TableDefinition owner, ForeignKeyReference fk,
      Map<String, TableDefinition> tables, List<Diagnostic> diagnostics) {
    Optional<ColumnDefinition> column = owner.column(fk.column());
    if (column.isEmpty()) {
      diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, owner.location(),
          "Foreign key " + fk.constraintName() + " uses unknown column " + fk.column() + " of " + owner.name()));
      return Optional.empty();
    }
    TableDefinition target = tables.get(fk.targetTable().key());
    if (target == null) {
      diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, owner.location(),
          "Foreign key " + fk.constraintName() + " on " + owner.name() + "." + fk.column()
              + " references unknown table " + fk.targetTable()));
      return Optional.empty();
    }

    Optional<ColumnDefinition> targetColumn;
    if (fk.targetColumn().isEmpty()) {
      List<ColumnDefinition> key = target.primaryKeyColumns();
      targetColumn = key.size() == 1 ? Optional.of(key.get(0)) : Optional.empty();
      if (targetColumn.isEmpty()) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, owner.location(),
            "Foreign key " + fk.constraintName() + " on " + owner.name() + "." + fk.column()
                + " names no column and " + target.name() + " has no single-column primary key"));
        return Optional.empty();
      }
    } else {
      targetColumn = target.column(fk.targetColumn());
      if (targetColumn.isEmpty()) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, owner.location(),
            "Foreign key " + fk.constraintName() + " on " + owner.name() + "." + fk.column()
                + " references unknown column " + target.name() + "." + fk.targetColumn()));
        return Optional.empty();
      }
    }
    return Optional.of(new ForeignKeyReference(fk.constraintName(), owner.name(), column.get().name(),
        target.name(), targetColumn.get().name()));
  }

  private void validateSeedData(Map<String, TableDefinition> tables, Map<String, List<SeedData>> seedData,
      List<Diagnostic> diagnostics) {
    for (List<SeedData> statements : seedData.values()) {
      for (SeedData data : statements) {
        TableDefinition table = tables.get(data.table().key());
        if (table == null) {
          diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, data.location(),
              "INSERT targets unknown table " + data.table()));
          continue;
        }
        if (data.columns().isEmpty()) {
          for (List<String> row : data.rows()) {
            if (row.size() != table.columns().size()) {
              diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, data.location(),
                  "Row has " + row.size() + " values but table " + table.name() + " has "
                      + table.columns().size() + " columns"));
            }
          }
        } else {
          for (String column : data.columns()) {
            if (!table.hasColumn(column)) {
              diagnostics.add(Diagnostic.at(DiagnosticKind.REFERENCE_ERROR, data.location(),
                  "INSERT names unknown column " + column + " of " + table.name()));
            }
          }
        }
      }
    }
  }

  // =========================================================================
  // Step 3: index normalization
  // =========================================================================

  private TableDefinition normalizeIndexes(TableDefinition table, List<Diagnostic> diagnostics) {
    Map<String, IndexDefinition> kept = new LinkedHashMap<>();
    for (IndexDefinition index : table.indexes()) {
      List<String> missing = index.columnNames().stream().filter(c -> !table.hasColumn(c)).toList();
      if (!missing.isEmpty()) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_INDEX, table.location(),
            "Index " + index.name() + " on " + table.name() + " references unknown columns " + missing));
        continue;
      }
      IndexDefinition first = kept.get(index.normalizedKey());
      if (first == null) {
        kept.put(index.normalizedKey(), index);
      } else {
        log.debug("Dropping index {} on {}: same columns as {}", index.name(), table.name(), first.name());
        if (index.primaryKey() && !first.primaryKey()) {
          kept.put(index.normalizedKey(), new IndexDefinition(first.name(), first.table(), first.unique(),
              first.clustered(), true, first.columnNames()));
        }
      }
    }

    Set<String> keyColumns = table.primaryKeyColumns().stream()
        .map(c -> c.name().toLowerCase(Locale.ROOT))
        .collect(Collectors.toCollection(LinkedHashSet::new));
    for (IndexDefinition index : kept.values()) {
      if (!index.primaryKey()) continue;
      Set<String> indexColumns = index.columnNames().stream()
          .map(c -> c.toLowerCase(Locale.ROOT))
          .collect(Collectors.toCollection(LinkedHashSet::new));
      if (!indexColumns.equals(keyColumns)) {
        diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_INDEX, table.location(),
            "Primary key " + index.name() + " on " + table.name() + " covers " + index.columnNames()
                + " but the columns flagged as primary key are "
                + table.primaryKeyColumns().stream().map(ColumnDefinition::name).toList()));
      }
    }
    return table.withIndexes(List.copyOf(kept.values()));
  }
}
