package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.diagnostics.SourceLocation;
import co.sqlgen.core.model.ColumnDefinition;
import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.QualifiedName;
import co.sqlgen.core.model.RefinedSchema;
import co.sqlgen.core.model.SeedData;
import co.sqlgen.core.model.TableDefinition;
import co.sqlgen.core.model.ViewDefinition;
import co.sqlgen.core.typemap.ResolvedType;
import co.sqlgen.core.typemap.TypeMapper;
import co.sqlgen.generators.java.GeneratorConfig.ValueConfig;
import co.sqlgen.generators.java.GeneratorConfig.ValueSetConfig;
import co.sqlgen.generators.java.model.EntityKind;
import co.sqlgen.generators.java.model.PropertyModel;
import co.sqlgen.generators.java.model.TargetEntityModel;
import co.sqlgen.generators.java.model.ValueSetAttribute;
import co.sqlgen.generators.java.model.ValueSetEntry;
import co.sqlgen.generators.java.model.ValueSetSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Third pipeline phase: builds one {@link TargetEntityModel} per table and view.
 *
 * <p>Column types go through the {@link TypeMapper}; a column without a usable Java type
 * is still generated (as {@code Object}) and reported as {@code UNKNOWN_TYPE}. Tables
 * listed in {@link GeneratorConfig#valueSets()} become value-set entities whose entries
 * come from the configuration or from the table's {@code INSERT} rows.
 */
public final class ModelTransformer {

    private static final Logger log = LoggerFactory.getLogger(ModelTransformer.class);

    private static final List<String> DISPLAY_COLUMN_NAMES = List.of("DisplayName", "Name");

    private final GeneratorConfig config;
    private final TypeMapper typeMapper;

    public ModelTransformer(GeneratorConfig config, TypeMapper typeMapper) {
        this.config = config;
        this.typeMapper = typeMapper;
    }

    public PhaseResult<List<TargetEntityModel>> transform(RefinedSchema schema) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        Map<String, ValueSetConfig> valueSets = new LinkedHashMap<>();
        for (ValueSetConfig valueSet : config.valueSets()) {
            QualifiedName name = QualifiedName.parse(valueSet.table(), config.defaultSchema());
            if (schema.table(name).isEmpty()) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.INVALID_VALUE_SET,
                    "Value set table " + name + " does not exist"));
            } else if (valueSets.putIfAbsent(name.key(), valueSet) != null) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.INVALID_VALUE_SET,
                    "Value set " + name + " is configured more than once"));
            }
        }

        List<TargetEntityModel> entities = new ArrayList<>();
        for (TableDefinition table : schema.tables()) {
            ValueSetConfig valueSet = valueSets.get(table.name().key());
            List<Diagnostic> typeWarnings = new ArrayList<>();
            List<PropertyModel> properties = properties(table.name(), table.columns(), table.foreignKeys(),
                table.location(), diagnostics, typeWarnings);
            if (valueSet == null) {
                diagnostics.addAll(typeWarnings);
                entities.add(new TargetEntityModel(EntityKind.TABLE, table.name(), packageName(table.name()),
                    JavaNames.toClassName(table.name().name()), properties, null));
            } else {
                valueSet(table, schema.seedData(table.name()), valueSet, diagnostics).ifPresent(spec ->
                    entities.add(new TargetEntityModel(EntityKind.VALUE_SET, table.name(), packageName(table.name()),
                        JavaNames.toClassName(table.name().name()), properties, spec)));
            }
        }
        for (ViewDefinition view : schema.views()) {
            List<PropertyModel> properties = properties(view.name(), view.columns(), List.of(),
                view.location(), diagnostics, diagnostics);
            entities.add(new TargetEntityModel(EntityKind.VIEW, view.name(), packageName(view.name()),
                JavaNames.toClassName(view.name().name()), properties, null));
        }

        log.debug("Transformed {} entities ({} diagnostics)", entities.size(), diagnostics.size());
        if (diagnostics.stream().anyMatch(Diagnostic::isFatal)) {
            return PhaseResult.failed(diagnostics);
        }
        return PhaseResult.of(entities, diagnostics);
    }

    String packageName(QualifiedName name) {
        if (name.schema().equalsIgnoreCase(config.defaultSchema())) {
            return config.packageName();
        }
        return config.packageName() + "." + JavaNames.toPackageSegment(name.schema());
    }

    // =========================================================================
    // Properties
    // =========================================================================

    private List<PropertyModel> properties(QualifiedName owner, List<ColumnDefinition> columns,
            List<ForeignKeyReference> foreignKeys, SourceLocation location,
            List<Diagnostic> diagnostics, List<Diagnostic> typeWarnings) {
        Map<String, String> columnByProperty = new HashMap<>();
        List<PropertyModel> properties = new ArrayList<>();
        List<ColumnDefinition> ordered = columns.stream()
            .sorted(Comparator.comparingInt(ColumnDefinition::ordinal))
            .toList();
        for (ColumnDefinition column : ordered) {
            String property = JavaNames.toPropertyName(column.name());
            String previous = columnByProperty.putIfAbsent(property, column.name());
            if (previous != null) {
                diagnostics.add(Diagnostic.at(DiagnosticKind.OUTPUT_COLLISION, location,
                    "Columns " + previous + " and " + column.name() + " of " + owner
                        + " both map to property '" + property + "'"));
                continue;
            }

            ResolvedType resolved = typeMapper.resolve(owner.schema(), owner.name(), column.name(), column.type());
            if (resolved.isUnknown()) {
                typeWarnings.add(Diagnostic.at(DiagnosticKind.UNKNOWN_TYPE, location,
                    "Column " + owner + "." + column.name() + " (" + column.type() + ") has no type mapping;"
                        + " generated as Object"));
            } else if (JavaTypeNames.parse(resolved.targetType()).isEmpty()) {
                typeWarnings.add(Diagnostic.at(DiagnosticKind.UNKNOWN_TYPE, location,
                    "Column " + owner + "." + column.name() + " maps to '" + resolved.targetType()
                        + "', which is not a Java type; generated as Object"));
            }

            ForeignKeyReference foreignKey = foreignKeys.stream()
                .filter(fk -> column.hasName(fk.column()))
                .findFirst()
                .orElse(null);
            properties.add(new PropertyModel(property, column.name(), column.type(), resolved,
                column.nullable(), column.primaryKey(), foreignKey));
        }
        return properties;
    }

    // =========================================================================
    // Value sets
    // =========================================================================

    private Optional<ValueSetSpecification> valueSet(TableDefinition table, List<SeedData> seedData,
            ValueSetConfig config, List<Diagnostic> diagnostics) {
        String label = "Value set " + table.name();
        int before = diagnostics.size();

        Optional<ColumnDefinition> valueColumn = config.valueColumn() != null
            ? table.column(config.valueColumn())
            : table.primaryKeyColumns().stream().findFirst().or(() -> table.columns().stream().findFirst());
        if (valueColumn.isEmpty()) {
            diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, table.location(),
                label + ": value column " + (config.valueColumn() == null ? "" : config.valueColumn() + " ")
                    + "not found"));
            return Optional.empty();
        }
        ColumnDefinition value = valueColumn.get();

        ColumnDefinition display;
        if (config.displayColumn() != null) {
            Optional<ColumnDefinition> configured = table.column(config.displayColumn());
            if (configured.isEmpty()) {
                diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, table.location(),
                    label + ": display column " + config.displayColumn() + " not found"));
                return Optional.empty();
            }
            display = configured.get();
        } else {
            display = DISPLAY_COLUMN_NAMES.stream()
                .map(table::column)
                .flatMap(Optional::stream)
                .filter(c -> !c.hasName(value.name()))
                .findFirst()
                .orElse(value);
        }

        List<ValueSetAttribute> attributes = new ArrayList<>();
        Map<String, String> columnByAccessor = new HashMap<>();
        for (ColumnDefinition column : table.columns()) {
            if (column.hasName(value.name()) || column.hasName(display.name())) continue;
            String accessor = ValueSetNaming.attributeAccessor(JavaNames.toPropertyName(column.name()));
            String previous = columnByAccessor.putIfAbsent(accessor, column.name());
            if (previous != null) {
                diagnostics.add(Diagnostic.at(DiagnosticKind.OUTPUT_COLLISION, table.location(),
                    label + ": columns " + previous + " and " + column.name() + " both map to accessor '"
                        + accessor + "'"));
                continue;
            }
            attributes.add(new ValueSetAttribute(column.name(), accessor));
        }

        List<ValueSetEntry> entries = config.values().isEmpty()
            ? entriesFromSeedData(table, seedData, value, display, attributes, label, diagnostics)
            : entriesFromConfig(config.values(), attributes, label, table.location(), diagnostics);

        if (entries.isEmpty() && diagnostics.size() == before) {
            diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, table.location(),
                label + " has no values"));
        }
        Set<String> seen = new HashSet<>();
        for (ValueSetEntry entry : entries) {
            if (!seen.add(entry.value())) {
                diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, table.location(),
                    label + ": value '" + entry.value() + "' appears more than once"));
            }
        }
        if (diagnostics.size() > before) return Optional.empty();

        log.debug("{}: {} values, {} attributes", label, entries.size(), attributes.size());
        return Optional.of(new ValueSetSpecification(value.name(), display.name(), attributes, entries));
    }

    private static List<ValueSetEntry> entriesFromConfig(List<ValueConfig> values, List<ValueSetAttribute> attributes,
            String label, SourceLocation location, List<Diagnostic> diagnostics) {
        List<ValueSetEntry> entries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            ValueConfig config = values.get(i);
            if (config.value() == null) {
                diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, location,
                    label + ": configured value #" + i + " has no value"));
                continue;
            }
            List<String> attributeValues = new ArrayList<>();
            for (ValueSetAttribute attribute : attributes) {
                attributeValues.add(config.attributes().entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(attribute.column()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null));
            }
            String displayName = config.displayName() != null ? config.displayName() : config.value();
            entries.add(new ValueSetEntry(config.value(), displayName, attributeValues));
        }
        return entries;
    }

    private static List<ValueSetEntry> entriesFromSeedData(TableDefinition table, List<SeedData> seedData,
            ColumnDefinition value, ColumnDefinition display, List<ValueSetAttribute> attributes,
            String label, List<Diagnostic> diagnostics) {
        List<ValueSetEntry> entries = new ArrayList<>();
        int row = 0;
        for (SeedData data : seedData) {
            List<String> columns = data.columns().isEmpty()
                ? table.columns().stream().map(ColumnDefinition::name).toList()
                : data.columns();
            int valueIndex = indexOf(columns, value.name());
            int displayIndex = indexOf(columns, display.name());
            int[] attributeIndexes = attributes.stream().mapToInt(a -> indexOf(columns, a.column())).toArray();

            for (List<String> values : data.rows()) {
                row++;
                String entryValue = valueIndex < 0 ? null : values.get(valueIndex);
                if (entryValue == null) {
                    diagnostics.add(Diagnostic.at(DiagnosticKind.INVALID_VALUE_SET, data.location(),
                        label + ": row " + row + " has no " + value.name()));
                    continue;
                }
                String displayName = displayIndex < 0 ? null : values.get(displayIndex);
                List<String> attributeValues = new ArrayList<>();
                for (int index : attributeIndexes) {
                    attributeValues.add(index < 0 ? null : values.get(index));
                }
                entries.add(new ValueSetEntry(entryValue, displayName != null ? displayName : entryValue, attributeValues));
            }
        }
        return entries;
    }

    private static int indexOf(List<String> columns, String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(column)) return i;
        }
        return -1;
    }
}
