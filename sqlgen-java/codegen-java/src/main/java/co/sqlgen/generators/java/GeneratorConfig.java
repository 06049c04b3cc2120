package co.sqlgen.generators.java;

import co.sqlgen.core.typemap.TypeMappingRule;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generator settings, usually read from a JSON file passed with {@code --config}.
 *
 * <pre>
 * {
 *   "packageName": "com.acme.model",
 *   "defaultSchema": "dbo",
 *   "useDefaultTypeRules": true,
 *   "typeRules": [ { "column": "Email", "sourceType": "NVARCHAR", "targetType": "String" } ],
 *   "valueSets": [ { "table": "dbo.OrderStatus", "valueColumn": "Code", "displayColumn": "Label" } ]
 * }
 * </pre>
 *
 * Every property is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorConfig(
    String packageName,
    String defaultSchema,
    boolean useDefaultTypeRules,
    List<TypeMappingRule> typeRules,
    List<ValueSetConfig> valueSets
) {
    public static final String DEFAULT_PACKAGE = "generated";
    public static final String DEFAULT_SCHEMA = "dbo";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public GeneratorConfig {
        packageName = packageName == null || packageName.isBlank() ? DEFAULT_PACKAGE : packageName.trim();
        defaultSchema = defaultSchema == null || defaultSchema.isBlank() ? DEFAULT_SCHEMA : defaultSchema.trim();
        typeRules = typeRules == null ? List.of() : List.copyOf(typeRules);
        valueSets = valueSets == null ? List.of() : List.copyOf(valueSets);
    }

    @JsonCreator
    public static GeneratorConfig fromJson(
        @JsonProperty("packageName") String packageName,
        @JsonProperty("defaultSchema") String defaultSchema,
        @JsonProperty("useDefaultTypeRules") Boolean useDefaultTypeRules,
        @JsonProperty("typeRules") List<TypeMappingRule> typeRules,
        @JsonProperty("valueSets") List<ValueSetConfig> valueSets
    ) {
        return new GeneratorConfig(packageName, defaultSchema,
            useDefaultTypeRules == null || useDefaultTypeRules, typeRules, valueSets);
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, true, null, null);
    }

    public static GeneratorConfig load(Path path) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(path), GeneratorConfig.class);
    }

    public GeneratorConfig withPackageName(String newPackageName) {
        return new GeneratorConfig(newPackageName, defaultSchema, useDefaultTypeRules, typeRules, valueSets);
    }

    public GeneratorConfig withValueSets(List<ValueSetConfig> newValueSets) {
        return new GeneratorConfig(packageName, defaultSchema, useDefaultTypeRules, typeRules, newValueSets);
    }

    public GeneratorConfig withoutDefaultTypeRules() {
        return new GeneratorConfig(packageName, defaultSchema, false, typeRules, valueSets);
    }

    /**
     * A table to generate as a value set. Without inline {@code values} the entries come
     * from the table's {@code INSERT} rows.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueSetConfig(
        String table,
        String valueColumn,
        String displayColumn,
        List<ValueConfig> values
    ) {
        @JsonCreator
        public ValueSetConfig(
            @JsonProperty("table") String table,
            @JsonProperty("valueColumn") String valueColumn,
            @JsonProperty("displayColumn") String displayColumn,
            @JsonProperty("values") List<ValueConfig> values
        ) {
            if (table == null || table.isBlank()) {
                throw new IllegalArgumentException("valueSets[].table is required");
            }
            this.table = table.trim();
            this.valueColumn = valueColumn;
            this.displayColumn = displayColumn;
            this.values = values == null ? List.of() : List.copyOf(values);
        }

        public static ValueSetConfig forTable(String table) {
            return new ValueSetConfig(table, null, null, null);
        }
    }

    /**
     * An inline value-set entry. Attribute keys are column names.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueConfig(
        String value,
        String displayName,
        Map<String, String> attributes
    ) {
        @JsonCreator
        public ValueConfig(
            @JsonProperty("value") String value,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("attributes") Map<String, String> attributes
        ) {
            this.value = value;
            this.displayName = displayName;
            this.attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }
}
