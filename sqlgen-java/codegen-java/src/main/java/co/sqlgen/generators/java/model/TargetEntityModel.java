package co.sqlgen.generators.java.model;

import co.sqlgen.core.model.QualifiedName;

import java.util.List;
import java.util.Objects;

/**
 * Language-level description of one generated entity.
 *
 * @param valueSet present only for {@link EntityKind#VALUE_SET} entities
 */
public record TargetEntityModel(
    EntityKind kind,
    QualifiedName source,
    String packageName,
    String className,
    List<PropertyModel> properties,
    ValueSetSpecification valueSet
) {
    public TargetEntityModel {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(className, "className");
        properties = List.copyOf(properties);
        if ((kind == EntityKind.VALUE_SET) != (valueSet != null)) {
            throw new IllegalArgumentException("valueSet must be present exactly for VALUE_SET entities: " + source);
        }
    }

    public List<PropertyModel> primaryKey() {
        return properties.stream().filter(PropertyModel::primaryKey).toList();
    }

    /** Artifact name prefix, e.g. {@code com/acme/model/} for package {@code com.acme.model}. */
    public String packagePath() {
        return packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
    }
}
