package co.sqlgen.generators.java.model;

import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.SqlType;
import co.sqlgen.core.typemap.ResolvedType;

import java.util.Objects;

/**
 * One column of an entity, already named for Java.
 *
 * @param foreignKey the reference this column takes part in, or null
 */
public record PropertyModel(
    String name,
    String columnName,
    SqlType sourceType,
    ResolvedType resolvedType,
    boolean nullable,
    boolean primaryKey,
    ForeignKeyReference foreignKey
) {
    public PropertyModel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(sourceType, "sourceType");
        Objects.requireNonNull(resolvedType, "resolvedType");
    }
}
