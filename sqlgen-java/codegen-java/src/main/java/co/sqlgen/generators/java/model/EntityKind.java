package co.sqlgen.generators.java.model;

/**
 * What a {@link TargetEntityModel} was built from and therefore how it is generated.
 */
public enum EntityKind {
    /** A table: one row-shaped class. */
    TABLE,
    /** A view: one row-shaped class without key metadata. */
    VIEW,
    /** A table whose rows are a closed set of named values. */
    VALUE_SET
}
