package co.sqlgen.generators.java.model;

import java.util.List;

/**
 * The closed set of values a {@link EntityKind#VALUE_SET} entity enumerates. Entry
 * order is the index order of the generated type.
 */
public record ValueSetSpecification(
    String valueColumn,
    String displayColumn,
    List<ValueSetAttribute> attributes,
    List<ValueSetEntry> entries
) {
    public ValueSetSpecification {
        attributes = List.copyOf(attributes);
        entries = List.copyOf(entries);
    }

    public int count() {
        return entries.size();
    }
}
