package co.sqlgen.generators.java.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One member of a value set. {@code attributes} runs parallel to
 * {@link ValueSetSpecification#attributes()}; attribute values may be null.
 */
public record ValueSetEntry(String value, String displayName, List<String> attributes) {
    public ValueSetEntry {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(displayName, "displayName");
        attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    }
}
