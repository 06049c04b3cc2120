package co.sqlgen.generators.java;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Names for the members generated per value: index constants, typed constants and
 * dispatch parameters. Every name is a valid, unique Java identifier whatever the values
 * look like.
 */
public final class ValueSetNaming {

    /** Static members of the generated core type that a constant must not shadow. */
    private static final Set<String> RESERVED_CONSTANTS = Set.of("COUNT", "VALUES", "BY_VALUE", "ATTRIBUTE_NAMES");

    /** Methods of the generated core type that an attribute accessor must not clash with. */
    private static final Set<String> RESERVED_ACCESSORS = Set.of(
        "index", "value", "displayName", "attribute", "match", "equals", "hashCode", "toString",
        "compareTo", "getClass", "notify", "notifyAll", "wait", "clone", "finalize",
        "fromIndex", "parse", "tryParse", "allValues", "createValues", "createLookup");

    private ValueSetNaming() {}

    /**
     * One constant name per value, in value order. Values that sanitize to nothing become
     * {@code VALUE_<index>}; repeats and reserved names get an {@code _<index>} suffix.
     */
    public static List<String> constantNames(List<String> values) {
        List<String> names = new ArrayList<>(values.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < values.size(); i++) {
            String name = JavaNames.toConstantCase(values.get(i));
            if (name.isEmpty()) {
                name = "VALUE_" + i;
            } else if (Character.isDigit(name.charAt(0))) {
                name = "_" + name;
            }
            if (RESERVED_CONSTANTS.contains(name) || used.contains(name)) {
                name = name + "_" + i;
            }
            while (!used.add(name)) {
                name = name + "_";
            }
            names.add(name);
        }
        return names;
    }

    /**
     * Parameter names for the dispatch helper: {@code ACTIVE} becomes {@code onActive},
     * {@code IN_PROGRESS} becomes {@code onInProgress}.
     */
    public static List<String> dispatchParameterNames(List<String> constantNames) {
        List<String> names = new ArrayList<>(constantNames.size());
        Set<String> used = new HashSet<>();
        for (String constant : constantNames) {
            StringBuilder sb = new StringBuilder("on");
            for (String part : constant.split("_")) {
                if (part.isEmpty()) continue;
                sb.append(JavaNames.cap(part.toLowerCase(Locale.ROOT)));
            }
            String name = sb.toString();
            while (!used.add(name)) {
                name = name + "_";
            }
            names.add(name);
        }
        return names;
    }

    /** Accessor name for an attribute property, moved aside when it clashes with a core method. */
    public static String attributeAccessor(String propertyName) {
        return RESERVED_ACCESSORS.contains(propertyName) ? propertyName + "Attribute" : propertyName;
    }
}
