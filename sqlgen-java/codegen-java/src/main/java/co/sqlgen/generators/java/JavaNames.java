package co.sqlgen.generators.java;

import javax.lang.model.SourceVersion;
import java.util.Locale;

/**
 * Turns SQL identifiers into Java identifiers.
 */
final class JavaNames {

    private JavaNames() {}

    /**
     * Convert a column name to a camelCase property name.
     * {@code UserId} becomes {@code userId}, {@code ORDER_DATE} becomes {@code orderDate},
     * {@code class} becomes {@code class_}.
     */
    static String toPropertyName(String name) {
        String result = uncap(joinParts(name));
        if (result.isEmpty()) return "column";
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        if (SourceVersion.isKeyword(result)) {
            result = result + "_";
        }
        return result;
    }

    /**
     * Convert a table or view name to a PascalCase class name.
     * {@code order_items} becomes {@code OrderItems}, {@code USERS} becomes {@code Users}.
     */
    static String toClassName(String name) {
        String result = joinParts(name);
        if (result.isEmpty()) return "Entity";
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return result;
    }

    /**
     * Convert a schema name to a package segment: lower case, keyword-escaped.
     */
    static String toPackageSegment(String schema) {
        String result = schema.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "");
        if (result.isEmpty()) return "schema";
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        if (SourceVersion.isKeyword(result)) {
            result = result + "_";
        }
        return result;
    }

    /**
     * Convert a string to UPPER_SNAKE_CASE for constant names. Characters that cannot
     * appear in an identifier become word breaks.
     */
    static String toConstantCase(String name) {
        if (name == null || name.isEmpty()) return "";
        String result = name.replaceAll("[^A-Za-z0-9]+", "_");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < result.length(); i++) {
            char c = result.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(result.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().replaceAll("^_+|_+$", "").toUpperCase(Locale.ROOT);
    }

    static String cap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    static String uncap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    /** Split on anything that is not a letter or digit and capitalize each part. */
    private static String joinParts(String name) {
        if (name == null) return "";
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("[^A-Za-z0-9]+")) {
            if (part.isEmpty()) continue;
            // all-caps parts (ID, ORDER) read as words, not acronyms
            if (part.length() > 1 && part.equals(part.toUpperCase(Locale.ROOT))) {
                part = part.toLowerCase(Locale.ROOT);
            }
            sb.append(cap(part));
        }
        return sb.toString();
    }
}
