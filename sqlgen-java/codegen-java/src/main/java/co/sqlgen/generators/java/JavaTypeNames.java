package co.sqlgen.generators.java;

import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Parses the target type names produced by type mapping rules into JavaPoet types.
 *
 * <p>Accepted forms: primitives, {@code java.lang} simple names, the simple names of common
 * {@code java.math}, {@code java.time} and {@code java.util} value types, fully qualified
 * class names, and any of these followed by {@code []}.
 */
public final class JavaTypeNames {

    private static final Pattern QUALIFIED_NAME =
        Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)+");

    private static final Map<String, TypeName> SIMPLE_NAMES = Map.ofEntries(
        entry("boolean", TypeName.BOOLEAN),
        entry("byte", TypeName.BYTE),
        entry("short", TypeName.SHORT),
        entry("int", TypeName.INT),
        entry("long", TypeName.LONG),
        entry("float", TypeName.FLOAT),
        entry("double", TypeName.DOUBLE),
        entry("char", TypeName.CHAR),
        entry("Boolean", ClassName.get(Boolean.class)),
        entry("Byte", ClassName.get(Byte.class)),
        entry("Short", ClassName.get(Short.class)),
        entry("Integer", ClassName.get(Integer.class)),
        entry("Long", ClassName.get(Long.class)),
        entry("Float", ClassName.get(Float.class)),
        entry("Double", ClassName.get(Double.class)),
        entry("Character", ClassName.get(Character.class)),
        entry("String", ClassName.get(String.class)),
        entry("Object", ClassName.OBJECT),
        entry("BigDecimal", ClassName.get(BigDecimal.class)),
        entry("BigInteger", ClassName.get(BigInteger.class)),
        entry("LocalDate", ClassName.get(LocalDate.class)),
        entry("LocalDateTime", ClassName.get(LocalDateTime.class)),
        entry("LocalTime", ClassName.get(LocalTime.class)),
        entry("OffsetDateTime", ClassName.get(OffsetDateTime.class)),
        entry("OffsetTime", ClassName.get(OffsetTime.class)),
        entry("ZonedDateTime", ClassName.get(ZonedDateTime.class)),
        entry("Instant", ClassName.get(Instant.class)),
        entry("Duration", ClassName.get(Duration.class)),
        entry("UUID", ClassName.get(UUID.class))
    );

    private JavaTypeNames() {}

    /**
     * Parse {@code target}. Empty when the text does not name a Java type, for example a
     * target meant for another generator ({@code "email-string"}).
     */
    public static Optional<TypeName> parse(String target) {
        if (target == null || target.isBlank()) return Optional.empty();
        String text = target.trim();
        if (text.endsWith("[]")) {
            return parse(text.substring(0, text.length() - 2)).map(ArrayTypeName::of);
        }
        TypeName simple = SIMPLE_NAMES.get(text);
        if (simple != null) return Optional.of(simple);
        if (!QUALIFIED_NAME.matcher(text).matches()) return Optional.empty();
        try {
            return Optional.of(ClassName.bestGuess(text));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** The type a property is declared with: boxed when the column is nullable. */
    static TypeName declaredType(TypeName type, boolean nullable) {
        return nullable && type.isPrimitive() ? type.box() : type;
    }
}
