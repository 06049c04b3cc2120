package co.sqlgen.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A schema-qualified object name. SQL identifiers are case-insensitive, so equality
 * and hashing go through {@link #key()} while the declared spelling is preserved.
 */
public record QualifiedName(String schema, String name) {

  public QualifiedName {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(name, "name");
  }

  public static QualifiedName of(String schema, String name) {
    return new QualifiedName(schema, name);
  }

  /**
   * Parse {@code schema.name} or a bare {@code name} (which takes {@code defaultSchema}).
   */
  public static QualifiedName parse(String text, String defaultSchema) {
    int dot = text.lastIndexOf('.');
    if (dot < 0) return new QualifiedName(defaultSchema, text.trim());
    return new QualifiedName(text.substring(0, dot).trim(), text.substring(dot + 1).trim());
  }

  public String key() {
    return (schema + "." + name).toLowerCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QualifiedName that)) return false;
    return key().equals(that.key());
  }

  @Override
  public int hashCode() {
    return key().hashCode();
  }

  @Override
  public String toString() {
    return schema + "." + name;
  }
}
