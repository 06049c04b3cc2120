package co.sqlgen.core.model;

import java.util.Objects;

/**
 * One unit of schema text, identified by a name (usually the file path).
 */
public record SchemaSource(String name, String text) {

  public SchemaSource {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(text, "text");
  }
}
