package co.sqlgen.generators.java.model;

import co.sqlgen.core.model.QualifiedName;

import java.util.Objects;

/**
 * One generated source file.
 *
 * @param name relative path of the file, e.g. {@code com/acme/model/Users.java}
 * @param sourceEntity the schema object the file was generated from
 */
public record GeneratedArtifact(String name, String content, QualifiedName sourceEntity) {
    public GeneratedArtifact {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sourceEntity, "sourceEntity");
    }
}
