package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.generators.java.model.EntityKind;
import co.sqlgen.generators.java.model.GeneratedArtifact;
import co.sqlgen.generators.java.model.PropertyModel;
import co.sqlgen.generators.java.model.TargetEntityModel;
import com.squareup.javapoet.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Java code generator for target entity models.
 *
 * Generates, per entity:
 * - Tables and views: one immutable row class with an all-args constructor, getters,
 *   a static Builder, equals/hashCode/toString and name constants
 * - Value sets: the core value type plus index, data, chunk and Jackson adapter
 *   classes (see {@link ValueSetGenerator})
 *
 * Entities are generated concurrently. A failure in one entity becomes a
 * {@code GENERATION_ERROR} diagnostic and does not stop the others. Two entities
 * producing the same file name is an {@code OUTPUT_COLLISION}; the first file is kept.
 */
public class JavaGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaGenerator.class);

    private static final ClassName OBJECTS = ClassName.get("java.util", "Objects");
    private static final TypeName STRING_LIST = ParameterizedTypeName.get(
        ClassName.get(List.class), ClassName.get(String.class));

    /**
     * Per-property descriptor used when generating plain-Java boilerplate
     * (constructor, getters, Builder, equals/hashCode/toString).
     */
    private record PlainField(String codeName, TypeName type, PropertyModel property, boolean mapped) {}

    private record Outcome(TargetEntityModel entity, List<GeneratedArtifact> artifacts, Diagnostic failure) {}

    /**
     * Generate every entity. Artifacts come back in entity order, each entity's files in
     * a fixed order, whatever order the entities finish in.
     */
    public PhaseResult<List<GeneratedArtifact>> generate(List<TargetEntityModel> entities) {
        List<Outcome> outcomes = entities.parallelStream()
            .map(this::generateSafely)
            .toList();

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, GeneratedArtifact> byName = new LinkedHashMap<>();
        for (Outcome outcome : outcomes) {
            if (outcome.failure() != null) {
                diagnostics.add(outcome.failure());
                continue;
            }
            for (GeneratedArtifact artifact : outcome.artifacts()) {
                GeneratedArtifact first = byName.putIfAbsent(artifact.name(), artifact);
                if (first != null) {
                    diagnostics.add(Diagnostic.of(DiagnosticKind.OUTPUT_COLLISION,
                        "Both " + first.sourceEntity() + " and " + artifact.sourceEntity()
                            + " generate " + artifact.name()));
                }
            }
        }

        log.debug("Generated {} artifacts for {} entities", byName.size(), entities.size());
        if (diagnostics.stream().anyMatch(Diagnostic::isFatal)) {
            return PhaseResult.failed(diagnostics);
        }
        return PhaseResult.of(List.copyOf(byName.values()), diagnostics);
    }

    private Outcome generateSafely(TargetEntityModel entity) {
        try {
            return new Outcome(entity, generate(entity), null);
        } catch (RuntimeException e) {
            log.debug("Generation failed for {}", entity.source(), e);
            return new Outcome(entity, List.of(), Diagnostic.of(DiagnosticKind.GENERATION_ERROR,
                "Generating " + entity.source() + " failed: " + e.getMessage()));
        }
    }

    /**
     * Generate the files of a single entity.
     */
    public List<GeneratedArtifact> generate(TargetEntityModel entity) {
        return switch (entity.kind()) {
            case TABLE, VIEW -> List.of(generateRowEntity(entity));
            case VALUE_SET -> new ValueSetGenerator(entity).generate();
        };
    }

    static GeneratedArtifact artifact(TargetEntityModel entity, TypeSpec type) {
        String content = JavaFile.builder(entity.packageName(), type)
            .skipJavaLangImports(true)
            .build()
            .toString();
        return new GeneratedArtifact(entity.packagePath() + type.name + ".java", content, entity.source());
    }

    // =========================================================================
    // Row Entity Generation
    // =========================================================================

    private GeneratedArtifact generateRowEntity(TargetEntityModel entity) {
        boolean view = entity.kind() == EntityKind.VIEW;
        String className = entity.className();
        List<PlainField> fields = entity.properties().stream()
            .map(JavaGenerator::plainField)
            .toList();

        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc(view ? "Row of view {@code $L}.\n" : "Row of table {@code $L}.\n", entity.source());

        tb.addField(FieldSpec.builder(String.class, view ? "VIEW_NAME" : "TABLE_NAME",
                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("$S", entity.source().toString())
            .build());
        if (!view) {
            CodeBlock keyColumns = entity.primaryKey().stream()
                .map(p -> CodeBlock.of("$S", p.columnName()))
                .collect(CodeBlock.joining(", "));
            tb.addField(FieldSpec.builder(STRING_LIST, "PRIMARY_KEY_COLUMNS",
                    Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$T.of($L)", List.class, keyColumns)
                .build());
        }

        for (PlainField f : fields) {
            tb.addField(FieldSpec.builder(f.type, f.codeName, Modifier.PRIVATE, Modifier.FINAL)
                .addJavadoc(fieldJavadoc(f))
                .build());
        }

        addConstructor(tb, fields);
        addGetters(tb, fields);
        addBuilderClass(tb, className, fields);
        addEqualsHashCodeToString(tb, className, fields);

        return artifact(entity, tb.build());
    }

    private static PlainField plainField(PropertyModel property) {
        TypeName type = property.resolvedType().isUnknown()
            ? null
            : JavaTypeNames.parse(property.resolvedType().targetType()).orElse(null);
        boolean mapped = type != null;
        TypeName declared = mapped ? JavaTypeNames.declaredType(type, property.nullable()) : ClassName.OBJECT;
        return new PlainField(property.name(), declared, property, mapped);
    }

    private static CodeBlock fieldJavadoc(PlainField f) {
        PropertyModel p = f.property;
        CodeBlock.Builder doc = CodeBlock.builder()
            .add("Column {@code $L}", p.columnName());
        if (!p.sourceType().isUnknown()) {
            doc.add(", {@code $L}", p.sourceType().text());
        }
        doc.add(p.nullable() ? ", nullable.\n" : ", not null.\n");
        if (p.primaryKey()) {
            doc.add("Part of the primary key.\n");
        }
        if (p.foreignKey() != null) {
            doc.add("References {@code $L.$L}.\n", p.foreignKey().targetTable(), p.foreignKey().targetColumn());
        }
        if (!f.mapped) {
            doc.add("<p>No Java type is mapped for this column");
            if (!p.resolvedType().isUnknown()) {
                doc.add(" (target {@code $L})", p.resolvedType().targetType());
            }
            doc.add(".\n");
        }
        return doc.build();
    }

    // =========================================================================
    // Plain-Java Boilerplate Helpers
    // =========================================================================

    private static void addConstructor(TypeSpec.Builder tb, List<PlainField> fields) {
        MethodSpec.Builder allArgs = MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC);
        for (PlainField f : fields) {
            allArgs.addParameter(f.type, f.codeName);
        }
        for (PlainField f : fields) {
            allArgs.addStatement("this.$L = $L", f.codeName, f.codeName);
        }
        tb.addMethod(allArgs.build());
    }

    private static void addGetters(TypeSpec.Builder tb, List<PlainField> fields) {
        for (PlainField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("get" + JavaNames.cap(f.codeName))
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type)
                .addStatement("return $L", f.codeName)
                .build());
        }
    }

    /**
     * Emit a static {@code Builder} inner class and a {@code builder()} factory method.
     */
    private static void addBuilderClass(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName builderRef = ClassName.bestGuess("Builder");
        ClassName entityRef = ClassName.bestGuess(className);

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(builderRef)
            .addStatement("return new Builder()")
            .build());

        TypeSpec.Builder builderTb = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL);

        for (PlainField f : fields) {
            builderTb.addField(FieldSpec.builder(f.type, f.codeName, Modifier.PRIVATE).build());
        }

        for (PlainField f : fields) {
            builderTb.addMethod(MethodSpec.methodBuilder(f.codeName)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type, f.codeName)
                .returns(builderRef)
                .addStatement("this.$L = $L", f.codeName, f.codeName)
                .addStatement("return this")
                .build());
        }

        String argList = fields.stream().map(f -> f.codeName).collect(Collectors.joining(", "));
        builderTb.addMethod(MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(entityRef)
            .addStatement("return new $T($L)", entityRef, argList)
            .build());

        tb.addType(builderTb.build());
    }

    private static void addEqualsHashCodeToString(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName entityRef = ClassName.bestGuess(className);

        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.get(Object.class), "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", entityRef);
        if (fields.isEmpty()) {
            equalsMethod.addStatement("return true");
        } else {
            equalsMethod.addStatement("$T that = ($T) o", entityRef, entityRef);
            StringBuilder condExpr = new StringBuilder("return ");
            List<Object> condArgs = new ArrayList<>();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) condExpr.append("\n    && ");
                condExpr.append("$T.equals($L, that.$L)");
                condArgs.add(OBJECTS);
                condArgs.add(fields.get(i).codeName);
                condArgs.add(fields.get(i).codeName);
            }
            equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        }
        tb.addMethod(equalsMethod.build());

        MethodSpec.Builder hashCodeMethod = MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class);
        if (fields.isEmpty()) {
            hashCodeMethod.addStatement("return 0");
        } else {
            String hashArgs = fields.stream().map(f -> f.codeName).collect(Collectors.joining(", "));
            hashCodeMethod.addStatement("return $T.hash($L)", OBJECTS, hashArgs);
        }
        tb.addMethod(hashCodeMethod.build());

        MethodSpec.Builder toStringMethod = MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class));
        if (fields.isEmpty()) {
            toStringMethod.addStatement("return $S", className + "{}");
        } else {
            StringBuilder tsExpr = new StringBuilder("return $S");
            List<Object> tsArgs = new ArrayList<>();
            tsArgs.add(className + "{" + fields.get(0).codeName + "=");
            tsExpr.append(" + $L");
            tsArgs.add(fields.get(0).codeName);
            for (int i = 1; i < fields.size(); i++) {
                tsExpr.append(" + $S + $L");
                tsArgs.add(", " + fields.get(i).codeName + "=");
                tsArgs.add(fields.get(i).codeName);
            }
            tsExpr.append(" + $S");
            tsArgs.add("}");
            toStringMethod.addStatement(tsExpr.toString(), tsArgs.toArray());
        }
        tb.addMethod(toStringMethod.build());
    }
}
