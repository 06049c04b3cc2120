package co.sqlgen.generators.java;

import co.sqlgen.generators.java.model.GeneratedArtifact;
import co.sqlgen.generators.java.model.TargetEntityModel;
import co.sqlgen.generators.java.model.ValueSetAttribute;
import co.sqlgen.generators.java.model.ValueSetEntry;
import co.sqlgen.generators.java.model.ValueSetSpecification;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.squareup.javapoet.*;

import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Emits the classes of one value-set entity.
 *
 * <p>Values live in string arrays split over chunk classes of at most {@link #CHUNK_SIZE}
 * entries, so no generated class initializer grows with the size of the set. Instances
 * carry only their index. Files, in order:
 * <ul>
 *   <li>{@code <Name>}: the value type and its operations</li>
 *   <li>{@code <Name>Indexes}: one {@code int} constant per value, for {@code switch} statements;
 *       sets larger than one chunk get {@code <Name>Indexes0}, {@code <Name>Indexes1}, ... instead</li>
 *   <li>{@code <Name>Data}: index arithmetic over the chunks</li>
 *   <li>{@code <Name>Data0}, {@code <Name>Data1}, ...: the values, display names and attributes</li>
 *   <li>{@code <Name>Json}: Jackson serializer, deserializer and module</li>
 * </ul>
 */
final class ValueSetGenerator {

    /** Largest set that still gets typed constants and a {@code match} helper. */
    static final int DISPATCH_THRESHOLD = 25;

    /** Entries per data chunk class. */
    static final int CHUNK_SIZE = 256;

    private static final TypeName STRING = ClassName.get(String.class);
    private static final ArrayTypeName STRING_ARRAY = ArrayTypeName.of(String.class);
    private static final ArrayTypeName STRING_ARRAY_2 = ArrayTypeName.of(STRING_ARRAY);
    private static final ArrayTypeName STRING_ARRAY_3 = ArrayTypeName.of(STRING_ARRAY_2);

    private final TargetEntityModel entity;
    private final ValueSetSpecification valueSet;
    private final ClassName self;
    private final ClassName indexes;
    private final ClassName data;
    private final List<String> constants;

    ValueSetGenerator(TargetEntityModel entity) {
        this.entity = entity;
        this.valueSet = entity.valueSet();
        this.self = ClassName.get(entity.packageName(), entity.className());
        this.indexes = ClassName.get(entity.packageName(), entity.className() + "Indexes");
        this.data = ClassName.get(entity.packageName(), entity.className() + "Data");
        this.constants = ValueSetNaming.constantNames(
            valueSet.entries().stream().map(ValueSetEntry::value).toList());
    }

    List<GeneratedArtifact> generate() {
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        artifacts.add(JavaGenerator.artifact(entity, coreType()));
        if (chunkCount() <= 1) {
            artifacts.add(JavaGenerator.artifact(entity, indexesType(indexes, 0, valueSet.count())));
        } else {
            for (int chunk = 0; chunk < chunkCount(); chunk++) {
                artifacts.add(JavaGenerator.artifact(entity, indexesType(indexesChunk(chunk),
                    chunk * CHUNK_SIZE, chunkEnd(chunk))));
            }
        }
        artifacts.add(JavaGenerator.artifact(entity, dataType()));
        for (int chunk = 0; chunk < chunkCount(); chunk++) {
            artifacts.add(JavaGenerator.artifact(entity, chunkType(chunk)));
        }
        artifacts.add(JavaGenerator.artifact(entity, jsonType()));
        return artifacts;
    }

    private boolean hasDispatch() {
        return valueSet.count() <= DISPATCH_THRESHOLD;
    }

    private boolean hasAttributes() {
        return !valueSet.attributes().isEmpty();
    }

    private int chunkCount() {
        return (valueSet.count() + CHUNK_SIZE - 1) / CHUNK_SIZE;
    }

    private int chunkEnd(int k) {
        return Math.min(valueSet.count(), (k + 1) * CHUNK_SIZE);
    }

    private ClassName chunk(int k) {
        return ClassName.get(entity.packageName(), entity.className() + "Data" + k);
    }

    private ClassName indexesChunk(int k) {
        return ClassName.get(entity.packageName(), entity.className() + "Indexes" + k);
    }

    // =========================================================================
    // Core Type
    // =========================================================================

    private TypeSpec coreType() {
        TypeSpec.Builder tb = TypeSpec.classBuilder(self)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addSuperinterface(ParameterizedTypeName.get(ClassName.get(Comparable.class), self))
            .addJavadoc("Values of table {@code $L}.\n", entity.source());
        if (chunkCount() > 1) {
            tb.addJavadoc("<p>Switch on {@link #index()} against the constants of {@link $T} and the "
                + "following {@code $LIndexes<k>} classes.\n", indexesChunk(0), entity.className());
        } else if (!hasDispatch()) {
            tb.addJavadoc("<p>Switch on {@link #index()} against the constants of {@link $T}.\n", indexes);
        }

        tb.addField(FieldSpec.builder(int.class, "COUNT", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("$L", valueSet.count())
            .build());
        tb.addField(FieldSpec.builder(ArrayTypeName.of(self), "VALUES", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
            .initializer("createValues()")
            .build());
        TypeName lookupType = ParameterizedTypeName.get(ClassName.get(Map.class), STRING, ClassName.get(Integer.class));
        tb.addField(FieldSpec.builder(lookupType, "BY_VALUE", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
            .initializer("createLookup()")
            .build());

        if (hasDispatch()) {
            for (int i = 0; i < constants.size(); i++) {
                tb.addField(FieldSpec.builder(self, constants.get(i), Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                    .initializer("VALUES[$T.$L]", indexes, constants.get(i))
                    .build());
            }
        }

        tb.addField(int.class, "index", Modifier.PRIVATE, Modifier.FINAL);

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .addParameter(int.class, "index")
            .addStatement("this.index = index")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("createValues")
            .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
            .returns(ArrayTypeName.of(self))
            .addStatement("$T[] values = new $T[COUNT]", self, self)
            .beginControlFlow("for (int i = 0; i < COUNT; i++)")
            .addStatement("values[i] = new $T(i)", self)
            .endControlFlow()
            .addStatement("return values")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("createLookup")
            .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
            .returns(lookupType)
            .addStatement("$T<$T, $T> lookup = new $T<>(COUNT * 2)", Map.class, String.class, Integer.class, HashMap.class)
            .beginControlFlow("for (int i = 0; i < COUNT; i++)")
            .addStatement("lookup.put($T.value(i), i)", data)
            .endControlFlow()
            .addStatement("return $T.unmodifiableMap(lookup)", Collections.class)
            .build());

        addAccessors(tb);
        addFactories(tb);
        if (hasDispatch()) {
            tb.addMethod(matchMethod());
        }
        addIdentity(tb);
        return tb.build();
    }

    private void addAccessors(TypeSpec.Builder tb) {
        tb.addMethod(MethodSpec.methodBuilder("index")
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addStatement("return index")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("value")
            .addJavadoc("Column {@code $L}.\n", valueSet.valueColumn())
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $T.value(index)", data)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("displayName")
            .addJavadoc("Column {@code $L}.\n", valueSet.displayColumn())
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $T.displayName(index)", data)
            .build());

        List<ValueSetAttribute> attributes = valueSet.attributes();
        for (int k = 0; k < attributes.size(); k++) {
            tb.addMethod(MethodSpec.methodBuilder(attributes.get(k).accessor())
                .addJavadoc("Column {@code $L}; null when the row has no value.\n", attributes.get(k).column())
                .addModifiers(Modifier.PUBLIC)
                .returns(String.class)
                .addStatement("return $T.attribute(index, $L)", data, k)
                .build());
        }

        MethodSpec.Builder byName = MethodSpec.methodBuilder("attribute")
            .addJavadoc("Attribute by column name, ignoring case.\n")
            .addJavadoc("\n@throws IllegalArgumentException if the set has no such attribute\n")
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addParameter(String.class, "name");
        if (hasAttributes()) {
            byName.beginControlFlow("for (int k = 0; k < $T.ATTRIBUTE_NAMES.length; k++)", data)
                .beginControlFlow("if ($T.ATTRIBUTE_NAMES[k].equalsIgnoreCase(name))", data)
                .addStatement("return $T.attribute(index, k)", data)
                .endControlFlow()
                .endControlFlow();
        }
        byName.addStatement("throw new $T($S + name)", IllegalArgumentException.class,
            entity.className() + " has no attribute ");
        tb.addMethod(byName.build());
    }

    private void addFactories(TypeSpec.Builder tb) {
        tb.addMethod(MethodSpec.methodBuilder("fromIndex")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(self)
            .addParameter(int.class, "index")
            .beginControlFlow("if (index < 0 || index >= COUNT)")
            .addStatement("throw new $T($S + index)", IndexOutOfBoundsException.class,
                "No " + entity.className() + " at index ")
            .endControlFlow()
            .addStatement("return VALUES[index]")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("parse")
            .addJavadoc("@throws IllegalArgumentException if {@code value} is not in the set\n")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(self)
            .addParameter(String.class, "value")
            .addStatement("return tryParse(value).orElseThrow(() -> new $T($S + value))",
                IllegalArgumentException.class, "Unknown " + entity.className() + " value: ")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("tryParse")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(ParameterizedTypeName.get(ClassName.get(Optional.class), self))
            .addParameter(String.class, "value")
            .addStatement("$T index = value == null ? null : BY_VALUE.get(value)", Integer.class)
            .addStatement("return index == null ? $T.empty() : $T.of(VALUES[index])", Optional.class, Optional.class)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("allValues")
            .addJavadoc("All values in index order.\n")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(ParameterizedTypeName.get(ClassName.get(List.class), self))
            .addStatement("return $T.of(VALUES)", List.class)
            .build());
    }

    private MethodSpec matchMethod() {
        TypeVariableName r = TypeVariableName.get("R");
        List<String> parameters = ValueSetNaming.dispatchParameterNames(constants);
        MethodSpec.Builder match = MethodSpec.methodBuilder("match")
            .addJavadoc("Result of the supplier that belongs to this value.\n")
            .addModifiers(Modifier.PUBLIC)
            .addTypeVariable(r)
            .returns(r);
        for (String parameter : parameters) {
            match.addParameter(ParameterizedTypeName.get(ClassName.get(Supplier.class), WildcardTypeName.subtypeOf(r)),
                parameter);
        }
        match.beginControlFlow("switch (index)");
        for (int i = 0; i < constants.size(); i++) {
            match.addStatement("case $T.$L: return $L.get()", indexes, constants.get(i), parameters.get(i));
        }
        match.addStatement("default: throw new $T($S + index)", IllegalStateException.class,
            "Unexpected " + entity.className() + " index ");
        match.endControlFlow();
        return match.build();
    }

    private void addIdentity(TypeSpec.Builder tb) {
        tb.addMethod(MethodSpec.methodBuilder("compareTo")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addParameter(self, "other")
            .addStatement("return $T.compare(index, other.index)", Integer.class)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(Object.class, "o")
            .addStatement("if (this == o) return true")
            .addStatement("if (!(o instanceof $T)) return false", self)
            .addStatement("return index == (($T) o).index", self)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addStatement("return $T.hashCode(index)", Integer.class)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return value()")
            .build());
    }

    // =========================================================================
    // Indexes and Data
    // =========================================================================

    /** Constants for the indexes in {@code [from, to)}. */
    private TypeSpec indexesType(ClassName name, int from, int to) {
        TypeSpec.Builder tb = TypeSpec.classBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Index of each {@link $T} value.\n", self);
        for (int i = from; i < to; i++) {
            tb.addField(FieldSpec.builder(int.class, constants.get(i), Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$L", i)
                .build());
        }
        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());
        return tb.build();
    }

    private TypeSpec dataType() {
        TypeSpec.Builder tb = TypeSpec.classBuilder(data)
            .addModifiers(Modifier.FINAL);

        tb.addField(FieldSpec.builder(int.class, "CHUNK_SIZE", Modifier.STATIC, Modifier.FINAL)
            .initializer("$L", CHUNK_SIZE)
            .build());
        tb.addField(FieldSpec.builder(STRING_ARRAY, "ATTRIBUTE_NAMES", Modifier.STATIC, Modifier.FINAL)
            .initializer(arrayInitializer(valueSet.attributes().stream()
                .map(a -> CodeBlock.of("$S", a.column()))
                .toList()))
            .build());
        tb.addField(FieldSpec.builder(STRING_ARRAY_2, "VALUE_CHUNKS", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
            .initializer(chunkReferences("VALUES"))
            .build());
        tb.addField(FieldSpec.builder(STRING_ARRAY_2, "DISPLAY_CHUNKS", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
            .initializer(chunkReferences("DISPLAY_NAMES"))
            .build());
        if (hasAttributes()) {
            tb.addField(FieldSpec.builder(STRING_ARRAY_3, "ATTRIBUTE_CHUNKS", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                .initializer(chunkReferences("ATTRIBUTES"))
                .build());
        }

        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());
        tb.addMethod(MethodSpec.methodBuilder("value")
            .addModifiers(Modifier.STATIC)
            .returns(String.class)
            .addParameter(int.class, "index")
            .addStatement("return VALUE_CHUNKS[index / CHUNK_SIZE][index % CHUNK_SIZE]")
            .build());
        tb.addMethod(MethodSpec.methodBuilder("displayName")
            .addModifiers(Modifier.STATIC)
            .returns(String.class)
            .addParameter(int.class, "index")
            .addStatement("return DISPLAY_CHUNKS[index / CHUNK_SIZE][index % CHUNK_SIZE]")
            .build());
        if (hasAttributes()) {
            tb.addMethod(MethodSpec.methodBuilder("attribute")
                .addModifiers(Modifier.STATIC)
                .returns(String.class)
                .addParameter(int.class, "index")
                .addParameter(int.class, "attribute")
                .addStatement("return ATTRIBUTE_CHUNKS[index / CHUNK_SIZE][index % CHUNK_SIZE][attribute]")
                .build());
        }
        return tb.build();
    }

    private TypeSpec chunkType(int k) {
        List<ValueSetEntry> entries = valueSet.entries().subList(k * CHUNK_SIZE, chunkEnd(k));

        TypeSpec.Builder tb = TypeSpec.classBuilder(chunk(k))
            .addModifiers(Modifier.FINAL);
        tb.addField(FieldSpec.builder(STRING_ARRAY, "VALUES", Modifier.STATIC, Modifier.FINAL)
            .initializer(arrayInitializer(entries.stream().map(e -> CodeBlock.of("$S", e.value())).toList()))
            .build());
        tb.addField(FieldSpec.builder(STRING_ARRAY, "DISPLAY_NAMES", Modifier.STATIC, Modifier.FINAL)
            .initializer(arrayInitializer(entries.stream().map(e -> CodeBlock.of("$S", e.displayName())).toList()))
            .build());
        if (hasAttributes()) {
            tb.addField(FieldSpec.builder(STRING_ARRAY_2, "ATTRIBUTES", Modifier.STATIC, Modifier.FINAL)
                .initializer(arrayInitializer(entries.stream()
                    .map(e -> e.attributes().stream()
                        .map(a -> CodeBlock.of("$S", a))
                        .collect(CodeBlock.joining(", ", "{", "}")))
                    .toList()))
                .build());
        }
        tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());
        return tb.build();
    }

    private CodeBlock chunkReferences(String field) {
        List<CodeBlock> references = new ArrayList<>();
        for (int k = 0; k < chunkCount(); k++) {
            references.add(CodeBlock.of("$T.$L", chunk(k), field));
        }
        return arrayInitializer(references);
    }

    /** One element per line. */
    private static CodeBlock arrayInitializer(List<CodeBlock> elements) {
        if (elements.isEmpty()) return CodeBlock.of("{}");
        return CodeBlock.builder()
            .add("{\n$>")
            .add(CodeBlock.join(elements, ",\n"))
            .add("\n$<}")
            .build();
    }

    // =========================================================================
    // Jackson Adapters
    // =========================================================================

    private TypeSpec jsonType() {
        ClassName json = ClassName.get(entity.packageName(), entity.className() + "Json");
        ClassName serializer = json.nestedClass("Serializer");
        ClassName deserializer = json.nestedClass("Deserializer");

        TypeSpec serializerType = TypeSpec.classBuilder(serializer)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .superclass(ParameterizedTypeName.get(ClassName.get(StdSerializer.class), self))
            .addMethod(MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .addStatement("super($T.class)", self)
                .build())
            .addMethod(MethodSpec.methodBuilder("serialize")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(self, "value")
                .addParameter(JsonGenerator.class, "gen")
                .addParameter(SerializerProvider.class, "provider")
                .addException(IOException.class)
                .addStatement("gen.writeString(value.value())")
                .build())
            .build();

        TypeSpec deserializerType = TypeSpec.classBuilder(deserializer)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .superclass(ParameterizedTypeName.get(ClassName.get(StdDeserializer.class), self))
            .addMethod(MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PUBLIC)
                .addStatement("super($T.class)", self)
                .build())
            .addMethod(MethodSpec.methodBuilder("deserialize")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(self)
                .addParameter(JsonParser.class, "p")
                .addParameter(DeserializationContext.class, "ctxt")
                .addException(IOException.class)
                .addStatement("$T text = p.getValueAsString()", String.class)
                .addStatement("return $T.tryParse(text).orElseThrow(() -> $T.from(p, $S + text, text, $T.class))",
                    self, InvalidFormatException.class, "Unknown " + entity.className() + " value: ", self)
                .build())
            .build();

        return TypeSpec.classBuilder(json)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Jackson support for {@link $T}: values are written and read as their string value.\n", self)
            .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
            .addMethod(MethodSpec.methodBuilder("module")
                .addJavadoc("Module registering both adapters.\n")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(SimpleModule.class)
                .addStatement("$T module = new $T($S)", SimpleModule.class, SimpleModule.class, entity.className())
                .addStatement("module.addSerializer($T.class, new $T())", self, serializer)
                .addStatement("module.addDeserializer($T.class, new $T())", self, deserializer)
                .addStatement("return module")
                .build())
            .addType(serializerType)
            .addType(deserializerType)
            .build();
    }
}
