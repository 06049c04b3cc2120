package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.QualifiedName;
import co.sqlgen.core.model.SqlType;
import co.sqlgen.core.typemap.ResolvedType;
import co.sqlgen.generators.java.model.EntityKind;
import co.sqlgen.generators.java.model.GeneratedArtifact;
import co.sqlgen.generators.java.model.PropertyModel;
import co.sqlgen.generators.java.model.TargetEntityModel;
import co.sqlgen.generators.java.model.ValueSetAttribute;
import co.sqlgen.generators.java.model.ValueSetEntry;
import co.sqlgen.generators.java.model.ValueSetSpecification;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

public class JavaGeneratorTest {

  private static final String PACKAGE = "com.acme.model";

  private final JavaGenerator generator = new JavaGenerator();

  private static PropertyModel property(String name, String column, String sqlType, String target,
      boolean nullable, boolean primaryKey) {
    ResolvedType resolved = target == null ? ResolvedType.UNKNOWN : new ResolvedType(target, 0, 1);
    return new PropertyModel(name, column, SqlType.parse(sqlType), resolved, nullable, primaryKey, null);
  }

  private static TargetEntityModel users() {
    return new TargetEntityModel(EntityKind.TABLE, QualifiedName.of("dbo", "Users"), PACKAGE, "Users", List.of(
        property("id", "Id", "INT", "int", false, true),
        property("email", "Email", "NVARCHAR(255)", "String", true, false),
        property("loginCount", "LoginCount", "INT", "int", true, false),
        property("location", "Location", "GEOGRAPHY", null, true, false)), null);
  }

  private static TargetEntityModel valueSet(String name, int count) {
    List<ValueSetEntry> entries = IntStream.range(0, count)
        .mapToObj(i -> new ValueSetEntry("V" + i, "Value " + i, List.of()))
        .toList();
    return new TargetEntityModel(EntityKind.VALUE_SET, QualifiedName.of("dbo", name), PACKAGE, name, List.of(),
        new ValueSetSpecification("Code", "Code", List.of(), entries));
  }

  private static String content(List<GeneratedArtifact> artifacts, String name) {
    return artifacts.stream()
        .filter(a -> a.name().equals("com/acme/model/" + name + ".java"))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no artifact " + name))
        .content();
  }

  private static int occurrences(String text, String fragment) {
    int count = 0;
    for (int i = text.indexOf(fragment); i >= 0; i = text.indexOf(fragment, i + fragment.length())) {
      count++;
    }
    return count;
  }

  @Test
  void shouldGenerateRowEntity() {
    List<GeneratedArtifact> artifacts = generator.generate(users());

    assertThat(artifacts).extracting(GeneratedArtifact::name).containsExactly("com/acme/model/Users.java");
    String code = artifacts.get(0).content();
    assertThat(code).contains("package com.acme.model;");
    assertThat(code).contains("public final class Users {");
    assertThat(code).contains("public static final String TABLE_NAME = \"dbo.Users\";");
    assertThat(code).contains("public static final List<String> PRIMARY_KEY_COLUMNS = List.of(\"Id\");");
    assertThat(code).contains("private final int id;");
    assertThat(code).contains("private final String email;");
    assertThat(code).contains("private final Integer loginCount;");
    assertThat(code).contains("private final Object location;");
    assertThat(code).contains("No Java type is mapped for this column");
    assertThat(code).contains("public Users(int id, String email, Integer loginCount, Object location)");
    assertThat(code).contains("public int getId()");
    assertThat(code).contains("public static Builder builder()");
    assertThat(code).contains("public Users build()");
    assertThat(code).contains("Objects.equals(id, that.id)");
    assertThat(code).contains("return Objects.hash(id, email, loginCount, location);");
    assertThat(code).contains("\"Users{id=\"");
  }

  @Test
  void shouldDocumentForeignKeys() {
    PropertyModel userId = new PropertyModel("userId", "UserId", SqlType.parse("INT"), new ResolvedType("int", 0, 1),
        false, false, new ForeignKeyReference("FK_Orders_Users", QualifiedName.of("dbo", "Orders"), "UserId",
            QualifiedName.of("dbo", "Users"), "Id"));
    TargetEntityModel orders = new TargetEntityModel(EntityKind.TABLE, QualifiedName.of("dbo", "Orders"), PACKAGE,
        "Orders", List.of(userId), null);

    String code = generator.generate(orders).get(0).content();

    assertThat(code).contains("References {@code dbo.Users.Id}.");
    assertThat(code).contains("PRIMARY_KEY_COLUMNS = List.of();");
  }

  @Test
  void shouldGenerateViewWithoutKeyMetadata() {
    TargetEntityModel view = new TargetEntityModel(EntityKind.VIEW, QualifiedName.of("dbo", "ActiveUsers"), PACKAGE,
        "ActiveUsers", List.of(property("id", "Id", "INT", "int", false, false)), null);

    String code = generator.generate(view).get(0).content();

    assertThat(code).contains("public static final String VIEW_NAME = \"dbo.ActiveUsers\";");
    assertThat(code).doesNotContain("PRIMARY_KEY_COLUMNS", "TABLE_NAME");
  }

  @Test
  void shouldSplitValueSetIntoSeparateArtifacts() {
    List<GeneratedArtifact> artifacts = generator.generate(valueSet("Status", 10));

    assertThat(artifacts).extracting(GeneratedArtifact::name).containsExactly(
        "com/acme/model/Status.java",
        "com/acme/model/StatusIndexes.java",
        "com/acme/model/StatusData.java",
        "com/acme/model/StatusData0.java",
        "com/acme/model/StatusJson.java");
    assertThat(artifacts).allSatisfy(a -> assertThat(a.sourceEntity()).isEqualTo(QualifiedName.of("dbo", "Status")));
    assertThat(content(artifacts, "StatusJson")).contains("extends StdSerializer<Status>", "extends StdDeserializer<Status>");
  }

  @Test
  void shouldEmitDispatchHelperWithOneBranchPerValueForSmallSets() {
    List<GeneratedArtifact> artifacts = generator.generate(valueSet("Status", 10));

    String core = content(artifacts, "Status");
    assertThat(core).contains("public <R> R match(Supplier<? extends R> onV0");
    assertThat(occurrences(core, "case StatusIndexes.")).isEqualTo(10);
    assertThat(core).contains("case StatusIndexes.V9: return onV9.get();");
    assertThat(core).contains("public static final Status V3 = VALUES[StatusIndexes.V3];");
  }

  @Test
  void shouldOmitDispatchHelperForLargeSets() {
    List<GeneratedArtifact> artifacts = generator.generate(valueSet("Status", 30));

    String core = content(artifacts, "Status");
    assertThat(core).doesNotContain("match(", "Supplier", "case ");
    assertThat(core).doesNotContain("public static final Status V0");
    assertThat(content(artifacts, "StatusIndexes")).contains("public static final int V29 = 29;");
  }

  @Test
  void shouldUseThresholdOfTwentyFive() {
    assertThat(content(generator.generate(valueSet("Status", 25)), "Status")).contains("match(");
    assertThat(content(generator.generate(valueSet("Status", 26)), "Status")).doesNotContain("match(");
  }

  @Test
  void shouldChunkLargeValueSets() {
    List<GeneratedArtifact> artifacts = generator.generate(valueSet("Code", 3000));

    List<GeneratedArtifact> chunks = artifacts.stream()
        .filter(a -> a.name().matches("com/acme/model/CodeData\\d+\\.java"))
        .toList();
    assertThat(chunks).hasSize(12);
    assertThat(chunks).allSatisfy(c ->
        assertThat(occurrences(c.content(), "\"Value ")).isLessThanOrEqualTo(ValueSetGenerator.CHUNK_SIZE));
    assertThat(content(artifacts, "CodeData0")).contains("\"V255\"").doesNotContain("\"V256\"");
    assertThat(content(artifacts, "CodeData1")).contains("\"V256\"");
    assertThat(content(artifacts, "CodeData11")).contains("\"V2999\"");
  }

  @Test
  void shouldKeepCoreTypeSizeIndependentOfSetSize() {
    String small = content(generator.generate(valueSet("Code", 300)), "Code");
    String large = content(generator.generate(valueSet("Code", 30000)), "Code");

    assertThat(large.length() - small.length()).isLessThan(10);
  }

  @Test
  void shouldChunkIndexConstantsOfLargeSets() {
    List<GeneratedArtifact> artifacts = generator.generate(valueSet("Code", 600));

    assertThat(artifacts).extracting(GeneratedArtifact::name).containsExactly(
        "com/acme/model/Code.java",
        "com/acme/model/CodeIndexes0.java",
        "com/acme/model/CodeIndexes1.java",
        "com/acme/model/CodeIndexes2.java",
        "com/acme/model/CodeData.java",
        "com/acme/model/CodeData0.java",
        "com/acme/model/CodeData1.java",
        "com/acme/model/CodeData2.java",
        "com/acme/model/CodeJson.java");
    assertThat(content(artifacts, "CodeIndexes0")).contains("public static final int V255 = 255;")
        .doesNotContain("V256");
    assertThat(content(artifacts, "CodeIndexes2")).contains("public static final int V599 = 599;");
  }

  @Test
  void shouldBoundLargestArtifactIndependentlyOfSetSize() {
    GeneratedArtifact small = largest(generator.generate(paddedValueSet(300)));
    GeneratedArtifact large = largest(generator.generate(paddedValueSet(3000)));

    assertThat(lines(large)).isEqualTo(lines(small));
    assertThat(large.content().length()).isLessThan(small.content().length() * 11 / 10);
  }

  private static TargetEntityModel paddedValueSet(int count) {
    List<ValueSetEntry> entries = IntStream.range(0, count)
        .mapToObj(i -> new ValueSetEntry(String.format("V%05d", i), String.format("Value %05d", i), List.of()))
        .toList();
    return new TargetEntityModel(EntityKind.VALUE_SET, QualifiedName.of("dbo", "Code"), PACKAGE, "Code", List.of(),
        new ValueSetSpecification("Code", "Code", List.of(), entries));
  }

  private static GeneratedArtifact largest(List<GeneratedArtifact> artifacts) {
    return artifacts.stream()
        .max(Comparator.comparingInt(JavaGeneratorTest::lines))
        .orElseThrow();
  }

  private static int lines(GeneratedArtifact artifact) {
    return artifact.content().split("\n", -1).length;
  }

  @Test
  void shouldEmitAttributeAccessors() {
    TargetEntityModel entity = new TargetEntityModel(EntityKind.VALUE_SET, QualifiedName.of("dbo", "Priority"),
        PACKAGE, "Priority", List.of(), new ValueSetSpecification("Code", "Label",
            List.of(new ValueSetAttribute("Weight", "weight")),
            List.of(new ValueSetEntry("Low", "Low", List.of("1")),
                new ValueSetEntry("High", "High", Arrays.asList((String) null)))));

    List<GeneratedArtifact> artifacts = generator.generate(entity);

    assertThat(content(artifacts, "Priority")).contains("public String weight()", "PriorityData.attribute(index, 0)");
    assertThat(content(artifacts, "PriorityData")).contains("ATTRIBUTE_CHUNKS");
    assertThat(content(artifacts, "PriorityData0")).contains("{\"1\"}", "{null}");
  }

  @Test
  void shouldGenerateAllEntitiesDeterministically() {
    List<TargetEntityModel> entities = List.of(users(), valueSet("Status", 10), valueSet("Code", 600));

    PhaseResult<List<GeneratedArtifact>> first = generator.generate(entities);
    PhaseResult<List<GeneratedArtifact>> second = generator.generate(entities);

    assertThat(first.diagnostics()).isEmpty();
    assertThat(first.value()).hasSize(1 + 5 + 9);
    assertThat(first.value()).isEqualTo(second.value());
    assertThat(first.value().get(0).name()).isEqualTo("com/acme/model/Users.java");
  }

  @Test
  void shouldReportArtifactNameCollision() {
    TargetEntityModel other = new TargetEntityModel(EntityKind.TABLE, QualifiedName.of("sales", "Users"), PACKAGE,
        "Users", List.of(), null);

    PhaseResult<List<GeneratedArtifact>> result = generator.generate(List.of(users(), other));

    assertThat(result.value()).isNull();
    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.OUTPUT_COLLISION);
      assertThat(d.message()).contains("dbo.Users", "sales.Users", "com/acme/model/Users.java");
    });
  }

  @Test
  void shouldIsolateFailuresPerEntity() {
    TargetEntityModel broken = new TargetEntityModel(EntityKind.TABLE, QualifiedName.of("dbo", "Broken"), PACKAGE,
        "not a name", List.of(), null);
    List<TargetEntityModel> entities = new ArrayList<>(List.of(users(), broken, valueSet("Status", 3)));

    PhaseResult<List<GeneratedArtifact>> result = generator.generate(entities);

    assertThat(result.hasFatal()).isTrue();
    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.GENERATION_ERROR);
      assertThat(d.message()).contains("dbo.Broken");
    });
  }
}
