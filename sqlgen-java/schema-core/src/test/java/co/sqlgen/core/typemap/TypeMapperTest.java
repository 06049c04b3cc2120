package co.sqlgen.core.typemap;

import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.model.SqlType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class TypeMapperTest {

  private static final SqlType NVARCHAR_50 = SqlType.of("NVARCHAR", "50");

  private static TypeMapper mapper(TypeMappingRule... rules) {
    PhaseResult<TypeMapper> compiled = TypeMapper.compile(List.of(rules));
    assertThat(compiled.diagnostics()).isEmpty();
    return compiled.value();
  }

  @Test
  void shouldPreferMoreSpecificRule() {
    TypeMapper mapper = mapper(
        TypeMappingRule.of("NVARCHAR", "text"),
        TypeMappingRule.of("NVARCHAR", "email-string").forColumn("Email"));

    ResolvedType email = mapper.resolve("dbo", "Users", "Email", NVARCHAR_50);
    assertThat(email.targetType()).isEqualTo("email-string");
    assertThat(email.specificity()).isEqualTo(2);
    assertThat(email.ruleIndex()).isEqualTo(1);

    ResolvedType username = mapper.resolve("dbo", "Users", "Username", NVARCHAR_50);
    assertThat(username.targetType()).isEqualTo("text");
    assertThat(username.specificity()).isEqualTo(1);
  }

  @Test
  void shouldBreakTiesByDeclarationOrder() {
    TypeMapper mapper = mapper(
        TypeMappingRule.of("INT", "first").forTable("Orders"),
        TypeMappingRule.of("INT", "second").forColumn("Total"));

    ResolvedType resolved = mapper.resolve("dbo", "Orders", "Total", SqlType.of("INT"));

    assertThat(resolved.targetType()).isEqualTo("first");
    assertThat(resolved.ruleIndex()).isEqualTo(0);
  }

  @Test
  void shouldReturnUnknownWithoutRules() {
    TypeMapper mapper = mapper();

    ResolvedType resolved = mapper.resolve("dbo", "Users", "Id", SqlType.of("INT"));

    assertThat(resolved).isSameAs(ResolvedType.UNKNOWN);
    assertThat(resolved.isUnknown()).isTrue();
    assertThat(resolved.ruleIndex()).isEqualTo(-1);
  }

  @Test
  void shouldNeverMapUnknownSourceType() {
    TypeMapper mapper = mapper(TypeMappingRule.of(".*", "Object").asRegex());

    assertThat(mapper.resolve("dbo", "T", "Computed", SqlType.UNKNOWN).isUnknown()).isTrue();
  }

  @ParameterizedTest
  @CsvSource({
      "nvarchar,     true",
      "NVARCHAR(50), true",
      "nvarchar(50), true",
      "NVARCHAR(60), false",
      "VARCHAR,      false"
  })
  void shouldMatchLiteralSourceTypeOnBaseNameOrFullText(String pattern, boolean matches) {
    TypeMapper mapper = mapper(TypeMappingRule.of(pattern, "String"));

    assertThat(mapper.resolve("dbo", "T", "C", NVARCHAR_50).isUnknown()).isEqualTo(!matches);
  }

  @Test
  void shouldMatchRegexPatternsCaseInsensitivelyOnWholeField() {
    TypeMapper mapper = mapper(
        TypeMappingRule.of("N?VARCHAR", "String").forColumn(".*_?id").asRegex(),
        TypeMappingRule.of("N?VARCHAR", "Other").forColumn("id").asRegex());

    assertThat(mapper.resolve("dbo", "T", "External_ID", NVARCHAR_50).targetType()).isEqualTo("String");
    assertThat(mapper.resolve("dbo", "T", "Ident", NVARCHAR_50).isUnknown()).isTrue();
  }

  @Test
  void shouldRequireEveryDeclaredPattern() {
    TypeMapper mapper = mapper(
        TypeMappingRule.of("INT", "OrderId").forSchema("sales").forTable("Orders").forColumn("Id"));

    assertThat(mapper.resolve("sales", "orders", "ID", SqlType.of("INT")).targetType()).isEqualTo("OrderId");
    assertThat(mapper.resolve("sales", "orders", "ID", SqlType.of("INT")).specificity()).isEqualTo(4);
    assertThat(mapper.resolve("dbo", "Orders", "Id", SqlType.of("INT")).isUnknown()).isTrue();
    assertThat(mapper.resolve("sales", "Orders", "Id", SqlType.of("BIGINT")).isUnknown()).isTrue();
  }

  @Test
  void shouldReportMalformedRuleOnceAndKeepTheRest() {
    PhaseResult<TypeMapper> compiled = TypeMapper.compile(List.of(
        TypeMappingRule.of("INT", "int"),
        TypeMappingRule.of("VARCHAR(", "String").asRegex(),
        new TypeMappingRule(null, null, null, "BIT", null, false),
        new TypeMappingRule(null, null, "Flag", null, "boolean", false)));

    assertThat(compiled.hasFatal()).isFalse();
    assertThat(compiled.diagnostics()).extracting(d -> d.kind())
        .containsExactly(DiagnosticKind.TYPE_RULE_COMPILATION, DiagnosticKind.TYPE_RULE_COMPILATION,
            DiagnosticKind.TYPE_RULE_COMPILATION);
    assertThat(compiled.diagnostics().get(0).message()).contains("#1").contains("malformed regex");
    assertThat(compiled.diagnostics().get(1).message()).contains("targetType is required");
    assertThat(compiled.diagnostics().get(2).message()).contains("sourceType is required");

    TypeMapper mapper = compiled.value();
    assertThat(mapper.size()).isEqualTo(1);
    for (int i = 0; i < 100; i++) {
      assertThat(mapper.resolve("dbo", "T", "C" + i, SqlType.of("VARCHAR", "10")).isUnknown()).isTrue();
    }
    assertThat(mapper.resolve("dbo", "T", "Id", SqlType.of("INT")).targetType()).isEqualTo("int");
  }

  @Test
  void shouldKeepOriginalRuleIndexAfterExcludingBadRules() {
    PhaseResult<TypeMapper> compiled = TypeMapper.compile(List.of(
        TypeMappingRule.of("[", "broken").asRegex(),
        TypeMappingRule.of("INT", "int")));

    assertThat(compiled.value().resolve("dbo", "T", "Id", SqlType.of("INT")).ruleIndex()).isEqualTo(1);
  }
}
