package co.sqlgen.core.typemap;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.model.SqlType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Resolves SQL column types to target types through an ordered list of rules.
 *
 * <p>A rule applies when every pattern it declares matches. Among applicable rules the
 * one declaring the most patterns wins; equally specific rules are decided by declaration
 * order, so the earlier rule wins. Nothing applicable yields {@link ResolvedType#UNKNOWN}.
 *
 * <p>Rules are compiled once by {@link #compile(List)}. A compiled mapper is immutable
 * and safe to share between generator threads.
 */
public final class TypeMapper {

  private static final Logger log = LoggerFactory.getLogger(TypeMapper.class);

  private final List<CompiledRule> rules;

  private TypeMapper(List<CompiledRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Compile {@code rules}. Each rule that cannot be compiled (malformed regex, missing
   * source type or target type) is reported once as {@code TYPE_RULE_COMPILATION} and
   * left out of the mapper. The mapper itself is always returned.
   */
  public static PhaseResult<TypeMapper> compile(List<TypeMappingRule> rules) {
    List<CompiledRule> compiled = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (int i = 0; i < rules.size(); i++) {
      TypeMappingRule rule = rules.get(i);
      try {
        compiled.add(CompiledRule.of(i, rule));
      } catch (IllegalArgumentException e) {
        diagnostics.add(Diagnostic.of(DiagnosticKind.TYPE_RULE_COMPILATION,
            "Type rule #" + i + " (" + rule + ") ignored: " + e.getMessage()));
      }
    }
    log.debug("Compiled {} of {} type mapping rules", compiled.size(), rules.size());
    return PhaseResult.of(new TypeMapper(compiled), diagnostics);
  }

  public static TypeMapper empty() {
    return new TypeMapper(List.of());
  }

  public int size() {
    return rules.size();
  }

  public ResolvedType resolve(String schema, String table, String column, SqlType type) {
    if (type == null || type.isUnknown()) return ResolvedType.UNKNOWN;
    CompiledRule best = null;
    for (CompiledRule rule : rules) {
      if (!rule.matches(schema, table, column, type)) continue;
      if (best == null || rule.specificity > best.specificity) {
        best = rule;
      }
    }
    if (best == null) return ResolvedType.UNKNOWN;
    return new ResolvedType(best.targetType, best.index, best.specificity);
  }

  private static final class CompiledRule {
    final int index;
    final int specificity;
    final String targetType;
    final Predicate<String> schema;
    final Predicate<String> table;
    final Predicate<String> column;
    final Predicate<String> sourceType;

    private CompiledRule(int index, int specificity, String targetType, Predicate<String> schema,
        Predicate<String> table, Predicate<String> column, Predicate<String> sourceType) {
      this.index = index;
      this.specificity = specificity;
      this.targetType = targetType;
      this.schema = schema;
      this.table = table;
      this.column = column;
      this.sourceType = sourceType;
    }

    static CompiledRule of(int index, TypeMappingRule rule) {
      if (!TypeMappingRule.isDeclared(rule.sourceType())) {
        throw new IllegalArgumentException("sourceType is required");
      }
      if (!TypeMappingRule.isDeclared(rule.targetType())) {
        throw new IllegalArgumentException("targetType is required");
      }
      return new CompiledRule(index, rule.specificity(), rule.targetType().trim(),
          pattern(rule.schema(), rule.regex()),
          pattern(rule.table(), rule.regex()),
          pattern(rule.column(), rule.regex()),
          sourceTypePattern(rule.sourceType(), rule.regex()));
    }

    boolean matches(String schemaName, String tableName, String columnName, SqlType type) {
      return (sourceType.test(type.baseName()) || sourceType.test(type.text()))
          && schema.test(schemaName) && table.test(tableName) && column.test(columnName);
    }

    private static Predicate<String> pattern(String text, boolean regex) {
      if (!TypeMappingRule.isDeclared(text)) return value -> true;
      if (regex) return compileRegex(text);
      String literal = text.trim();
      return value -> value != null && value.equalsIgnoreCase(literal);
    }

    private static Predicate<String> sourceTypePattern(String text, boolean regex) {
      if (regex) return compileRegex(text);
      SqlType declared = SqlType.parse(text);
      String literal = declared.isUnknown() ? text.trim() : declared.text();
      return value -> value != null && value.equalsIgnoreCase(literal);
    }

    private static Predicate<String> compileRegex(String text) {
      Pattern p;
      try {
        p = Pattern.compile(text, Pattern.CASE_INSENSITIVE);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("malformed regex '" + text + "': " + e.getDescription(), e);
      }
      return value -> value != null && p.matcher(value).matches();
    }
  }
}
