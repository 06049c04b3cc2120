package co.sqlgen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A column's declared SQL type: an upper-cased base name plus optional parameters
 * such as length, precision and scale ({@code DECIMAL(10,2)}, {@code NVARCHAR(MAX)}).
 *
 * <p>{@link #parse(String)} never throws. Blank or unparseable text yields {@link #UNKNOWN}.
 */
public record SqlType(String baseName, List<String> parameters) {

  public static final SqlType UNKNOWN = new SqlType("", List.of());

  private static final Pattern TYPE_TEXT = Pattern.compile(
      "^\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\s+[A-Za-z_][A-Za-z0-9_]*)*)\\s*(?:\\(([^()]*)\\))?\\s*$");

  public SqlType {
    baseName = baseName.toUpperCase(Locale.ROOT);
    parameters = List.copyOf(parameters);
  }

  public static SqlType of(String baseName, String... parameters) {
    return new SqlType(baseName, List.of(parameters));
  }

  public static SqlType parse(String text) {
    if (text == null || text.isBlank()) return UNKNOWN;
    Matcher m = TYPE_TEXT.matcher(text);
    if (!m.matches()) return UNKNOWN;
    String base = m.group(1).replaceAll("\\s+", " ");
    List<String> params = new ArrayList<>();
    if (m.group(2) != null) {
      for (String p : m.group(2).split(",", -1)) {
        String trimmed = p.trim();
        if (trimmed.isEmpty()) return UNKNOWN;
        params.add(trimmed.toUpperCase(Locale.ROOT));
      }
    }
    return new SqlType(base, params);
  }

  public boolean isUnknown() {
    return baseName.isEmpty();
  }

  /** Full declared text, e.g. {@code NVARCHAR(50)}. */
  public String text() {
    if (parameters.isEmpty()) return baseName;
    return baseName + "(" + String.join(",", parameters) + ")";
  }

  @Override
  public String toString() {
    return isUnknown() ? "<unknown>" : text();
  }
}
