package co.sqlgen.core.ingest;

import java.util.Locale;

/**
 * A lexical token. {@code text} is the unquoted value for quoted identifiers and string
 * literals. {@code start} and {@code end} are offsets into the source text.
 */
public record Token(TokenType type, String text, int line, int column, int start, int end) {

  /** True for an unquoted identifier spelled like {@code keyword}, ignoring case. */
  public boolean isKeyword(String keyword) {
    return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
  }

  public boolean isKeyword(String... keywords) {
    for (String k : keywords) {
      if (isKeyword(k)) return true;
    }
    return false;
  }

  public boolean is(TokenType expected) {
    return type == expected;
  }

  public boolean isName() {
    return type == TokenType.IDENTIFIER || type == TokenType.QUOTED_IDENTIFIER;
  }

  public String describe() {
    return type == TokenType.EOF ? "end of statement" : "'" + text + "'";
  }

  public String upper() {
    return text.toUpperCase(Locale.ROOT);
  }
}
