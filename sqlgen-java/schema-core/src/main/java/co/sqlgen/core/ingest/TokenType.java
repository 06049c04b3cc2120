package co.sqlgen.core.ingest;

/**
 * Lexical categories produced by {@link SqlLexer}.
 */
public enum TokenType {
  IDENTIFIER,
  QUOTED_IDENTIFIER,
  STRING,
  NUMBER,
  LPAREN,
  RPAREN,
  COMMA,
  SEMICOLON,
  DOT,
  OPERATOR,
  EOF
}
