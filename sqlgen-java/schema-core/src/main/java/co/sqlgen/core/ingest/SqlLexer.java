package co.sqlgen.core.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the SQL dialect accepted by {@link SqlSchemaParser}.
 *
 * <p>Understands T-SQL quoting ({@code [name]}), ANSI quoting ({@code "name"}), MySQL
 * backticks, {@code N'...'} literals with doubled-quote escapes, and both comment styles.
 * Lexical problems do not stop tokenization: they are collected in {@link #errors()}
 * and the offending input is skipped.
 */
public final class SqlLexer {

  /** A lexical problem at a 1-based line and column. */
  public record LexError(String message, int line, int column) {}

  private final String text;
  private final List<Token> tokens = new ArrayList<>();
  private final List<LexError> errors = new ArrayList<>();
  private int pos;
  private char ch;
  private int line = 1;
  private int column = 1;

  private int tokenStart;
  private int tokenLine;
  private int tokenColumn;

  public SqlLexer(String text) {
    this.text = text;
    this.pos = 0;
    this.ch = pos < text.length() ? text.charAt(pos) : '\0';
  }

  /**
   * Tokenize the whole input. The returned list always ends with an {@link TokenType#EOF} token.
   */
  public List<Token> tokenize() {
    while (true) {
      skipWhitespaceAndComments();
      tokenStart = pos;
      tokenLine = line;
      tokenColumn = column;
      if (pos >= text.length()) {
        emit(TokenType.EOF, "");
        return tokens;
      }
      nextToken();
    }
  }

  public List<LexError> errors() {
    return errors;
  }

  // ==================== Scanning ====================

  private void nextToken() {
    if ((ch == 'N' || ch == 'n') && peek() == '\'') {
      advance();
      scanString();
      return;
    }
    if (isIdentifierStart(ch)) {
      scanIdentifier();
      return;
    }
    switch (ch) {
      case '[' -> scanDelimited(']');
      case '"' -> scanDelimited('"');
      case '`' -> scanDelimited('`');
      case '\'' -> scanString();
      case '(' -> single(TokenType.LPAREN);
      case ')' -> single(TokenType.RPAREN);
      case ',' -> single(TokenType.COMMA);
      case ';' -> single(TokenType.SEMICOLON);
      case '.' -> {
        if (isDigit(peek())) scanNumber();
        else single(TokenType.DOT);
      }
      case '=', '+', '-', '*', '/', '<', '>', '!', '%', '&', '|', '^', '~', ':' -> single(TokenType.OPERATOR);
      default -> {
        if (isDigit(ch)) {
          scanNumber();
        } else {
          errors.add(new LexError("Unexpected character '" + ch + "'", line, column));
          advance();
        }
      }
    }
  }

  private void scanIdentifier() {
    while (isIdentifierPart(ch)) advance();
    emit(TokenType.IDENTIFIER, text.substring(tokenStart, pos));
  }

  private void scanDelimited(char close) {
    advance();
    StringBuilder sb = new StringBuilder();
    while (pos < text.length()) {
      if (ch == close) {
        if (peek() == close) {
          sb.append(close);
          advance();
          advance();
          continue;
        }
        advance();
        emit(TokenType.QUOTED_IDENTIFIER, sb.toString());
        return;
      }
      sb.append(ch);
      advance();
    }
    errors.add(new LexError("Unterminated quoted identifier", tokenLine, tokenColumn));
    emit(TokenType.QUOTED_IDENTIFIER, sb.toString());
  }

  private void scanString() {
    advance(); // opening quote
    StringBuilder sb = new StringBuilder();
    while (pos < text.length()) {
      if (ch == '\'') {
        if (peek() == '\'') {
          sb.append('\'');
          advance();
          advance();
          continue;
        }
        advance();
        emit(TokenType.STRING, sb.toString());
        return;
      }
      sb.append(ch);
      advance();
    }
    errors.add(new LexError("Unterminated string literal", tokenLine, tokenColumn));
    emit(TokenType.STRING, sb.toString());
  }

  private void scanNumber() {
    while (isDigit(ch)) advance();
    if (ch == '.' && isDigit(peek())) {
      advance();
      while (isDigit(ch)) advance();
    } else if (ch == '.') {
      advance();
    }
    if ((ch == 'e' || ch == 'E') && (isDigit(peek()) || peek() == '-' || peek() == '+')) {
      advance();
      if (ch == '+' || ch == '-') advance();
      while (isDigit(ch)) advance();
    }
    emit(TokenType.NUMBER, text.substring(tokenStart, pos));
  }

  private void single(TokenType type) {
    String value = String.valueOf(ch);
    advance();
    emit(type, value);
  }

  private void emit(TokenType type, String value) {
    tokens.add(new Token(type, value, tokenLine, tokenColumn, tokenStart, pos));
  }

  // ==================== Helpers ====================

  private void advance() {
    if (ch == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
    ch = pos < text.length() ? text.charAt(pos) : '\0';
  }

  private char peek() {
    return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
  }

  private void skipWhitespaceAndComments() {
    while (pos < text.length()) {
      if (Character.isWhitespace(ch)) {
        advance();
      } else if (ch == '-' && peek() == '-') {
        while (pos < text.length() && ch != '\n') advance();
      } else if (ch == '/' && peek() == '*') {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        boolean closed = false;
        while (pos < text.length()) {
          if (ch == '*' && peek() == '/') {
            advance();
            advance();
            closed = true;
            break;
          }
          advance();
        }
        if (!closed) errors.add(new LexError("Unterminated block comment", startLine, startColumn));
      } else {
        return;
      }
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '@' || c == '#';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '#' || c == '$';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
