package co.sqlgen.core.ingest;

/**
 * Raised by {@link SqlSchemaParser} when a statement cannot be understood. It never
 * escapes the parser: it is converted into a parse diagnostic at the statement or table
 * element where parsing resumes.
 */
class SqlParseException extends RuntimeException {

  private final transient Token token;

  SqlParseException(String message, Token token) {
    super(message);
    this.token = token;
  }

  Token token() {
    return token;
  }
}
