package co.sqlgen.core.ingest;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.diagnostics.SourceLocation;
import co.sqlgen.core.model.ColumnDefinition;
import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.IndexDefinition;
import co.sqlgen.core.model.QualifiedName;
import co.sqlgen.core.model.RawSchemaModel;
import co.sqlgen.core.model.SchemaSource;
import co.sqlgen.core.model.SeedData;
import co.sqlgen.core.model.SqlType;
import co.sqlgen.core.model.TableAlteration;
import co.sqlgen.core.model.TableDefinition;
import co.sqlgen.core.model.ViewDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser turning one schema source into a {@link RawSchemaModel}.
 *
 * <p>Supported statements:
 * <ul>
 *   <li>{@code CREATE TABLE} with column and table constraints</li>
 *   <li>{@code CREATE [UNIQUE] [CLUSTERED|NONCLUSTERED] INDEX name ON table (columns)}</li>
 *   <li>{@code CREATE [OR ALTER] VIEW name [(columns)] AS query}</li>
 *   <li>{@code ALTER TABLE name [WITH CHECK] ADD ...} (constraints and columns)</li>
 *   <li>{@code INSERT INTO name [(columns)] VALUES (...), (...)}</li>
 * </ul>
 * Everything else (procedures, grants, {@code SET} options) is skipped.
 *
 * <p>Statements end at {@code ;}, at a {@code GO} batch separator, or where a new
 * {@code CREATE}/{@code ALTER}/{@code INSERT} starts a line outside parentheses. A
 * malformed statement produces a parse diagnostic and parsing resumes with the next
 * table element or the next statement.
 */
public final class SqlSchemaParser {

  private static final Logger log = LoggerFactory.getLogger(SqlSchemaParser.class);

  private static final Set<String> COLUMN_CONSTRAINT_KEYWORDS = Set.of(
      "NOT", "NULL", "CONSTRAINT", "PRIMARY", "UNIQUE", "IDENTITY", "REFERENCES", "FOREIGN",
      "CHECK", "COLLATE", "DEFAULT", "AUTO_INCREMENT", "AUTOINCREMENT", "ROWGUIDCOL",
      "SPARSE", "PERSISTED", "FILESTREAM"
  );

  private static final Set<String> TYPE_CONTINUATIONS = Set.of("PRECISION", "VARYING", "UNSIGNED");

  private static final Set<String> STATEMENT_STARTS = Set.of("CREATE", "ALTER", "INSERT");

  private final String defaultSchema;

  public SqlSchemaParser(String defaultSchema) {
    this.defaultSchema = Objects.requireNonNull(defaultSchema, "defaultSchema");
  }

  /**
   * Parse a source. The returned model is never null; it holds everything that could be
   * recovered even when diagnostics were reported.
   */
  public PhaseResult<RawSchemaModel> parse(SchemaSource source) {
    SqlLexer lexer = new SqlLexer(source.text());
    List<Token> tokens = lexer.tokenize();

    List<Diagnostic> diagnostics = new ArrayList<>();
    for (SqlLexer.LexError e : lexer.errors()) {
      diagnostics.add(Diagnostic.at(DiagnosticKind.PARSE_ERROR,
          new SourceLocation(source.name(), e.line(), e.column()), e.message()));
    }

    ModelDraft model = new ModelDraft();
    for (List<Token> statement : splitStatements(tokens)) {
      StatementParser parser = new StatementParser(source, statement, model, diagnostics);
      try {
        parser.parseStatement();
      } catch (SqlParseException e) {
        parser.report(e);
      }
    }

    diagnostics.sort(Comparator
        .comparingInt((Diagnostic d) -> d.location().line())
        .thenComparingInt(d -> d.location().column()));

    RawSchemaModel raw = new RawSchemaModel(source.name(), model.tables, model.views,
        model.indexes, model.alterations, model.seedData);
    log.debug("Parsed {}: {} tables, {} views, {} indexes, {} alterations, {} seed statements",
        source.name(), raw.tables().size(), raw.views().size(), raw.indexes().size(),
        raw.alterations().size(), raw.seedData().size());
    return PhaseResult.of(raw, diagnostics);
  }

  static List<List<Token>> splitStatements(List<Token> tokens) {
    List<List<Token>> statements = new ArrayList<>();
    List<Token> current = new ArrayList<>();
    Token previous = null;
    int depth = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (t.is(TokenType.EOF)) break;
      boolean startsLine = previous == null || previous.line() < t.line();
      int separatorEnd = depth == 0 && startsLine ? batchSeparatorEnd(tokens, i) : -1;
      if (separatorEnd >= 0) {
        addStatement(statements, current);
        current = new ArrayList<>();
        previous = tokens.get(separatorEnd);
        i = separatorEnd;
      } else if (t.is(TokenType.SEMICOLON)) {
        addStatement(statements, current);
        current = new ArrayList<>();
        depth = 0;
      } else {
        boolean newStatement = depth == 0 && startsLine && !current.isEmpty()
            && t.is(TokenType.IDENTIFIER) && STATEMENT_STARTS.contains(t.upper());
        if (newStatement) {
          addStatement(statements, current);
          current = new ArrayList<>();
        }
        if (t.is(TokenType.LPAREN)) depth++;
        if (t.is(TokenType.RPAREN) && depth > 0) depth--;
        current.add(t);
      }
      previous = t;
    }
    addStatement(statements, current);
    return statements;
  }

  /**
   * Index of the last token of a {@code GO [count]} batch separator starting at {@code i},
   * or -1 when the tokens there are not alone on their line.
   */
  private static int batchSeparatorEnd(List<Token> tokens, int i) {
    Token go = tokens.get(i);
    if (!go.isKeyword("GO")) return -1;
    int last = i;
    Token next = tokens.get(i + 1);
    if (next.is(TokenType.NUMBER) && next.line() == go.line()) {
      last = i + 1;
      next = tokens.get(i + 2);
    }
    if (next.is(TokenType.SEMICOLON) && next.line() == go.line()) {
      last++;
      next = tokens.get(last + 1);
    }
    boolean endsLine = next.is(TokenType.EOF) || next.line() > go.line();
    return endsLine ? last : -1;
  }

  private static void addStatement(List<List<Token>> statements, List<Token> statement) {
    if (statement.isEmpty()) return;
    Token last = statement.get(statement.size() - 1);
    statement.add(new Token(TokenType.EOF, "", last.line(), last.column() + last.text().length(), last.end(), last.end()));
    statements.add(statement);
  }

  // =========================================================================
  // Drafts
  // =========================================================================

  private static final class ModelDraft {
    final List<TableDefinition> tables = new ArrayList<>();
    final List<ViewDefinition> views = new ArrayList<>();
    final List<IndexDefinition> indexes = new ArrayList<>();
    final List<TableAlteration> alterations = new ArrayList<>();
    final List<SeedData> seedData = new ArrayList<>();
  }

  private static final class TableDraft {
    final QualifiedName name;
    final List<ColumnDefinition> columns = new ArrayList<>();
    final List<IndexDefinition> indexes = new ArrayList<>();
    final List<ForeignKeyReference> foreignKeys = new ArrayList<>();

    TableDraft(QualifiedName name) {
      this.name = name;
    }

    void addColumn(String column, SqlType type, boolean nullable, boolean primaryKey,
        boolean identity, String defaultExpression) {
      columns.add(new ColumnDefinition(column, type, nullable && !primaryKey, primaryKey,
          columns.size(), identity, defaultExpression));
    }

    TableDefinition build(SourceLocation location) {
      Set<String> keyColumns = indexes.stream()
          .filter(IndexDefinition::primaryKey)
          .flatMap(i -> i.columnNames().stream())
          .map(c -> c.toLowerCase(Locale.ROOT))
          .collect(Collectors.toSet());
      List<ColumnDefinition> flagged = columns.stream()
          .map(c -> keyColumns.contains(c.name().toLowerCase(Locale.ROOT)) ? c.withPrimaryKey(true) : c)
          .toList();
      return new TableDefinition(name, flagged, indexes, foreignKeys, location);
    }
  }

  // =========================================================================
  // Statement parsing
  // =========================================================================

  private final class StatementParser {
    private final SchemaSource source;
    private final List<Token> tokens;
    private final ModelDraft model;
    private final List<Diagnostic> diagnostics;
    private int pos;

    StatementParser(SchemaSource source, List<Token> tokens, ModelDraft model, List<Diagnostic> diagnostics) {
      this.source = source;
      this.tokens = tokens;
      this.model = model;
      this.diagnostics = diagnostics;
    }

    void parseStatement() {
      Token first = peek();
      if (accept("CREATE")) {
        if (accept("OR")) expect("ALTER");
        if (accept("TABLE")) {
          parseCreateTable(first);
        } else if (peek().isKeyword("UNIQUE", "CLUSTERED", "NONCLUSTERED", "INDEX")) {
          parseCreateIndex();
        } else if (accept("VIEW")) {
          parseCreateView(first);
        } else {
          log.debug("Skipping CREATE {} at {}", peek().text(), location(first));
        }
      } else if (accept("ALTER")) {
        if (accept("TABLE")) parseAlterTable(first);
      } else if (accept("INSERT")) {
        parseInsert(first);
      }
    }

    void report(SqlParseException e) {
      diagnostics.add(Diagnostic.at(DiagnosticKind.PARSE_ERROR, location(e.token()), e.getMessage()));
    }

    // ---- CREATE TABLE ----

    private void parseCreateTable(Token first) {
      QualifiedName name = qualifiedName();
      TableDraft table = new TableDraft(name);
      expect(TokenType.LPAREN, "'(' after table name " + name);
      while (true) {
        int elementStart = pos;
        try {
          parseTableElement(table);
        } catch (SqlParseException e) {
          report(e);
          pos = elementStart;
          skipToElementEnd();
        }
        if (acceptToken(TokenType.COMMA)) continue;
        if (acceptToken(TokenType.RPAREN)) break;
        throw error("Expected ',' or ')' in table " + name + " but found " + peek().describe());
      }
      model.tables.add(table.build(location(first)));
    }

    private void parseTableElement(TableDraft table) {
      if (accept("CONSTRAINT")) {
        String constraintName = identifier("constraint name");
        parseTableConstraint(table, constraintName);
      } else if (startsTableConstraint()) {
        parseTableConstraint(table, null);
      } else {
        parseColumn(table);
      }
    }

    private boolean startsTableConstraint() {
      Token t = peek();
      Token after = peek(1);
      if (t.isKeyword("PRIMARY", "FOREIGN")) return after.isKeyword("KEY");
      if (t.isKeyword("UNIQUE")) {
        return after.is(TokenType.LPAREN) || after.isKeyword("CLUSTERED", "NONCLUSTERED", "KEY");
      }
      if (t.isKeyword("CHECK")) return after.is(TokenType.LPAREN);
      if (t.isKeyword("INDEX")) {
        Token third = peek(2);
        return after.isName()
            && (third.is(TokenType.LPAREN) || third.isKeyword("UNIQUE", "CLUSTERED", "NONCLUSTERED"));
      }
      return false;
    }

    private void parseTableConstraint(TableDraft table, String constraintName) {
      String tableName = table.name.name();
      if (accept("PRIMARY")) {
        expect("KEY");
        boolean nonClustered = accept("NONCLUSTERED");
        if (!nonClustered) accept("CLUSTERED");
        List<String> columns = columnList();
        String name = constraintName != null ? constraintName : "PK_" + tableName;
        table.indexes.add(new IndexDefinition(name, table.name, true, !nonClustered, true, columns));
      } else if (accept("UNIQUE")) {
        accept("KEY");
        boolean clustered = accept("CLUSTERED");
        if (!clustered) accept("NONCLUSTERED");
        List<String> columns = columnList();
        String name = constraintName != null ? constraintName : "UQ_" + tableName + "_" + String.join("_", columns);
        table.indexes.add(new IndexDefinition(name, table.name, true, clustered, false, columns));
      } else if (accept("FOREIGN")) {
        expect("KEY");
        List<String> columns = columnList();
        expect("REFERENCES");
        QualifiedName target = qualifiedName();
        List<String> targetColumns = peek().is(TokenType.LPAREN) ? columnList() : List.of();
        if (targetColumns.isEmpty() && columns.size() > 1) {
          throw error("Composite foreign key on " + tableName + " must list the referenced columns");
        }
        if (!targetColumns.isEmpty() && targetColumns.size() != columns.size()) {
          throw error("Foreign key on " + tableName + " lists " + columns.size()
              + " columns but references " + targetColumns.size());
        }
        String name = constraintName != null ? constraintName : "FK_" + tableName + "_" + target.name();
        for (int i = 0; i < columns.size(); i++) {
          String targetColumn = targetColumns.isEmpty() ? "" : targetColumns.get(i);
          table.foreignKeys.add(new ForeignKeyReference(name, table.name, columns.get(i), target, targetColumn));
        }
        skipReferentialActions();
      } else if (accept("CHECK")) {
        skipGroup();
      } else if (accept("INDEX")) {
        String name = identifier("index name");
        boolean unique = accept("UNIQUE");
        boolean clustered = accept("CLUSTERED");
        if (!clustered) accept("NONCLUSTERED");
        List<String> columns = columnList();
        table.indexes.add(new IndexDefinition(name, table.name, unique, clustered, false, columns));
      } else {
        throw error("Expected PRIMARY KEY, UNIQUE, FOREIGN KEY, CHECK or INDEX but found " + peek().describe());
      }
      if (peek().isKeyword("WITH", "ON")) skipToElementEnd();
    }

    private void parseColumn(TableDraft table) {
      String name = identifier("column name");
      if (accept("AS")) {
        // computed column: the expression has no declared type
        skipToElementEnd();
        table.addColumn(name, SqlType.UNKNOWN, true, false, false, null);
        return;
      }

      SqlType type = SqlType.UNKNOWN;
      if (peek().isName() && !isColumnConstraintStart(peek())) {
        type = parseType();
      }

      boolean nullable = true;
      boolean primaryKey = false;
      boolean identity = false;
      String defaultExpression = null;
      String constraintName = null;

      while (!atElementEnd()) {
        Token t = peek();
        if (accept("NOT")) {
          if (accept("NULL")) {
            nullable = false;
          } else if (accept("FOR")) {
            expect("REPLICATION");
          } else {
            throw error("Expected NULL after NOT in column " + name);
          }
        } else if (accept("NULL")) {
          nullable = true;
        } else if (accept("CONSTRAINT")) {
          constraintName = identifier("constraint name");
        } else if (accept("PRIMARY")) {
          expect("KEY");
          primaryKey = true;
          acceptAny("CLUSTERED", "NONCLUSTERED");
          acceptAny("ASC", "DESC");
        } else if (accept("UNIQUE")) {
          boolean clustered = accept("CLUSTERED");
          if (!clustered) accept("NONCLUSTERED");
          String indexName = constraintName != null ? constraintName : "UQ_" + table.name.name() + "_" + name;
          table.indexes.add(new IndexDefinition(indexName, table.name, true, clustered, false, List.of(name)));
          constraintName = null;
        } else if (accept("IDENTITY")) {
          identity = true;
          if (peek().is(TokenType.LPAREN)) skipGroup();
        } else if (acceptAny("AUTO_INCREMENT", "AUTOINCREMENT")) {
          identity = true;
        } else if (accept("DEFAULT")) {
          defaultExpression = parseDefaultExpression();
          constraintName = null;
        } else if (accept("FOREIGN")) {
          expect("KEY");
          expect("REFERENCES");
          table.foreignKeys.add(inlineReference(table, name, constraintName));
          constraintName = null;
        } else if (accept("REFERENCES")) {
          table.foreignKeys.add(inlineReference(table, name, constraintName));
          constraintName = null;
        } else if (accept("CHECK")) {
          skipGroup();
          constraintName = null;
        } else if (accept("COLLATE")) {
          identifier("collation name");
        } else if (acceptAny("ROWGUIDCOL", "SPARSE", "PERSISTED", "FILESTREAM", "ASC", "DESC")) {
          continue;
        } else {
          throw error("Unexpected " + t.describe() + " in definition of column " + name);
        }
      }
      table.addColumn(name, type, nullable, primaryKey, identity, defaultExpression);
    }

    private ForeignKeyReference inlineReference(TableDraft table, String column, String constraintName) {
      QualifiedName target = qualifiedName();
      String targetColumn = "";
      if (peek().is(TokenType.LPAREN)) {
        List<String> columns = columnList();
        if (columns.size() != 1) {
          throw error("Column " + column + " can reference exactly one column, found " + columns.size());
        }
        targetColumn = columns.get(0);
      }
      skipReferentialActions();
      String name = constraintName != null ? constraintName : "FK_" + table.name.name() + "_" + column;
      return new ForeignKeyReference(name, table.name, column, target, targetColumn);
    }

    private SqlType parseType() {
      String base = identifier("type name");
      while (peek().is(TokenType.DOT)) {
        next();
        base = identifier("type name");
      }
      while (peek().is(TokenType.IDENTIFIER) && TYPE_CONTINUATIONS.contains(peek().upper())) {
        base = base + " " + next().text();
      }
      if (peek().isKeyword("WITH", "WITHOUT") && peek(1).isKeyword("TIME") && peek(2).isKeyword("ZONE")) {
        base = base + " " + next().text() + " " + next().text() + " " + next().text();
      }

      List<String> parameters = new ArrayList<>();
      if (acceptToken(TokenType.LPAREN)) {
        while (true) {
          Token p = peek();
          if (!p.is(TokenType.NUMBER) && !p.is(TokenType.IDENTIFIER) && !p.is(TokenType.STRING)) {
            throw error("Expected type parameter but found " + p.describe());
          }
          parameters.add(next().text());
          if (acceptToken(TokenType.COMMA)) continue;
          expect(TokenType.RPAREN, "')' after type parameters");
          break;
        }
      }
      return new SqlType(base, parameters);
    }

    private String parseDefaultExpression() {
      int start = pos;
      do {
        if (atElementEnd()) throw error("Expected a default value");
        if (peek().is(TokenType.LPAREN)) skipGroup();
        else next();
      } while (!atElementEnd() && !isColumnConstraintStart(peek()));
      return textBetween(start, pos);
    }

    private boolean isColumnConstraintStart(Token t) {
      return t.is(TokenType.IDENTIFIER) && COLUMN_CONSTRAINT_KEYWORDS.contains(t.upper());
    }

    private void skipReferentialActions() {
      while (peek().isKeyword("ON") && peek(1).isKeyword("DELETE", "UPDATE")) {
        next();
        next();
        if (accept("NO")) {
          expect("ACTION");
        } else if (accept("SET")) {
          if (!acceptAny("NULL", "DEFAULT")) throw error("Expected NULL or DEFAULT after SET");
        } else if (!acceptAny("CASCADE", "RESTRICT")) {
          throw error("Expected a referential action but found " + peek().describe());
        }
      }
      if (peek().isKeyword("NOT") && peek(1).isKeyword("FOR")) {
        next();
        next();
        expect("REPLICATION");
      }
    }

    // ---- CREATE INDEX ----

    private void parseCreateIndex() {
      boolean unique = accept("UNIQUE");
      boolean clustered = accept("CLUSTERED");
      if (!clustered) accept("NONCLUSTERED");
      expect("INDEX");
      String name = identifier("index name");
      expect("ON");
      QualifiedName table = qualifiedName();
      List<String> columns = columnList();
      // INCLUDE, WHERE and WITH clauses do not change the key columns
      model.indexes.add(new IndexDefinition(name, table, unique, clustered, false, columns));
    }

    // ---- CREATE VIEW ----

    private void parseCreateView(Token first) {
      QualifiedName name = qualifiedName();
      List<String> columns = peek().is(TokenType.LPAREN) ? columnList() : List.of();
      if (accept("WITH")) {
        while (!atEnd() && !peek().isKeyword("AS")) next();
      }
      expect("AS");
      if (atEnd()) throw error("View " + name + " has no query");
      String query = textBetween(pos, tokens.size() - 1);
      model.views.add(new ViewDefinition(name, columns, query, location(first)));
    }

    // ---- ALTER TABLE ----

    private void parseAlterTable(Token first) {
      QualifiedName name = qualifiedName();
      if (accept("WITH")) acceptAny("CHECK", "NOCHECK");
      if (!accept("ADD")) {
        log.debug("Skipping ALTER TABLE {} at {}", name, location(first));
        return;
      }
      TableDraft draft = new TableDraft(name);
      while (true) {
        if (accept("CONSTRAINT")) {
          parseTableConstraint(draft, identifier("constraint name"));
        } else if (startsTableConstraint()) {
          parseTableConstraint(draft, null);
        } else {
          parseColumn(draft);
        }
        if (!acceptToken(TokenType.COMMA)) break;
      }
      if (!atEnd()) throw error("Unexpected " + peek().describe() + " in ALTER TABLE " + name);
      model.alterations.add(new TableAlteration(name, draft.columns, draft.indexes, draft.foreignKeys, location(first)));
    }

    // ---- INSERT ----

    private void parseInsert(Token first) {
      accept("INTO");
      QualifiedName table = qualifiedName();
      List<String> columns = peek().is(TokenType.LPAREN) ? columnList() : List.of();
      if (!accept("VALUES")) {
        log.debug("Skipping INSERT into {} without a VALUES list at {}", table, location(first));
        return;
      }
      List<List<String>> rows = new ArrayList<>();
      do {
        Token rowStart = peek();
        expect(TokenType.LPAREN, "'(' before row values");
        List<String> row = new ArrayList<>();
        while (true) {
          row.add(parseLiteral());
          if (acceptToken(TokenType.COMMA)) continue;
          expect(TokenType.RPAREN, "')' after row values");
          break;
        }
        if (!columns.isEmpty() && row.size() != columns.size()) {
          throw new SqlParseException("Row has " + row.size() + " values but "
              + columns.size() + " columns are listed for " + table, rowStart);
        }
        rows.add(row);
      } while (acceptToken(TokenType.COMMA));
      if (!atEnd()) throw error("Unexpected " + peek().describe() + " after VALUES list");
      model.seedData.add(new SeedData(table, columns, rows, location(first)));
    }

    private String parseLiteral() {
      Token t = peek();
      if (t.is(TokenType.STRING)) {
        next();
        return t.text();
      }
      if (t.isKeyword("NULL")) {
        next();
        return null;
      }
      int start = pos;
      while (!atElementEnd()) {
        if (peek().is(TokenType.LPAREN)) skipGroup();
        else next();
      }
      if (pos == start) throw error("Expected a value but found " + peek().describe());
      return textBetween(start, pos);
    }

    // ---- shared helpers ----

    private QualifiedName qualifiedName() {
      List<String> parts = new ArrayList<>();
      parts.add(identifier("object name"));
      while (acceptToken(TokenType.DOT)) {
        parts.add(identifier("object name"));
      }
      if (parts.size() == 1) return QualifiedName.of(defaultSchema, parts.get(0));
      return QualifiedName.of(parts.get(parts.size() - 2), parts.get(parts.size() - 1));
    }

    private List<String> columnList() {
      expect(TokenType.LPAREN, "'(' before column list");
      List<String> columns = new ArrayList<>();
      while (true) {
        columns.add(identifier("column name"));
        acceptAny("ASC", "DESC");
        if (acceptToken(TokenType.COMMA)) continue;
        expect(TokenType.RPAREN, "')' after column list");
        return columns;
      }
    }

    private void skipGroup() {
      expect(TokenType.LPAREN, "'('");
      int depth = 1;
      while (depth > 0) {
        Token t = next();
        if (t.is(TokenType.EOF)) throw error("Unbalanced parentheses");
        if (t.is(TokenType.LPAREN)) depth++;
        if (t.is(TokenType.RPAREN)) depth--;
      }
    }

    private void skipToElementEnd() {
      int depth = 0;
      while (!atEnd()) {
        Token t = peek();
        if (depth == 0 && (t.is(TokenType.COMMA) || t.is(TokenType.RPAREN))) return;
        if (t.is(TokenType.LPAREN)) depth++;
        if (t.is(TokenType.RPAREN)) depth--;
        next();
      }
    }

    private boolean atElementEnd() {
      Token t = peek();
      return t.is(TokenType.COMMA) || t.is(TokenType.RPAREN) || t.is(TokenType.EOF);
    }

    private boolean atEnd() {
      return peek().is(TokenType.EOF);
    }

    private Token peek() {
      return peek(0);
    }

    private Token peek(int ahead) {
      int index = Math.min(pos + ahead, tokens.size() - 1);
      return tokens.get(index);
    }

    private Token next() {
      Token t = peek();
      if (pos < tokens.size() - 1) pos++;
      return t;
    }

    private boolean accept(String keyword) {
      if (peek().isKeyword(keyword)) {
        pos++;
        return true;
      }
      return false;
    }

    private boolean acceptAny(String... keywords) {
      if (peek().isKeyword(keywords)) {
        pos++;
        return true;
      }
      return false;
    }

    private boolean acceptToken(TokenType type) {
      if (peek().is(type)) {
        pos++;
        return true;
      }
      return false;
    }

    private void expect(String keyword) {
      if (!accept(keyword)) {
        throw error("Expected " + keyword + " but found " + peek().describe());
      }
    }

    private Token expect(TokenType type, String what) {
      if (!peek().is(type)) {
        throw error("Expected " + what + " but found " + peek().describe());
      }
      return next();
    }

    private String identifier(String what) {
      Token t = peek();
      if (!t.isName()) {
        throw error("Expected " + what + " but found " + t.describe());
      }
      next();
      return t.text();
    }

    private String textBetween(int from, int toExclusive) {
      if (toExclusive <= from) return "";
      return source.text().substring(tokens.get(from).start(), tokens.get(toExclusive - 1).end()).trim();
    }

    private SourceLocation location(Token t) {
      return new SourceLocation(source.name(), t.line(), t.column());
    }

    private SqlParseException error(String message) {
      return new SqlParseException(message, peek());
    }
  }
}
