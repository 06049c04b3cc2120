package co.sqlgen.core.refine;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.ingest.SqlSchemaParser;
import co.sqlgen.core.model.ColumnDefinition;
import co.sqlgen.core.model.ForeignKeyReference;
import co.sqlgen.core.model.IndexDefinition;
import co.sqlgen.core.model.QualifiedName;
import co.sqlgen.core.model.RawSchemaModel;
import co.sqlgen.core.model.RefinedSchema;
import co.sqlgen.core.model.SchemaSource;
import co.sqlgen.core.model.TableDefinition;
import co.sqlgen.core.model.ViewDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SchemaRefinerTest {

  private final SqlSchemaParser parser = new SqlSchemaParser("dbo");
  private final SchemaRefiner refiner = new SchemaRefiner();

  private PhaseResult<RefinedSchema> refine(String... sources) {
    List<RawSchemaModel> models = new ArrayList<>();
    for (int i = 0; i < sources.length; i++) {
      PhaseResult<RawSchemaModel> parsed = parser.parse(new SchemaSource("s" + i + ".sql", sources[i]));
      assertThat(parsed.diagnostics()).as("parse diagnostics of s%d.sql", i).isEmpty();
      models.add(parsed.value());
    }
    return refiner.refine(models);
  }

  private static TableDefinition table(RefinedSchema schema, String name) {
    return schema.table(QualifiedName.of("dbo", name)).orElseThrow();
  }

  @Test
  void shouldResolveForeignKeysAcrossSources() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Users (Id INT PRIMARY KEY, Username NVARCHAR(50), Email NVARCHAR(255));",
        "CREATE TABLE Orders (Id INT PRIMARY KEY, UserId INT REFERENCES users(id), Total DECIMAL(10,2));");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.value().tables()).extracting(t -> t.name().name()).containsExactly("Users", "Orders");
    ForeignKeyReference fk = table(result.value(), "Orders").foreignKeys().get(0);
    assertThat(fk.targetTable().name()).isEqualTo("Users");
    assertThat(fk.targetColumn()).isEqualTo("Id");
  }

  @Test
  void shouldResolveReferenceWithoutColumnToSinglePrimaryKey() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Users (UserKey INT PRIMARY KEY, Name NVARCHAR(50));",
        "CREATE TABLE Orders (Id INT PRIMARY KEY, UserId INT REFERENCES Users);");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(table(result.value(), "Orders").foreignKeys().get(0).targetColumn()).isEqualTo("UserKey");
  }

  @Test
  void shouldReportReferenceWithoutColumnWhenTargetHasCompositeKey() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Pairs (A INT, B INT, PRIMARY KEY (A, B));",
        "CREATE TABLE Refs (Id INT, PairA INT REFERENCES Pairs);");

    assertThat(result.value()).isNull();
    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.REFERENCE_ERROR);
      assertThat(d.message()).contains("single-column primary key");
    });
  }

  @Test
  void shouldReportEveryUnresolvedForeignKey() {
    PhaseResult<RefinedSchema> result = refine("""
        CREATE TABLE Users (Id INT PRIMARY KEY);
        CREATE TABLE Orders (
          Id INT PRIMARY KEY,
          UserId INT REFERENCES Users(Missing),
          ShopId INT REFERENCES Shops(Id)
        );
        """);

    assertThat(result.hasFatal()).isTrue();
    assertThat(result.value()).isNull();
    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.REFERENCE_ERROR, DiagnosticKind.REFERENCE_ERROR);
    assertThat(result.diagnostics().get(0).message()).contains("dbo.Users.Missing");
    assertThat(result.diagnostics().get(1).message()).contains("unknown table dbo.Shops");
  }

  @Test
  void shouldReportDuplicateTableAndKeepFirstLocation() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Users (Id INT);",
        "CREATE TABLE dbo.USERS (Id INT);");

    assertThat(result.value()).isNull();
    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DEFINITION);
      assertThat(d.location().source()).isEqualTo("s1.sql");
      assertThat(d.message()).contains("already declared at s0.sql:1:1");
    });
  }

  @Test
  void shouldReportViewNamedLikeTable() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Report (Id INT);\nCREATE VIEW Report AS SELECT 1 AS One;");

    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.DUPLICATE_DEFINITION);
  }

  @Test
  void shouldReportDuplicateColumn() {
    PhaseResult<RefinedSchema> result = refine("CREATE TABLE T (Id INT, id BIGINT);");

    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DEFINITION);
      assertThat(d.message()).contains("Column id");
    });
  }

  @Test
  void shouldSkipReferenceResolutionWhenMergeFails() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Users (Id INT PRIMARY KEY);",
        "CREATE TABLE Users (Id INT PRIMARY KEY);\nCREATE TABLE Orders (UserId INT REFERENCES Ghosts(Id));");

    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.DUPLICATE_DEFINITION);
  }

  @Test
  void shouldApplyAlterationsFromAnotherSource() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE Users (Id INT NOT NULL, Name NVARCHAR(50));",
        """
        ALTER TABLE Users ADD CONSTRAINT PK_Users PRIMARY KEY (Id);
        ALTER TABLE Users ADD Notes NVARCHAR(MAX) NULL, Score INT;
        """);

    assertThat(result.diagnostics()).isEmpty();
    TableDefinition users = table(result.value(), "Users");
    assertThat(users.columns()).extracting(ColumnDefinition::name).containsExactly("Id", "Name", "Notes", "Score");
    assertThat(users.columns()).extracting(ColumnDefinition::ordinal).containsExactly(0, 1, 2, 3);
    assertThat(users.primaryKeyColumns()).extracting(ColumnDefinition::name).containsExactly("Id");
    assertThat(users.indexes()).extracting(IndexDefinition::name).containsExactly("PK_Users");
  }

  @Test
  void shouldReportAlterationOfUnknownTable() {
    PhaseResult<RefinedSchema> result = refine("ALTER TABLE Nowhere ADD Notes NVARCHAR(10);");

    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.REFERENCE_ERROR);
      assertThat(d.message()).contains("dbo.Nowhere");
    });
  }

  @Test
  void shouldKeepOneIndexWhenDeclaredTwiceUnderDifferentNames() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE T (Id INT PRIMARY KEY, Name NVARCHAR(50));\nCREATE INDEX IX_A ON T (Name);",
        "CREATE INDEX IX_B ON dbo.t (name);\nCREATE UNIQUE INDEX UX_T_Name ON T (Name);");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(table(result.value(), "T").indexes()).extracting(IndexDefinition::name)
        .containsExactly("IX_A", "UX_T_Name");
  }

  @Test
  void shouldReportIndexOnMissingColumn() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE T (Id INT);\nCREATE INDEX IX_T_Ghost ON T (Ghost);");

    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_INDEX);
      assertThat(d.message()).contains("IX_T_Ghost").contains("Ghost");
    });
  }

  @Test
  void shouldReportPrimaryKeyIndexDisagreeingWithColumnFlags() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE T (Id INT PRIMARY KEY, Code INT, CONSTRAINT PK_T PRIMARY KEY (Code));");

    assertThat(result.diagnostics()).singleElement().satisfies(d -> {
      assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_INDEX);
      assertThat(d.message()).contains("PK_T").contains("[Code]").contains("[Id, Code]");
    });
  }

  @Test
  void shouldAttachAndValidateSeedData() {
    PhaseResult<RefinedSchema> ok = refine(
        "CREATE TABLE Status (Id INT PRIMARY KEY, Name NVARCHAR(20));",
        "INSERT INTO Status VALUES (1, 'Open'), (2, 'Closed');");
    assertThat(ok.diagnostics()).isEmpty();
    assertThat(ok.value().seedData(QualifiedName.of("DBO", "status"))).singleElement()
        .satisfies(s -> assertThat(s.rows()).hasSize(2));

    PhaseResult<RefinedSchema> bad = refine(
        "CREATE TABLE Status (Id INT PRIMARY KEY, Name NVARCHAR(20));",
        "INSERT INTO Status (Id, Label) VALUES (1, 'Open');\nINSERT INTO Status VALUES (2);\nINSERT INTO Ghost VALUES (1);");
    assertThat(bad.diagnostics()).extracting(Diagnostic::kind).containsOnly(DiagnosticKind.REFERENCE_ERROR);
    assertThat(bad.diagnostics()).extracting(Diagnostic::message).anySatisfy(m -> assertThat(m).contains("Label"));
    assertThat(bad.diagnostics()).extracting(Diagnostic::message).anySatisfy(m -> assertThat(m).contains("1 values"));
    assertThat(bad.diagnostics()).extracting(Diagnostic::message).anySatisfy(m -> assertThat(m).contains("dbo.Ghost"));
  }

  @Test
  void shouldCarryViewQueryTextWithoutDerivingColumns() {
    PhaseResult<RefinedSchema> result = refine(
        """
        CREATE TABLE dbo.Users (Id INT PRIMARY KEY, Email NVARCHAR(255) NULL);
        """,
        """
        CREATE VIEW dbo.ActiveUsers AS
        SELECT u.Id, u.Email AS Mail
        FROM dbo.Users u;
        """);

    assertThat(result.diagnostics()).isEmpty();
    ViewDefinition view = result.value().views().get(0);
    assertThat(view.columns()).isEmpty();
    assertThat(view.queryText()).contains("u.Email AS Mail", "FROM dbo.Users u");
  }

  @Test
  void shouldKeepDeclaredViewColumnsWhenSelectingStar() {
    PhaseResult<RefinedSchema> result = refine(
        "CREATE TABLE T (Id INT);\nCREATE VIEW V (Key1, Key2) AS SELECT * FROM T;");

    List<ColumnDefinition> columns = result.value().views().get(0).columns();
    assertThat(columns).extracting(ColumnDefinition::name).containsExactly("Key1", "Key2");
    assertThat(columns).allSatisfy(c -> {
      assertThat(c.type().isUnknown()).isTrue();
      assertThat(c.nullable()).isTrue();
    });
  }
}
