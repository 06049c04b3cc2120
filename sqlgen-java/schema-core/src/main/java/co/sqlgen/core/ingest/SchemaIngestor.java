package co.sqlgen.core.ingest;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.model.RawSchemaModel;
import co.sqlgen.core.model.SchemaSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * First pipeline phase: parses every schema source into its own raw model.
 *
 * <p>Sources share no state, so they are parsed concurrently. Models and diagnostics
 * come back in input order whatever order the parses finish in, which keeps the run
 * deterministic. Parse errors do not stop other sources; they are returned as fatal
 * diagnostics for the orchestrator to act on.
 */
public final class SchemaIngestor {

  private static final Logger log = LoggerFactory.getLogger(SchemaIngestor.class);

  private final SqlSchemaParser parser;

  public SchemaIngestor(String defaultSchema) {
    this(new SqlSchemaParser(defaultSchema));
  }

  public SchemaIngestor(SqlSchemaParser parser) {
    this.parser = parser;
  }

  public PhaseResult<List<RawSchemaModel>> ingest(List<SchemaSource> sources) {
    List<PhaseResult<RawSchemaModel>> parsed = sources.parallelStream()
        .map(parser::parse)
        .toList();

    List<RawSchemaModel> models = new ArrayList<>(parsed.size());
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (PhaseResult<RawSchemaModel> result : parsed) {
      models.add(result.value());
      diagnostics.addAll(result.diagnostics());
    }
    log.debug("Ingested {} sources with {} diagnostics", sources.size(), diagnostics.size());
    return PhaseResult.of(models, diagnostics);
  }
}
