package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.diagnostics.DiagnosticKind;
import co.sqlgen.core.diagnostics.PhaseResult;
import co.sqlgen.core.ingest.SchemaIngestor;
import co.sqlgen.core.model.RawSchemaModel;
import co.sqlgen.core.model.RefinedSchema;
import co.sqlgen.core.model.SchemaSource;
import co.sqlgen.core.refine.SchemaRefiner;
import co.sqlgen.core.typemap.TypeMapper;
import co.sqlgen.core.typemap.TypeMappingRule;
import co.sqlgen.core.typemap.TypeRuleLoader;
import co.sqlgen.generators.java.model.GeneratedArtifact;
import co.sqlgen.generators.java.model.TargetEntityModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Runs the pipeline: ingest, refine, transform, generate.
 *
 * <p>Each phase reports diagnostics; the run stops before the next phase as soon as one
 * of them is fatal. Cancellation is checked between phases only. Type rules apply in
 * this order: rules from the configuration, the extra rules given to the constructor,
 * then the bundled {@code default-type-rules.json} unless the configuration turns them off.
 * Earlier rules win ties.
 */
public class SqlGenOrchestrator {

    static final String DEFAULT_RULES_RESOURCE = "/default-type-rules.json";

    private final GeneratorConfig config;
    private final List<TypeMappingRule> rules;
    private final Logger log;

    public SqlGenOrchestrator(GeneratorConfig config) {
        this(config, List.of(), LoggerFactory.getLogger(SqlGenOrchestrator.class));
    }

    public SqlGenOrchestrator(GeneratorConfig config, List<TypeMappingRule> extraRules, Logger log) {
        this.config = config;
        this.log = log;
        List<TypeMappingRule> all = new ArrayList<>(config.typeRules());
        all.addAll(extraRules);
        if (config.useDefaultTypeRules()) {
            all.addAll(defaultTypeRules());
        }
        this.rules = List.copyOf(all);
    }

    /** The rules shipped with the generator, mapping SQL Server types to Java types. */
    public static List<TypeMappingRule> defaultTypeRules() {
        try (InputStream in = SqlGenOrchestrator.class.getResourceAsStream(DEFAULT_RULES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULT_RULES_RESOURCE);
            }
            return TypeRuleLoader.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RULES_RESOURCE, e);
        }
    }

    public List<TypeMappingRule> rules() {
        return rules;
    }

    public GenerationResult generate(List<SchemaSource> sources) {
        return generate(sources, () -> false);
    }

    public GenerationResult generate(List<SchemaSource> sources, BooleanSupplier cancelled) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (halted("ingestion", cancelled, diagnostics)) return GenerationResult.failure(diagnostics);
        log.info("Phase 1: Ingesting SQL schema...");
        PhaseResult<List<RawSchemaModel>> raw = new SchemaIngestor(config.defaultSchema()).ingest(sources);
        diagnostics.addAll(raw.diagnostics());
        if (failed(raw, diagnostics)) return GenerationResult.failure(diagnostics);

        if (halted("refinement", cancelled, diagnostics)) return GenerationResult.failure(diagnostics);
        log.info("Phase 2: Refining schema model...");
        PhaseResult<RefinedSchema> refined = new SchemaRefiner().refine(raw.value());
        diagnostics.addAll(refined.diagnostics());
        if (failed(refined, diagnostics)) return GenerationResult.failure(diagnostics);
        log.info("Found {} tables and {} views", refined.value().tables().size(), refined.value().views().size());

        if (halted("transformation", cancelled, diagnostics)) return GenerationResult.failure(diagnostics);
        log.info("Phase 3: Transforming to Java model...");
        PhaseResult<TypeMapper> mapper = TypeMapper.compile(rules);
        diagnostics.addAll(mapper.diagnostics());
        PhaseResult<List<TargetEntityModel>> entities =
            new ModelTransformer(config, mapper.value()).transform(refined.value());
        diagnostics.addAll(entities.diagnostics());
        if (failed(entities, diagnostics)) return GenerationResult.failure(diagnostics);

        if (halted("generation", cancelled, diagnostics)) return GenerationResult.failure(diagnostics);
        log.info("Phase 4: Generating Java code...");
        PhaseResult<List<GeneratedArtifact>> artifacts = new JavaGenerator().generate(entities.value());
        diagnostics.addAll(artifacts.diagnostics());
        if (failed(artifacts, diagnostics)) return GenerationResult.failure(diagnostics);

        Map<String, String> output = new LinkedHashMap<>();
        for (GeneratedArtifact artifact : artifacts.value()) {
            output.put(artifact.name(), artifact.content());
        }
        long warnings = diagnostics.size();
        if (warnings > 0) {
            log.warn("Generated {} files with {} warnings", output.size(), warnings);
        } else {
            log.info("Generated {} files", output.size());
        }
        return GenerationResult.success(output, diagnostics);
    }

    private boolean halted(String phase, BooleanSupplier cancelled, List<Diagnostic> diagnostics) {
        if (!cancelled.getAsBoolean()) return false;
        log.warn("Generation cancelled before {}", phase);
        diagnostics.add(Diagnostic.of(DiagnosticKind.CANCELLED, "Generation cancelled before " + phase));
        return true;
    }

    private boolean failed(PhaseResult<?> result, List<Diagnostic> diagnostics) {
        if (!result.hasFatal()) return false;
        long fatal = result.diagnostics().stream().filter(Diagnostic::isFatal).count();
        log.error("Stopping after {} fatal diagnostics ({} in total)", fatal, diagnostics.size());
        return true;
    }
}
