package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.Diagnostic;
import co.sqlgen.core.model.SchemaSource;
import co.sqlgen.core.typemap.TypeMappingRule;
import co.sqlgen.core.typemap.TypeRuleLoader;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * CLI entry point for the SQL schema generator.
 *
 * Usage:
 *   java -jar codegen-java.jar --sql <file> [--sql <file> ...] --output <dir>
 *   java -jar codegen-java.jar --sql-dir <dir> --output <dir> [--config <json>] [--rules <json>]
 *       [--package <pkg>] [--no-default-rules]
 */
public class Main {

    static final String USAGE = "Usage: java -jar codegen-java.jar [--sql <file> ... | --sql-dir <dir>] --output <dir>"
        + " [--config <json>] [--rules <json>] [--package <pkg>] [--no-default-rules]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the generator and write its files. Returns the process exit code: 0 on success,
     * 1 when the arguments are wrong, an input cannot be read or generation fails.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<Path> sqlFiles = new ArrayList<>();
        Path sqlDir = null;
        Path configFile = null;
        Path rulesFile = null;
        String packageName = null;
        Path outputDir = null;
        boolean noDefaultRules = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--sql":
                        sqlFiles.add(Path.of(value(args, ++i)));
                        break;
                    case "--sql-dir":
                        sqlDir = Path.of(value(args, ++i));
                        break;
                    case "--config":
                        configFile = Path.of(value(args, ++i));
                        break;
                    case "--rules":
                        rulesFile = Path.of(value(args, ++i));
                        break;
                    case "--package":
                        packageName = value(args, ++i);
                        break;
                    case "--output":
                        outputDir = Path.of(value(args, ++i));
                        break;
                    case "--no-default-rules":
                        noDefaultRules = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        if ((sqlFiles.isEmpty() && sqlDir == null) || outputDir == null) {
            err.println(USAGE);
            return 1;
        }

        try {
            GeneratorConfig config = configFile != null ? GeneratorConfig.load(configFile) : GeneratorConfig.defaults();
            if (packageName != null) {
                config = config.withPackageName(packageName);
            }
            if (noDefaultRules) {
                config = config.withoutDefaultTypeRules();
            }
            List<TypeMappingRule> extraRules = rulesFile != null ? TypeRuleLoader.load(rulesFile) : List.of();

            List<SchemaSource> sources = new ArrayList<>();
            for (Path file : sqlFiles) {
                sources.add(new SchemaSource(file.toString(), Files.readString(file)));
            }
            if (sqlDir != null) {
                for (Path file : sqlFilesIn(sqlDir)) {
                    sources.add(new SchemaSource(file.toString(), Files.readString(file)));
                }
            }

            GenerationResult result = new SqlGenOrchestrator(config, extraRules,
                LoggerFactory.getLogger(Main.class)).generate(sources);
            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(diagnostic);
            }
            if (!result.succeeded()) {
                err.println("Generation failed with " + result.fatalDiagnostics().size() + " error(s)");
                return 1;
            }

            for (Map.Entry<String, String> artifact : result.artifacts().entrySet()) {
                Path target = outputDir.resolve(artifact.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, artifact.getValue());
            }

            // Output summary
            out.println("Generated " + result.artifacts().size() + " file(s) from " + sources.size()
                + " source(s) in " + outputDir);
            for (String name : result.artifacts().keySet()) {
                out.println("  - " + name);
            }
            return 0;
        } catch (IOException | UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static List<Path> sqlFilesIn(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        }
    }
}
