package co.sqlgen.generators.java;

import co.sqlgen.core.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one generation run.
 *
 * @param artifacts file name to generated source, sorted by name; empty when the run failed
 * @param diagnostics every diagnostic of the run in the order the phases reported them
 */
public record GenerationResult(SortedMap<String, String> artifacts, List<Diagnostic> diagnostics) {

    public GenerationResult {
        artifacts = Collections.unmodifiableSortedMap(new TreeMap<>(artifacts));
        diagnostics = List.copyOf(diagnostics);
    }

    static GenerationResult success(Map<String, String> artifacts, List<Diagnostic> diagnostics) {
        return new GenerationResult(new TreeMap<>(artifacts), diagnostics);
    }

    static GenerationResult failure(List<Diagnostic> diagnostics) {
        return new GenerationResult(new TreeMap<>(), diagnostics);
    }

    public boolean succeeded() {
        return diagnostics.stream().noneMatch(Diagnostic::isFatal);
    }

    public List<Diagnostic> fatalDiagnostics() {
        return diagnostics.stream().filter(Diagnostic::isFatal).toList();
    }
}
