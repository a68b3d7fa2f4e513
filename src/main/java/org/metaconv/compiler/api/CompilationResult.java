package org.metaconv.compiler.api;

import org.metaconv.compiler.registry.CoverageReport;

import java.util.List;

/**
 * Everything a run produces, drained from the registry once at the end.
 *
 * @param functions All distinct functions, sorted by name.
 * @param lookup The call-site lookup table, sorted by context and original text.
 * @param report Coverage statistics.
 */
public record CompilationResult(List<GeneratedFunction> functions, List<LookupEntry> lookup, CoverageReport report) {
    public CompilationResult {
        functions = List.copyOf(functions);
        lookup = List.copyOf(lookup);
    }

    /**
     * @return The name of the function implementing {@code originalText} in {@code context}, or {@code null}.
     */
    public String functionFor(String originalText, ExpressionContext context) {
        return lookup.stream()
                .filter(e -> e.context() == context && e.originalText().equals(originalText))
                .map(LookupEntry::functionName)
                .findFirst()
                .orElse(null);
    }
}
