package org.metaconv.compiler.diagnostics;

import org.metaconv.compiler.api.ExpressionContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Collects per-expression diagnostics of a compilation run.
 * <p>
 * This decouples problem reporting from the compiler logic. Safe for concurrent reporting.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new CopyOnWriteArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param context      The calling convention of the expression.
     * @param originalText The expression text.
     */
    public void reportError(String message, ExpressionContext context, String originalText) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, context, originalText));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable snapshot of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
