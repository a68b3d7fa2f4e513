package org.metaconv.compiler.diagnostics;

import org.metaconv.compiler.api.ExpressionContext;

/**
 * Represents a single diagnostic message about one expression of the corpus.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param context The calling convention of the expression.
 * @param originalText The Perl text of the expression.
 */
public record Diagnostic(
        Type type,
        String message,
        ExpressionContext context,
        String originalText
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** The expression could not be compiled and is served by a fallback. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s '%s': %s", type, context, originalText, message);
    }
}
