package org.metaconv.compiler.api;

/**
 * A function of the emitted module.
 *
 * @param name The Java method name.
 * @param context The calling convention.
 * @param source The complete method source, including its leading comment.
 * @param outcome Whether the body was generated, delegates to a manual implementation or is a fallback.
 * @param originalText The Perl text of the first expression registered under this name.
 * @param reason Why no code was generated, or {@code null} for generated functions.
 */
public record GeneratedFunction(
        String name,
        ExpressionContext context,
        String source,
        FunctionOutcome outcome,
        String originalText,
        String reason
) {
}
