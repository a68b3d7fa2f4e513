package org.metaconv.compiler.api;

import org.metaconv.compiler.frontend.ast.NormalizedNode;

/**
 * A normalized expression ready for registration.
 *
 * @param originalText The Perl source text.
 * @param context The calling convention.
 * @param normalizedAst The normalized tree.
 */
public record FunctionSpec(String originalText, ExpressionContext context, NormalizedNode normalizedAst) {
}
