package org.metaconv.compiler.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One input expression as delivered by the upstream parser. The AST stays in its JSON form until the
 * expression is compiled, so a malformed tree only affects its own expression.
 *
 * @param context The calling convention.
 * @param originalText The Perl source text.
 * @param parsedAst The PPI tree as JSON.
 * @param usage Where the expression is used, or {@code null} if unknown.
 */
public record ExpressionRecord(ExpressionContext context, String originalText, JsonNode parsedAst, UsageSite usage) {
    public ExpressionRecord {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        if (originalText == null) {
            throw new IllegalArgumentException("originalText must not be null");
        }
    }
}
