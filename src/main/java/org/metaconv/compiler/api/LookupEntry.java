package org.metaconv.compiler.api;

import java.util.List;

/**
 * One row of the call-site lookup table consumed by the runtime dispatcher.
 *
 * @param originalText The Perl source text as it appears in the tag table.
 * @param context The calling convention.
 * @param functionName The generated function that implements it.
 * @param usages The tag-table locations using this exact text.
 */
public record LookupEntry(String originalText, ExpressionContext context, String functionName, List<UsageSite> usages) {
    public LookupEntry {
        usages = usages != null ? List.copyOf(usages) : List.of();
    }
}
