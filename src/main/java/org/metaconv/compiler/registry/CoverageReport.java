package org.metaconv.compiler.registry;

import org.metaconv.compiler.api.ExpressionContext;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-run statistics: how many expressions got a generated function, how many are served by a
 * manual implementation and which ones fell back. Coverage counts generated functions only.
 *
 * @param contexts Counters per calling convention; every context is present.
 * @param fallbacks One entry per fallback expression, sorted by context and text.
 */
public record CoverageReport(Map<ExpressionContext, ContextStats> contexts, List<FallbackEntry> fallbacks) {

    public CoverageReport {
        Map<ExpressionContext, ContextStats> complete = new EnumMap<>(ExpressionContext.class);
        for (ExpressionContext context : ExpressionContext.values()) {
            complete.put(context, contexts.getOrDefault(context, ContextStats.EMPTY));
        }
        contexts = Map.copyOf(complete);
        fallbacks = List.copyOf(fallbacks);
    }

    /**
     * @param total Expressions registered.
     * @param generated Expressions served by a generated function.
     * @param manual Expressions served by a delegate to a manual implementation.
     * @param fallback Expressions served by a fallback function.
     * @param distinctFunctions Distinct functions after deduplication.
     */
    public record ContextStats(int total, int generated, int manual, int fallback, int distinctFunctions) {
        public static final ContextStats EMPTY = new ContextStats(0, 0, 0, 0, 0);
    }

    /**
     * @param context The calling convention.
     * @param originalText The Perl text that fell back.
     * @param functionName The fallback function serving it.
     * @param reason Why no function could be generated.
     */
    public record FallbackEntry(ExpressionContext context, String originalText, String functionName, String reason) {
    }

    public ContextStats stats(ExpressionContext context) {
        return contexts.get(context);
    }

    public int total() {
        return contexts.values().stream().mapToInt(ContextStats::total).sum();
    }

    public int generated() {
        return contexts.values().stream().mapToInt(ContextStats::generated).sum();
    }

    public int manual() {
        return contexts.values().stream().mapToInt(ContextStats::manual).sum();
    }

    public int fallback() {
        return contexts.values().stream().mapToInt(ContextStats::fallback).sum();
    }

    /**
     * @return The share of expressions with a generated function, 1.0 for an empty run.
     */
    public double coverage() {
        int total = total();
        return total == 0 ? 1.0 : (double) generated() / total;
    }
}
