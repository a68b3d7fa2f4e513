package org.metaconv.compiler.api;

import java.util.Locale;

/**
 * The calling convention a generated function must satisfy. Fixed per expression at registration time.
 */
public enum ExpressionContext {
    /** {@code TagValue f(TagValue val) throws ExpressionException}: converts a raw value. */
    VALUE_TRANSFORM("value"),
    /** {@code String f(TagValue val)}: formats a value for display; never fails. */
    DISPLAY_FORMAT("print"),
    /** {@code boolean f(TagValue val, EvalContext ctx)}: selects an optional processing path; never fails. */
    BOOLEAN_GATE("condition");

    private final String functionPrefix;

    ExpressionContext(String functionPrefix) {
        this.functionPrefix = functionPrefix;
    }

    /**
     * @return The prefix of generated function names for this context.
     */
    public String functionPrefix() {
        return functionPrefix;
    }

    /**
     * Resolves the expression type names used by corpus files. Both the calling-convention names and
     * the tag-table attribute names are accepted ({@code ValueConv}, {@code PrintConv}, {@code Condition}).
     *
     * @param name The expression type as written in the input.
     * @return The context.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ExpressionContext fromInput(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Missing expression type");
        }
        return switch (name.replace("_", "").toLowerCase(Locale.ROOT)) {
            case "valuetransform", "valueconv", "rawconv" -> VALUE_TRANSFORM;
            case "displayformat", "printconv" -> DISPLAY_FORMAT;
            case "booleangate", "condition" -> BOOLEAN_GATE;
            default -> throw new IllegalArgumentException("Unknown expression type: " + name);
        };
    }
}
