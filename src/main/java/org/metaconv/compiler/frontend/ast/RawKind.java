package org.metaconv.compiler.frontend.ast;

/**
 * Kinds of raw nodes delivered by the upstream PPI parser.
 */
public enum RawKind {
    DOCUMENT,
    STATEMENT,
    /** A statement inside a structure, e.g. the contents of parentheses. */
    EXPRESSION,
    /** Compound statements ({@code if (...) {...}}); never normalized. */
    COMPOUND,
    /** {@code ( ... )} */
    LIST,
    /** {@code {...}} or {@code [...]} after a variable. */
    SUBSCRIPT,
    /** {@code { ... }} code block. */
    BLOCK,
    /** Anonymous array or hash constructor. */
    CONSTRUCTOR,
    /** Condition of a compound statement. */
    CONDITION,
    WORD,
    SYMBOL,
    /** Punctuation variables such as {@code $1} or {@code $_}. */
    MAGIC,
    CAST,
    OPERATOR,
    NUMBER,
    QUOTE_DOUBLE,
    QUOTE_SINGLE,
    REGEX_MATCH,
    REGEX_SUBSTITUTE,
    TRANSLITERATE,
    /** Structural punctuation, in practice the statement separator {@code ;}. */
    STRUCTURE,
    /** A comma-composed argument list built during normalization. */
    ARGUMENTS;

    /**
     * @return {@code true} for nodes whose children form an operator/operand run.
     */
    public boolean isSequence() {
        return this == STATEMENT || this == EXPRESSION || this == SUBSCRIPT || this == CONDITION;
    }

    /**
     * @return {@code true} for leaf tokens.
     */
    public boolean isToken() {
        return ordinal() >= WORD.ordinal() && ordinal() <= STRUCTURE.ordinal();
    }
}
