package org.metaconv.compiler.frontend.normalize;

/**
 * Coarse binding strength of a normalizer pass. At every node all {@link #HIGH} passes run before any
 * {@link #MEDIUM} pass, which run before any {@link #LOW} pass.
 */
public enum PrecedenceTier {
    /** Terms, function calls and named unary operators, and every binary operator tighter than {@code ?:}. */
    HIGH,
    /** The conditional operator and its idioms. */
    MEDIUM,
    /** Comma lists, rightward list operators, word logical operators and statement modifiers. */
    LOW
}
