package org.metaconv.compiler.api;

/**
 * How a registered expression ended up in the emitted module.
 */
public enum FunctionOutcome {
    /** Code was generated from the normalized tree. */
    GENERATED,
    /** The expression could not be translated and delegates to a configured hand-written method. */
    MANUAL,
    /** A context default was emitted because no generation rule matched or the input was malformed. */
    FALLBACK
}
