package org.metaconv.compiler.api;

/**
 * Error codes for everything that can go wrong in a compilation run.
 * This decouples test logic from message wording.
 */
public enum CompilerErrorCode {
    // region Per-expression (recovered)
    /** The upstream AST of one expression is malformed. */
    PARSE_INPUT_ERROR,
    /** No generation rule matches a normalized shape. */
    UNSUPPORTED_CONSTRUCT,
    // endregion

    // region Fatal
    /** Normalizer passes were applied out of tier order at a node. */
    PRECEDENCE_INVARIANT_VIOLATION,
    /** Two structurally different trees were assigned the same function name. */
    DUPLICATE_NAME_COLLISION,
    /** The corpus file could not be read or is not a list of expression records. */
    INVALID_CORPUS,
    /** An output artifact could not be written. */
    IO_ERROR_WRITING_OUTPUT,
    /** The emitted module does not compile. */
    GENERATED_SOURCE_INVALID,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
