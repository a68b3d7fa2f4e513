package org.metaconv.compiler.api;

/**
 * Thrown when a compilation run has to be aborted.
 * <p>
 * Per-expression problems never abort a run; they become fallback functions. This exception carries
 * compiler defects (broken invariants) and I/O failures.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * @param errorCode The reason for the abort.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * @param errorCode The reason for the abort.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}
