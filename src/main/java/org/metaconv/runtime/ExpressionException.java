package org.metaconv.runtime;

/**
 * Raised by generated value transforms and by {@link Builtins} when an operation has no
 * meaningful result for its operands, e.g. arithmetic on a non-numeric string or a division by zero.
 */
public class ExpressionException extends Exception {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
