package org.metaconv.runtime;

/**
 * Lazily evaluated operand of a short-circuiting operator.
 */
@FunctionalInterface
public interface ValueSupplier {
    TagValue get() throws ExpressionException;
}
