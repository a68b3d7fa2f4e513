package org.metaconv.compiler.frontend.ast;

/**
 * A binary operator application. Word operators are canonicalized: {@code and} is {@code &&}, {@code or} is {@code ||}.
 *
 * @param operator The Perl operator text.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOp(String operator, NormalizedNode left, NormalizedNode right) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
