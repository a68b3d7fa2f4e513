package org.metaconv.compiler.frontend.ast;

/**
 * The guarded division idiom {@code $v ? N / $v : 0}. The divisor is only used when it is true,
 * so the division can never be by zero.
 *
 * @param numerator The dividend.
 * @param divisor The guard and divisor.
 */
public record SafeDivision(NormalizedNode numerator, NormalizedNode divisor) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
