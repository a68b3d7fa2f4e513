package org.metaconv.compiler.frontend.ast;

/**
 * {@code body if condition} or, when negated, {@code body unless condition}.
 */
public record PostfixConditional(NormalizedNode body, NormalizedNode condition, boolean negated) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
