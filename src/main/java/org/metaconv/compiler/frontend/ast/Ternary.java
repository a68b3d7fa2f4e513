package org.metaconv.compiler.frontend.ast;

/**
 * {@code condition ? ifTrue : ifFalse}
 */
public record Ternary(NormalizedNode condition, NormalizedNode ifTrue, NormalizedNode ifFalse) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
