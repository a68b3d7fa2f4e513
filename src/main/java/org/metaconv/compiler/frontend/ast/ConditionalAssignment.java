package org.metaconv.compiler.frontend.ast;

/**
 * The two-statement idiom {@code COND and $val OP= VALUE; RESULT}: the target is updated when the
 * condition holds, then the result is evaluated with the updated target.
 *
 * @param condition The guard.
 * @param target The assigned variable.
 * @param operator The binary operator of a compound assignment ({@code -} for {@code -=}), or {@code =}.
 * @param value The assigned or combined value.
 * @param result The expression returned afterwards.
 */
public record ConditionalAssignment(
        NormalizedNode condition,
        Symbol target,
        String operator,
        NormalizedNode value,
        NormalizedNode result
) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
