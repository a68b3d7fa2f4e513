package org.metaconv.compiler.frontend.ast;

import java.util.List;

/**
 * A call of a Perl builtin or named function. Logical negation ({@code !}, {@code not}) is the call {@code not}.
 *
 * @param name The function name as written.
 * @param args The arguments in order.
 */
public record FunctionCall(String name, List<NormalizedNode> args) implements NormalizedNode {
    public FunctionCall {
        args = List.copyOf(args);
    }

    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
