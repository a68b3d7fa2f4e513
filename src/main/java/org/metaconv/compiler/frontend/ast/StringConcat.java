package org.metaconv.compiler.frontend.ast;

import java.util.List;

/**
 * An n-ary string concatenation. Chains {@code a . b . c} and interpolated strings collapse into one node.
 *
 * @param parts The concatenated values in order.
 */
public record StringConcat(List<NormalizedNode> parts) implements NormalizedNode {
    public StringConcat {
        parts = List.copyOf(parts);
    }

    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
