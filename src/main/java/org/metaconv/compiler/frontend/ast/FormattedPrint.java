package org.metaconv.compiler.frontend.ast;

import java.util.List;

/**
 * {@code sprintf(format, args...)}.
 *
 * @param format The format string expression.
 * @param args The values to format, in list context.
 */
public record FormattedPrint(NormalizedNode format, List<NormalizedNode> args) implements NormalizedNode {
    public FormattedPrint {
        args = List.copyOf(args);
    }

    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
