package org.metaconv.compiler.frontend.normalize;

import org.metaconv.compiler.frontend.ast.AstNode;

/**
 * A stateless rewrite rule recognizing one canonical construct.
 * <p>
 * A pass may read the node it is given and that node's direct children; the items of a direct
 * {@code ARGUMENTS} or {@code STATEMENT} child count as direct. It never recurses. When its pattern does not
 * match it returns the very same instance.
 */
public interface NormalizerPass {

    /**
     * @return The tier deciding when this pass runs relative to the others at a node.
     */
    PrecedenceTier tier();

    /**
     * @param node A node whose children are already normalized as far as possible.
     * @return The rewritten node, or {@code node} itself when the pattern does not match.
     */
    AstNode apply(AstNode node);

    default String name() {
        return getClass().getSimpleName();
    }
}
