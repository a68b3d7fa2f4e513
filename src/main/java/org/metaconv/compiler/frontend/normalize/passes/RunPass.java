package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NormalizerPass;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

/**
 * Base for passes that rewrite the operator/operand run of a statement, expression or subscript.
 */
abstract class RunPass implements NormalizerPass {

    private final PrecedenceTier tier;

    RunPass(PrecedenceTier tier) {
        this.tier = tier;
    }

    @Override
    public final PrecedenceTier tier() {
        return tier;
    }

    @Override
    public final AstNode apply(AstNode node) {
        if (node instanceof RawNode raw && raw.kind().isSequence() && !raw.children().isEmpty()) {
            return rewrite(raw);
        }
        return node;
    }

    /**
     * @param run A raw sequence node with at least one child.
     * @return The rewritten node, or {@code run} when nothing matched.
     */
    protected abstract RawNode rewrite(RawNode run);
}
