package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.Ternary;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * {@code C ? A : B}. The conditional operator is right-associative, so the rightmost {@code ?} is folded first.
 */
public final class TernaryPass extends RunPass {

    public TernaryPass() {
        super(PrecedenceTier.MEDIUM);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<AstNode> children = current.children();
            for (int q = children.size() - 4; q >= 1; q--) {
                if (!NodeRuns.isOperator(children.get(q), "?")
                        || !(children.get(q - 1) instanceof NormalizedNode condition)
                        || !(children.get(q + 1) instanceof NormalizedNode ifTrue)
                        || !NodeRuns.isOperator(children.get(q + 2), ":")
                        || !(children.get(q + 3) instanceof NormalizedNode ifFalse)) {
                    continue;
                }
                if (NodeRuns.leftBoundary(children, q - 1, PerlOperators.CONDITIONAL + 1)
                        && NodeRuns.rightBoundary(children, q + 3, PerlOperators.CONDITIONAL + 1)) {
                    current = current.replace(q - 1, q + 4, new Ternary(condition, ifTrue, ifFalse));
                    changed = true;
                    break;
                }
            }
        }
        return current;
    }
}
