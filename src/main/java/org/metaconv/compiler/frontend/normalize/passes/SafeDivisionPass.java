package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.SafeDivision;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * The guard idiom {@code $x ? N / $x : 0}. Must run before {@link TernaryPass}, which would
 * otherwise claim the same tokens as a plain conditional.
 */
public final class SafeDivisionPass extends RunPass {

    public SafeDivisionPass() {
        super(PrecedenceTier.MEDIUM);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        for (int i = current.children().size() - 5; i >= 0; i--) {
            List<AstNode> children = current.children();
            if (!(children.get(i) instanceof Symbol divisor)
                    || !NodeRuns.isOperator(children.get(i + 1), "?")
                    || !(children.get(i + 2) instanceof BinaryOp division)
                    || !division.operator().equals("/")
                    || !division.right().equals(divisor)
                    || !NodeRuns.isOperator(children.get(i + 3), ":")
                    || !(children.get(i + 4) instanceof Literal zero)
                    || !zero.isNumber("0")) {
                continue;
            }
            // a trailing '?' makes the 0 the condition of a nested conditional
            boolean rightFree = i + 5 == children.size()
                    || (!NodeRuns.isOperator(children.get(i + 5), "?")
                    && NodeRuns.rightBoundary(children, i + 4, PerlOperators.CONDITIONAL + 1));
            if (rightFree && NodeRuns.leftBoundary(children, i, PerlOperators.CONDITIONAL + 1)) {
                current = current.replace(i, i + 5, new SafeDivision(division.left(), divisor));
            }
        }
        return current;
    }
}
