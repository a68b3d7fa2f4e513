package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.StringRepeat;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * {@code STRING x COUNT} where no tighter operator reaches into either operand.
 */
public final class StringRepeatPass extends RunPass {

    private static final int PRECEDENCE = PerlOperators.binaryPrecedence("x");

    public StringRepeatPass() {
        super(PrecedenceTier.HIGH);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<AstNode> children = current.children();
            for (int i = 1; i + 1 < children.size(); i++) {
                if (!NodeRuns.isOperator(children.get(i), "x")
                        || !(children.get(i - 1) instanceof NormalizedNode string)
                        || !(children.get(i + 1) instanceof NormalizedNode count)) {
                    continue;
                }
                // left-associative: an equal operator on the left groups first, on the right it waits
                if (NodeRuns.leftBoundary(children, i - 1, PRECEDENCE)
                        && NodeRuns.rightBoundary(children, i + 1, PRECEDENCE + 1)) {
                    current = current.replace(i - 1, i + 2, new StringRepeat(string, count));
                    changed = true;
                    break;
                }
            }
        }
        return current;
    }
}
