package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceClimber;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.ArrayList;
import java.util.List;

/**
 * A chain {@code T . T . T} collapses into one n-ary concatenation, provided no operator at or above
 * the additive level reaches into its ends. Chains broken by tighter operators are left to
 * {@link BinaryOperatorPass}.
 */
public final class StringConcatPass extends RunPass {

    private static final int PRECEDENCE = PerlOperators.binaryPrecedence(".");

    public StringConcatPass() {
        super(PrecedenceTier.HIGH);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        int start = 0;
        while (start < current.children().size()) {
            List<AstNode> children = current.children();
            int end = chainEnd(children, start);
            if (end > start && NodeRuns.leftBoundary(children, start, PRECEDENCE)
                    && NodeRuns.rightBoundary(children, end, PRECEDENCE + 1)) {
                List<NormalizedNode> parts = new ArrayList<>();
                for (int k = start; k <= end; k += 2) {
                    PrecedenceClimber.addConcatParts(parts, (NormalizedNode) children.get(k));
                }
                current = current.replace(start, end + 1, new StringConcat(parts));
            }
            start++;
        }
        return current;
    }

    /**
     * @return The index of the last operand of the {@code .} chain starting at {@code start}, or
     * {@code start} if there is none.
     */
    private static int chainEnd(List<AstNode> children, int start) {
        if (!NodeRuns.isOperand(children.get(start))) {
            return start;
        }
        int end = start;
        while (end + 2 < children.size() && NodeRuns.isOperator(children.get(end + 1), ".")
                && NodeRuns.isOperand(children.get(end + 2))) {
            end += 2;
        }
        return end;
    }
}
