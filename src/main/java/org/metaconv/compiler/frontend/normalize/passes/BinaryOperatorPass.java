package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceClimber;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * Arithmetic, comparison, bitwise, binding and symbolic logical operators. The run is cut into
 * segments at everything that is neither an operand nor such an operator ({@code ? :}, commas,
 * assignments, word operators, barewords) and each segment is folded by precedence climbing.
 */
public final class BinaryOperatorPass extends RunPass {

    public BinaryOperatorPass() {
        super(PrecedenceTier.HIGH);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        int end = current.children().size();
        while (end > 0) {
            List<AstNode> children = current.children();
            int start = end;
            boolean hasOperator = false;
            while (start > 0 && isSegmentMember(children.get(start - 1))) {
                hasOperator |= !NodeRuns.isOperand(children.get(start - 1));
                start--;
            }
            if (hasOperator) {
                NormalizedNode folded = PrecedenceClimber.fold(children.subList(start, end));
                if (folded != null) {
                    current = current.replace(start, end, folded);
                }
            }
            // skip the separator
            end = start - 1;
        }
        return current;
    }

    private static boolean isSegmentMember(AstNode node) {
        if (NodeRuns.isOperand(node)) {
            return true;
        }
        String op = NodeRuns.operator(node);
        return op != null && (PerlOperators.isBinary(op) || PerlOperators.isPrefix(op));
    }
}
