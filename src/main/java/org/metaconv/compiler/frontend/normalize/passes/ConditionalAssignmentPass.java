package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.ConditionalAssignment;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.NormalizerPass;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * The two-statement idiom {@code COND and $val -= 360; $val}: a document whose first statement is a
 * guarded assignment to {@code $val} and whose second is the result expression.
 */
public final class ConditionalAssignmentPass implements NormalizerPass {

    @Override
    public PrecedenceTier tier() {
        return PrecedenceTier.LOW;
    }

    @Override
    public AstNode apply(AstNode node) {
        if (!(node instanceof RawNode document) || !document.is(RawKind.DOCUMENT)
                || document.children().size() != 2
                || !(document.children().get(0) instanceof RawNode statement)
                || !statement.is(RawKind.STATEMENT)
                || !(document.children().get(1) instanceof NormalizedNode result)) {
            return node;
        }
        List<AstNode> parts = statement.children();
        if (parts.size() != 5
                || !(parts.get(0) instanceof NormalizedNode condition)
                || !NodeRuns.isOperator(parts.get(1), "and")
                || !(parts.get(2) instanceof Symbol target)
                || target.kind() != Symbol.Kind.VALUE
                || !(parts.get(4) instanceof NormalizedNode value)) {
            return node;
        }
        String assignment = NodeRuns.operator(parts.get(3));
        if (assignment == null || !PerlOperators.isAssignment(assignment)) {
            return node;
        }
        String operator = assignment.equals("=") ? "=" : assignment.substring(0, assignment.length() - 1);
        return new ConditionalAssignment(condition, target, operator, value, result);
    }
}
