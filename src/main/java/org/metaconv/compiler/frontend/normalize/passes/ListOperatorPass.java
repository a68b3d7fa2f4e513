package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.FormattedPrint;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * Parenthesis-free list operators, e.g. {@code join " ", unpack "H2H2", $val}. The operator takes
 * every comma-separated item to its right up to a statement modifier or word operator. Runs before
 * {@link ArgumentListPass} so the comma list is still flat.
 */
public final class ListOperatorPass extends RunPass {

    public ListOperatorPass() {
        super(PrecedenceTier.LOW);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        for (int i = current.children().size() - 2; i >= 0; i--) {
            List<AstNode> children = current.children();
            String word = NodeRuns.word(children.get(i));
            if (word == null || !PerlOperators.isListOperator(word)) {
                continue;
            }
            int end = i + 1;
            while (end < children.size() && !isListEnd(children.get(end))) {
                end++;
            }
            List<NormalizedNode> items = NodeRuns.commaItems(children.subList(i + 1, end));
            if (items == null || items.isEmpty()) {
                continue;
            }
            NormalizedNode call = word.equals("sprintf")
                    ? new FormattedPrint(items.get(0), items.subList(1, items.size()))
                    : new FunctionCall(word, items);
            current = current.replace(i, end, call);
        }
        return current;
    }

    private static boolean isListEnd(AstNode node) {
        String word = NodeRuns.word(node);
        if (word != null && PerlOperators.isStatementModifier(word)) {
            return true;
        }
        String op = NodeRuns.operator(node);
        return op != null && PerlOperators.isWordLogical(op);
    }
}
