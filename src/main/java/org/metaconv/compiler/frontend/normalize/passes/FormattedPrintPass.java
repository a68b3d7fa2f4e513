package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.FormattedPrint;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * {@code sprintf(FORMAT, ARGS)} with parentheses. Runs before {@link FunctionCallPass} so that
 * {@code sprintf} never turns into a generic call.
 */
public final class FormattedPrintPass extends RunPass {

    public FormattedPrintPass() {
        super(PrecedenceTier.HIGH);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        for (int i = current.children().size() - 2; i >= 0; i--) {
            List<AstNode> children = current.children();
            if (!"sprintf".equals(NodeRuns.word(children.get(i)))) {
                continue;
            }
            List<NormalizedNode> args = NodeRuns.arguments(children.get(i + 1));
            if (args == null || args.isEmpty()) {
                continue;
            }
            current = current.replace(i, i + 2, new FormattedPrint(args.get(0), args.subList(1, args.size())));
        }
        return current;
    }
}
