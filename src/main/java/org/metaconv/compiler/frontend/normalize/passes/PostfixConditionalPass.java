package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.PostfixConditional;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * {@code BODY if COND} and {@code BODY unless COND}. Needs {@link LogicalWordPass} to have folded
 * word operators in the condition first.
 */
public final class PostfixConditionalPass extends RunPass {

    public PostfixConditionalPass() {
        super(PrecedenceTier.LOW);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        List<AstNode> children = run.children();
        if (children.size() != 3
                || !(children.get(0) instanceof NormalizedNode body)
                || !(children.get(2) instanceof NormalizedNode condition)) {
            return run;
        }
        String word = NodeRuns.word(children.get(1));
        if (!"if".equals(word) && !"unless".equals(word)) {
            return run;
        }
        return run.replace(0, 3, new PostfixConditional(body, condition, word.equals("unless")));
    }
}
