package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceClimber;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * Calls: {@code name(ARGS)} for any function word, and parenthesis-free named unary operators such as
 * {@code length $val}, whose operand extends over operators binding tighter than comparisons.
 * Runs before {@link BinaryOperatorPass}, so {@code length $val > 3} compares the length.
 */
public final class FunctionCallPass extends RunPass {

    public FunctionCallPass() {
        super(PrecedenceTier.HIGH);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        for (int i = current.children().size() - 2; i >= 0; i--) {
            List<AstNode> children = current.children();
            String word = NodeRuns.word(children.get(i));
            if (word == null || word.equals("sprintf") || PerlOperators.isKeyword(word)
                    || PerlOperators.isStatementModifier(word)) {
                continue;
            }
            List<NormalizedNode> args = NodeRuns.arguments(children.get(i + 1));
            if (args != null) {
                current = current.replace(i, i + 2, new FunctionCall(word, args));
                continue;
            }
            if (!PerlOperators.isNamedUnary(word)) {
                continue;
            }
            List<AstNode> rest = children.subList(i + 1, children.size());
            int length = PrecedenceClimber.prefixLength(rest, PerlOperators.NAMED_UNARY + 1);
            if (length == 0) {
                continue;
            }
            NormalizedNode operand = PrecedenceClimber.fold(rest.subList(0, length));
            current = current.replace(i, i + 1 + length, new FunctionCall(word, List.of(operand)));
        }
        return current;
    }
}
