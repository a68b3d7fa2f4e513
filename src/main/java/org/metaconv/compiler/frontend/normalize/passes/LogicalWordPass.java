package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * The low-precedence word operators {@code not}, {@code and}, {@code or} and {@code xor}, folded within
 * each segment between statement modifiers. {@code and}/{@code or} become {@code &&}/{@code ||}.
 */
public final class LogicalWordPass extends RunPass {

    public LogicalWordPass() {
        super(PrecedenceTier.LOW);
    }

    @Override
    protected RawNode rewrite(RawNode run) {
        RawNode current = run;
        int end = current.children().size();
        while (end > 0) {
            List<AstNode> children = current.children();
            int start = end;
            while (start > 0 && !isModifier(children.get(start - 1))) {
                start--;
            }
            List<AstNode> segment = children.subList(start, end);
            if (segment.stream().anyMatch(LogicalWordPass::isWordOperator)) {
                Parser parser = new Parser(segment);
                NormalizedNode folded = parser.or();
                if (folded != null && parser.pos == segment.size()) {
                    current = current.replace(start, end, folded);
                }
            }
            end = start - 1;
        }
        return current;
    }

    private static boolean isModifier(AstNode node) {
        String word = NodeRuns.word(node);
        return word != null && PerlOperators.isStatementModifier(word);
    }

    private static boolean isWordOperator(AstNode node) {
        String op = NodeRuns.operator(node);
        return op != null && PerlOperators.isWordLogical(op);
    }

    /**
     * {@code or := and (('or' | 'xor') and)*}, {@code and := not ('and' not)*}, {@code not := 'not' not | TERM}.
     */
    private static final class Parser {
        private final List<AstNode> run;
        private int pos;

        Parser(List<AstNode> run) {
            this.run = run;
        }

        NormalizedNode or() {
            NormalizedNode left = and();
            while (left != null && (peek("or") || peek("xor"))) {
                String op = NodeRuns.operator(run.get(pos++));
                NormalizedNode right = and();
                if (right == null) {
                    return null;
                }
                left = new BinaryOp(op.equals("or") ? "||" : "xor", left, right);
            }
            return left;
        }

        private NormalizedNode and() {
            NormalizedNode left = not();
            while (left != null && peek("and")) {
                pos++;
                NormalizedNode right = not();
                if (right == null) {
                    return null;
                }
                left = new BinaryOp("&&", left, right);
            }
            return left;
        }

        private NormalizedNode not() {
            if (peek("not")) {
                pos++;
                NormalizedNode operand = not();
                return operand != null ? new FunctionCall("not", List.of(operand)) : null;
            }
            if (pos < run.size() && run.get(pos) instanceof NormalizedNode term) {
                pos++;
                return term;
            }
            return null;
        }

        private boolean peek(String op) {
            return pos < run.size() && NodeRuns.isOperator(run.get(pos), op);
        }
    }
}
