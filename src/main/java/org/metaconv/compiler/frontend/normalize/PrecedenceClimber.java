package org.metaconv.compiler.frontend.normalize;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.ast.StringRepeat;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a flat run of operands, binary operators and prefix operators into one tree using Perl
 * precedence and associativity.
 * <p>
 * {@code .} chains flatten into one {@link StringConcat}, {@code x} builds a {@link StringRepeat},
 * {@code !} becomes the call {@code not}, unary minus becomes {@code 0 - x} (or a negative literal).
 */
public final class PrecedenceClimber {

    private final List<AstNode> run;
    private int pos;

    private PrecedenceClimber(List<AstNode> run) {
        this.run = run;
    }

    /**
     * @param run The run, e.g. {@code [$val, *, 25]}.
     * @return The folded tree, or {@code null} if the run is not a well-formed expression.
     */
    public static NormalizedNode fold(List<AstNode> run) {
        return fold(run, 0);
    }

    /**
     * @param run The run.
     * @param minPrecedence Binary operators binding looser than this end the expression.
     * @return The folded tree, or {@code null} if the run is not a well-formed expression
     * or not entirely consumed.
     */
    public static NormalizedNode fold(List<AstNode> run, int minPrecedence) {
        PrecedenceClimber climber = new PrecedenceClimber(run);
        NormalizedNode result = climber.expression(minPrecedence);
        return result != null && climber.pos == run.size() ? result : null;
    }

    /**
     * Length of the longest prefix of {@code run} that forms one operand expression whose binary
     * operators all bind at least {@code minPrecedence}.
     *
     * @return The prefix length, or 0 if {@code run} does not start with an operand expression.
     */
    public static int prefixLength(List<AstNode> run, int minPrecedence) {
        PrecedenceClimber climber = new PrecedenceClimber(run);
        return climber.expression(minPrecedence) != null ? climber.pos : 0;
    }

    private NormalizedNode expression(int minPrecedence) {
        NormalizedNode left = unary();
        if (left == null) {
            return null;
        }
        while (pos < run.size()) {
            String op = NodeRuns.operator(run.get(pos));
            if (op == null || !PerlOperators.isBinary(op)) {
                break;
            }
            int precedence = PerlOperators.binaryPrecedence(op);
            if (precedence < minPrecedence) {
                break;
            }
            int mark = pos++;
            NormalizedNode right = expression(PerlOperators.isRightAssociative(op) ? precedence : precedence + 1);
            if (right == null) {
                pos = mark;
                return null;
            }
            left = combine(op, left, right);
        }
        return left;
    }

    private NormalizedNode unary() {
        if (pos >= run.size()) {
            return null;
        }
        AstNode next = run.get(pos);
        if (next instanceof NormalizedNode operand) {
            pos++;
            return operand;
        }
        String op = NodeRuns.operator(next);
        if (op == null || !PerlOperators.isPrefix(op)) {
            return null;
        }
        pos++;
        NormalizedNode operand = expression(PerlOperators.UNARY);
        if (operand == null) {
            return null;
        }
        return switch (op) {
            case "!" -> new FunctionCall("not", List.of(operand));
            case "-" -> negate(operand);
            default -> operand;
        };
    }

    private static NormalizedNode negate(NormalizedNode operand) {
        if (operand instanceof Literal literal && literal.kind() == Literal.Kind.NUMBER) {
            String value = literal.value();
            return Literal.number(value.startsWith("-") ? value.substring(1) : "-" + value);
        }
        return new BinaryOp("-", Literal.number(0), operand);
    }

    private static NormalizedNode combine(String op, NormalizedNode left, NormalizedNode right) {
        switch (op) {
            case "." -> {
                List<NormalizedNode> parts = new ArrayList<>();
                addConcatParts(parts, left);
                addConcatParts(parts, right);
                return new StringConcat(parts);
            }
            case "x" -> {
                return new StringRepeat(left, right);
            }
            default -> {
                return new BinaryOp(op, left, right);
            }
        }
    }

    /**
     * Appends {@code node} to a concatenation, flattening nested concatenations.
     */
    public static void addConcatParts(List<NormalizedNode> parts, NormalizedNode node) {
        if (node instanceof StringConcat concat) {
            parts.addAll(concat.parts());
        } else {
            parts.add(node);
        }
    }
}
