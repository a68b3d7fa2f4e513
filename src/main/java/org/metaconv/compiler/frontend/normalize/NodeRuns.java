package org.metaconv.compiler.frontend.normalize;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading operator/operand runs among the direct children of a node.
 */
public final class NodeRuns {

    private NodeRuns() {
    }

    public static boolean isOperand(AstNode node) {
        return node instanceof NormalizedNode;
    }

    /**
     * @return The operator text if {@code node} is an operator token, otherwise {@code null}.
     */
    public static String operator(AstNode node) {
        return node instanceof RawNode raw && raw.is(RawKind.OPERATOR) ? raw.content() : null;
    }

    public static boolean isOperator(AstNode node, String text) {
        return text.equals(operator(node));
    }

    /**
     * @return The word if {@code node} is a bareword token, otherwise {@code null}.
     */
    public static String word(AstNode node) {
        return node instanceof RawNode raw && raw.is(RawKind.WORD) ? raw.content() : null;
    }

    public static boolean isComma(AstNode node) {
        String op = operator(node);
        return ",".equals(op) || "=>".equals(op);
    }

    /**
     * @return The children of {@code node} if it is a raw run container, otherwise {@code null}.
     */
    public static List<AstNode> sequence(AstNode node) {
        return node instanceof RawNode raw && raw.kind().isSequence() ? raw.children() : null;
    }

    /**
     * @return The normalized items of an {@code ARGUMENTS} node, or {@code null} if it is not one
     * or still holds raw items.
     */
    public static List<NormalizedNode> arguments(AstNode node) {
        if (!(node instanceof RawNode raw) || !raw.is(RawKind.ARGUMENTS)) {
            return null;
        }
        return allNormalized(raw.children());
    }

    /**
     * @return The nodes cast to normalized nodes, or {@code null} if any of them is raw.
     */
    public static List<NormalizedNode> allNormalized(List<AstNode> nodes) {
        List<NormalizedNode> out = new ArrayList<>(nodes.size());
        for (AstNode n : nodes) {
            if (!(n instanceof NormalizedNode normalized)) {
                return null;
            }
            out.add(normalized);
        }
        return out;
    }

    /**
     * Splits a comma list into single-node items.
     *
     * @return The items, or {@code null} if some item is not exactly one normalized node.
     */
    public static List<NormalizedNode> commaItems(List<AstNode> nodes) {
        List<NormalizedNode> items = new ArrayList<>();
        int i = 0;
        while (i < nodes.size()) {
            if (!(nodes.get(i) instanceof NormalizedNode item)) {
                return null;
            }
            items.add(item);
            i++;
            if (i == nodes.size()) {
                break;
            }
            if (!isComma(nodes.get(i))) {
                return null;
            }
            i++;
        }
        return items;
    }

    /**
     * Whether the operand at {@code index} is free on its left, i.e. no operator binding at least
     * {@code precedence} reaches into it from the left.
     */
    public static boolean leftBoundary(List<AstNode> children, int index, int precedence) {
        return index == 0 || bindingStrength(children, index - 1) < precedence;
    }

    /**
     * Whether the operand at {@code index} is free on its right, i.e. no operator binding at least
     * {@code precedence} reaches into it from the right.
     */
    public static boolean rightBoundary(List<AstNode> children, int index, int precedence) {
        return index == children.size() - 1 || bindingStrength(children, index + 1) < precedence;
    }

    /**
     * @return The precedence of the operator at {@code index}, taking prefix position into account,
     * or -1 if the child there is not an operator that can grab an adjacent operand.
     */
    public static int bindingStrength(List<AstNode> children, int index) {
        String op = operator(children.get(index));
        if (op == null) {
            return -1;
        }
        boolean prefixPosition = index == 0 || !isOperand(children.get(index - 1));
        if (prefixPosition && PerlOperators.isPrefix(op)) {
            return PerlOperators.UNARY;
        }
        return PerlOperators.binaryPrecedence(op);
    }
}
