package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.NormalizerPass;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

/**
 * Runs last. Turns parentheses and comma lists into {@code ARGUMENTS} nodes for the enclosing
 * call, and lets a statement, expression or document that has been reduced to one term stand
 * for that term.
 */
public final class ArgumentListPass implements NormalizerPass {

    @Override
    public PrecedenceTier tier() {
        return PrecedenceTier.LOW;
    }

    @Override
    public AstNode apply(AstNode node) {
        if (!(node instanceof RawNode raw)) {
            return node;
        }
        List<AstNode> children = raw.children();
        switch (raw.kind()) {
            case LIST -> {
                if (children.isEmpty()) {
                    return new RawNode(RawKind.ARGUMENTS, "", List.of());
                }
                if (children.size() == 1 && children.get(0) instanceof RawNode inner && inner.is(RawKind.ARGUMENTS)) {
                    return inner;
                }
                if (children.size() == 1 && children.get(0) instanceof NormalizedNode item) {
                    return new RawNode(RawKind.ARGUMENTS, "", List.of(item));
                }
                return raw;
            }
            case EXPRESSION -> {
                if (children.stream().anyMatch(NodeRuns::isComma)) {
                    List<NormalizedNode> items = NodeRuns.commaItems(children);
                    return items != null ? new RawNode(RawKind.ARGUMENTS, "", List.<AstNode>copyOf(items)) : raw;
                }
                return single(raw);
            }
            case STATEMENT, DOCUMENT -> {
                return single(raw);
            }
            default -> {
                return raw;
            }
        }
    }

    private static AstNode single(RawNode raw) {
        return raw.children().size() == 1 && raw.children().get(0) instanceof NormalizedNode item ? item : raw;
    }
}
