package org.metaconv.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A node as produced by the upstream parser, or a raw wrapper whose children are being normalized.
 *
 * @param kind The node kind.
 * @param content The token text; for quotes the unquoted body, for structures the opening bracket.
 * @param children The ordered children.
 */
public record RawNode(RawKind kind, String content, List<AstNode> children) implements AstNode {

    public RawNode {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        content = content != null ? content : "";
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static RawNode token(RawKind kind, String content) {
        return new RawNode(kind, content, List.of());
    }

    public static RawNode of(RawKind kind, AstNode... children) {
        return new RawNode(kind, "", List.of(children));
    }

    public static RawNode operator(String text) {
        return token(RawKind.OPERATOR, text);
    }

    public static RawNode word(String text) {
        return token(RawKind.WORD, text);
    }

    public RawNode withChildren(List<AstNode> newChildren) {
        return new RawNode(kind, content, newChildren);
    }

    /**
     * Replaces {@code children[from, to)} with a single node.
     */
    public RawNode replace(int from, int to, AstNode replacement) {
        List<AstNode> rewritten = new ArrayList<>(children.subList(0, from));
        rewritten.add(replacement);
        rewritten.addAll(children.subList(to, children.size()));
        return withChildren(rewritten);
    }

    public boolean is(RawKind expected) {
        return kind == expected;
    }

    public boolean is(RawKind expected, String text) {
        return kind == expected && content.equals(text);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return kind + "(" + content + ")";
        }
        return kind + (content.isEmpty() ? "" : "'" + content + "'") + children;
    }
}
