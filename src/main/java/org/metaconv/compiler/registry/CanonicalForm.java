package org.metaconv.compiler.registry;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.ConditionalAssignment;
import org.metaconv.compiler.frontend.ast.FormattedPrint;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.NormalizedNodeVisitor;
import org.metaconv.compiler.frontend.ast.PostfixConditional;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.SafeDivision;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.ast.StringRepeat;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.ast.Ternary;

import java.util.List;

/**
 * An unambiguous S-expression of a tree. Two trees have the same canonical form exactly when they are
 * structurally equal.
 */
public final class CanonicalForm implements NormalizedNodeVisitor<Void, RuntimeException> {

    private final StringBuilder out = new StringBuilder();

    private CanonicalForm() {
    }

    public static String of(AstNode node) {
        CanonicalForm form = new CanonicalForm();
        form.append(node);
        return form.out.toString();
    }

    /**
     * @return A quoted string with backslashes and quotes escaped.
     */
    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private void append(AstNode node) {
        if (node instanceof NormalizedNode normalized) {
            normalized.accept(this);
        } else if (node instanceof RawNode raw) {
            open("Raw").word(raw.kind().name()).text(raw.content());
            for (AstNode child : raw.children()) {
                out.append(' ');
                append(child);
            }
            out.append(')');
        }
    }

    private CanonicalForm open(String tag) {
        out.append('(').append(tag);
        return this;
    }

    private CanonicalForm word(String word) {
        out.append(' ').append(word);
        return this;
    }

    private CanonicalForm text(String text) {
        out.append(' ').append(quote(text));
        return this;
    }

    private CanonicalForm child(NormalizedNode node) {
        out.append(' ');
        node.accept(this);
        return this;
    }

    private CanonicalForm children(List<NormalizedNode> nodes) {
        out.append(" [");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(' ');
            }
            nodes.get(i).accept(this);
        }
        out.append(']');
        return this;
    }

    private Void close() {
        out.append(')');
        return null;
    }

    @Override
    public Void visit(BinaryOp node) {
        return open("BinaryOp").text(node.operator()).child(node.left()).child(node.right()).close();
    }

    @Override
    public Void visit(StringConcat node) {
        return open("StringConcat").children(node.parts()).close();
    }

    @Override
    public Void visit(StringRepeat node) {
        return open("StringRepeat").child(node.string()).child(node.count()).close();
    }

    @Override
    public Void visit(Ternary node) {
        return open("Ternary").child(node.condition()).child(node.ifTrue()).child(node.ifFalse()).close();
    }

    @Override
    public Void visit(SafeDivision node) {
        return open("SafeDivision").child(node.numerator()).child(node.divisor()).close();
    }

    @Override
    public Void visit(FunctionCall node) {
        return open("FunctionCall").text(node.name()).children(node.args()).close();
    }

    @Override
    public Void visit(FormattedPrint node) {
        return open("FormattedPrint").child(node.format()).children(node.args()).close();
    }

    @Override
    public Void visit(PostfixConditional node) {
        return open("PostfixConditional").child(node.body()).child(node.condition())
                .word(Boolean.toString(node.negated())).close();
    }

    @Override
    public Void visit(ConditionalAssignment node) {
        return open("ConditionalAssignment").child(node.condition()).child(node.target()).text(node.operator())
                .child(node.value()).child(node.result()).close();
    }

    @Override
    public Void visit(Literal node) {
        return open("Literal").word(node.kind().name()).text(node.value()).text(node.modifiers()).close();
    }

    @Override
    public Void visit(Symbol node) {
        return open("Symbol").word(node.kind().name()).text(node.name()).word(Integer.toString(node.index())).close();
    }
}
