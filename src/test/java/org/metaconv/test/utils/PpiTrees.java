package org.metaconv.test.utils;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;

import java.util.List;

/**
 * Builders for raw trees shaped the way PPI delivers them, so tests read close to the Perl they model.
 * Quote tokens take the unquoted body.
 */
public final class PpiTrees {

    private PpiTrees() {
    }

    public static RawNode doc(AstNode... children) {
        return RawNode.of(RawKind.DOCUMENT, children);
    }

    public static RawNode stmt(AstNode... children) {
        return RawNode.of(RawKind.STATEMENT, children);
    }

    public static RawNode expr(AstNode... children) {
        return RawNode.of(RawKind.EXPRESSION, children);
    }

    /**
     * {@code ( ... )}, normally holding one {@link #expr} child.
     */
    public static RawNode list(AstNode... children) {
        return new RawNode(RawKind.LIST, "(", List.of(children));
    }

    /**
     * @param open {@code "["} or {@code "{"}.
     */
    public static RawNode subscript(String open, AstNode... children) {
        return new RawNode(RawKind.SUBSCRIPT, open, List.of(children));
    }

    /**
     * An argument list as the normalizer builds it from parentheses or a comma list.
     */
    public static RawNode arguments(AstNode... items) {
        return RawNode.of(RawKind.ARGUMENTS, items);
    }

    public static RawNode sym(String text) {
        return RawNode.token(RawKind.SYMBOL, text);
    }

    public static RawNode num(String text) {
        return RawNode.token(RawKind.NUMBER, text);
    }

    public static RawNode op(String text) {
        return RawNode.operator(text);
    }

    public static RawNode word(String text) {
        return RawNode.word(text);
    }

    public static RawNode sq(String body) {
        return RawNode.token(RawKind.QUOTE_SINGLE, body);
    }

    public static RawNode dq(String body) {
        return RawNode.token(RawKind.QUOTE_DOUBLE, body);
    }

    public static RawNode regex(String text) {
        return RawNode.token(RawKind.REGEX_MATCH, text);
    }

    public static RawNode cast(String text) {
        return RawNode.token(RawKind.CAST, text);
    }

    public static RawNode semicolon() {
        return RawNode.token(RawKind.STRUCTURE, ";");
    }

    /**
     * A whole one-statement expression: {@code doc(stmt(children))}.
     */
    public static RawNode statement(AstNode... children) {
        return doc(stmt(children));
    }

    /**
     * {@code $val * 25}
     */
    public static RawNode valTimes25() {
        return statement(sym("$val"), op("*"), num("25"));
    }

    /**
     * {@code $val ? 1/$val : 0}
     */
    public static RawNode guardedReciprocal() {
        return statement(sym("$val"), op("?"), num("1"), op("/"), sym("$val"), op(":"), num("0"));
    }

    /**
     * {@code sprintf("%.1f mm", $val)}
     */
    public static RawNode sprintfMillimetres() {
        return statement(word("sprintf"), list(expr(dq("%.1f mm"), op(","), sym("$val"))));
    }

    /**
     * {@code $val > 180 and $val -= 360; $val}
     */
    public static RawNode wrapAngle() {
        return doc(
                stmt(sym("$val"), op(">"), num("180"), op("and"), sym("$val"), op("-="), num("360"), semicolon()),
                stmt(sym("$val")));
    }
}
