package org.metaconv.compiler.frontend.ast;

/**
 * A constant.
 *
 * @param kind The literal kind.
 * @param value Numbers in canonical decimal form, strings with escapes resolved, regex patterns verbatim.
 * @param modifiers Regex modifiers; empty for other kinds.
 */
public record Literal(Kind kind, String value, String modifiers) implements NormalizedNode {

    public enum Kind {
        NUMBER,
        STRING,
        REGEX,
        UNDEF
    }

    public Literal {
        value = value != null ? value : "";
        modifiers = modifiers != null ? modifiers : "";
    }

    public static Literal number(String canonical) {
        return new Literal(Kind.NUMBER, canonical, "");
    }

    public static Literal number(long value) {
        return number(Long.toString(value));
    }

    public static Literal string(String value) {
        return new Literal(Kind.STRING, value, "");
    }

    public static Literal regex(String pattern, String modifiers) {
        return new Literal(Kind.REGEX, pattern, modifiers);
    }

    public static Literal undef() {
        return new Literal(Kind.UNDEF, "", "");
    }

    public boolean isNumber(String canonical) {
        return kind == Kind.NUMBER && value.equals(canonical);
    }

    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
