package org.metaconv.compiler.frontend.ast;

/**
 * A variable reference.
 *
 * @param kind What the variable refers to.
 * @param name The variable or data member name without sigils.
 * @param index The element index for {@link Kind#VALUE_ELEMENT}, otherwise 0.
 */
public record Symbol(Kind kind, String name, int index) implements NormalizedNode {

    public enum Kind {
        /** {@code $val}, the value being converted. */
        VALUE,
        /** {@code $val[n]}, one element of a multi-valued tag. */
        VALUE_ELEMENT,
        /** {@code @val}, all elements of a multi-valued tag. */
        VALUE_LIST,
        /** {@code $$self{Name}}, a data member of the extraction state. */
        CONTEXT_FIELD,
        /** Any other scalar, e.g. {@code $count} or {@code $format} in conditions. */
        VARIABLE
    }

    public static Symbol value() {
        return new Symbol(Kind.VALUE, "val", 0);
    }

    public static Symbol valueList() {
        return new Symbol(Kind.VALUE_LIST, "val", 0);
    }

    public static Symbol element(int index) {
        return new Symbol(Kind.VALUE_ELEMENT, "val", index);
    }

    public static Symbol contextField(String name) {
        return new Symbol(Kind.CONTEXT_FIELD, name, 0);
    }

    public static Symbol variable(String name) {
        return new Symbol(Kind.VARIABLE, name, 0);
    }

    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
