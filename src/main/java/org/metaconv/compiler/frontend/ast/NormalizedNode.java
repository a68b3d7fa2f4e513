package org.metaconv.compiler.frontend.ast;

/**
 * The canonical shapes the code generator is written against. The set is closed; every consumer
 * implements {@link NormalizedNodeVisitor}, so adding a shape breaks every consumer until it is handled.
 */
public sealed interface NormalizedNode extends AstNode permits
        BinaryOp, StringConcat, StringRepeat, Ternary, SafeDivision, FunctionCall, FormattedPrint,
        PostfixConditional, ConditionalAssignment, Literal, Symbol {

    /**
     * Accepts a visitor.
     * @param visitor The visitor.
     * @param <T> The result type.
     * @param <X> The checked exception the visitor may throw.
     * @return The visitor's result.
     * @throws X if the visitor fails.
     */
    <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X;
}
