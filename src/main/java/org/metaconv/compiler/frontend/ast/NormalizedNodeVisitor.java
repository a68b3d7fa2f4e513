package org.metaconv.compiler.frontend.ast;

/**
 * A visitor over the closed set of normalized nodes.
 *
 * @param <T> The result type.
 * @param <X> The checked exception visit methods may throw; use {@link RuntimeException} for none.
 */
public interface NormalizedNodeVisitor<T, X extends Exception> {
    T visit(BinaryOp node) throws X;
    T visit(StringConcat node) throws X;
    T visit(StringRepeat node) throws X;
    T visit(Ternary node) throws X;
    T visit(SafeDivision node) throws X;
    T visit(FunctionCall node) throws X;
    T visit(FormattedPrint node) throws X;
    T visit(PostfixConditional node) throws X;
    T visit(ConditionalAssignment node) throws X;
    T visit(Literal node) throws X;
    T visit(Symbol node) throws X;
}
