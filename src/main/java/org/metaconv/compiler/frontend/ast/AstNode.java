package org.metaconv.compiler.frontend.ast;

/**
 * A node of an expression tree during normalization. A partially normalized tree mixes raw nodes from
 * the upstream parser with normalized nodes built by the passes; raw nodes may hold normalized children,
 * never the other way round.
 */
public sealed interface AstNode permits RawNode, NormalizedNode {
}
