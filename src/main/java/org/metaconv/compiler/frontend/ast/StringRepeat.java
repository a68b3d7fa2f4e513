package org.metaconv.compiler.frontend.ast;

/**
 * Perl {@code x}.
 *
 * @param string The repeated value.
 * @param count The repeat count.
 */
public record StringRepeat(NormalizedNode string, NormalizedNode count) implements NormalizedNode {
    @Override
    public <T, X extends Exception> T accept(NormalizedNodeVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
