package org.metaconv.compiler.frontend.normalize;

import org.metaconv.compiler.api.UnsupportedConstructException;
import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites a raw parser tree into a normalized tree.
 * <p>
 * The tree is walked post-order: every child is normalized before its parent, and at each node all
 * passes are offered the node in tier order (stable within a tier). A node that is already
 * normalized is left alone, so normalizing a normalized tree returns it unchanged.
 */
public class AstNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(AstNormalizer.class);

    private final List<NormalizerPass> passes;

    /**
     * @param registry The passes to run; they are ordered by tier.
     */
    public AstNormalizer(NormalizerPassRegistry registry) {
        this(registry.passes(), true);
    }

    /**
     * @param passes The passes.
     * @param sortByTier {@code false} keeps the given order, which only tests use to provoke tier violations.
     */
    AstNormalizer(List<NormalizerPass> passes, boolean sortByTier) {
        List<NormalizerPass> ordered = new ArrayList<>(passes);
        if (sortByTier) {
            // List.sort is stable
            ordered.sort(Comparator.comparing(NormalizerPass::tier));
        }
        this.passes = List.copyOf(ordered);
    }

    public static AstNormalizer withDefaults() {
        return new AstNormalizer(NormalizerPassRegistry.initializeWithDefaults());
    }

    /**
     * @return The passes in the order they are applied at each node.
     */
    public List<NormalizerPass> passes() {
        return passes;
    }

    /**
     * Normalizes a whole expression.
     *
     * @param root The raw parser tree, or an already normalized tree.
     * @return The normalized root.
     * @throws UnsupportedConstructException if no combination of passes reduces the root.
     * @throws PrecedenceInvariantViolation if passes would be applied out of tier order.
     */
    public NormalizedNode normalize(AstNode root) throws UnsupportedConstructException {
        AstNode result = normalizePartial(root);
        if (result instanceof NormalizedNode normalized) {
            return normalized;
        }
        throw new UnsupportedConstructException("Cannot normalize " + result);
    }

    /**
     * Normalizes as far as the passes allow and returns the possibly still raw result.
     */
    public AstNode normalizePartial(AstNode root) {
        if (!(root instanceof RawNode raw)) {
            return root;
        }
        List<AstNode> children = new ArrayList<>(raw.children().size());
        boolean changed = false;
        for (AstNode child : raw.children()) {
            AstNode rewritten = normalizePartial(child);
            changed |= rewritten != child;
            children.add(rewritten);
        }
        return applyPasses(changed ? raw.withChildren(children) : raw);
    }

    private AstNode applyPasses(AstNode node) {
        AstNode current = node;
        PrecedenceTier applied = null;
        NormalizerPass previous = null;
        for (NormalizerPass pass : passes) {
            if (applied != null && pass.tier().compareTo(applied) < 0) {
                throw new PrecedenceInvariantViolation(String.format(
                        "Pass %s (%s) applied after %s (%s) at %s",
                        pass.name(), pass.tier(), previous.name(), applied, node));
            }
            AstNode next = pass.apply(current);
            if (next == null) {
                throw new IllegalStateException("Pass " + pass.name() + " returned null");
            }
            if (next != current && LOG.isTraceEnabled()) {
                LOG.trace("{}: {} -> {}", pass.name(), current, next);
            }
            current = next;
            applied = pass.tier();
            previous = pass;
            if (current instanceof NormalizedNode) {
                // nothing left for later passes to read at this node
                break;
            }
        }
        return current;
    }
}
