package org.metaconv.compiler.frontend.normalize;

/**
 * Normalizer passes were applied out of tier order at a node. This is a compiler defect; continuing
 * would produce wrongly grouped trees, so the whole run is aborted.
 */
public class PrecedenceInvariantViolation extends RuntimeException {

    public PrecedenceInvariantViolation(String message) {
        super(message);
    }
}
