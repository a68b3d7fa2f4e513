package org.metaconv.compiler.registry;

/**
 * Turns the canonical form of a dedup key into the hex suffix of a function name.
 */
@FunctionalInterface
public interface KeyHasher {

    /**
     * @param canonical The canonical key text.
     * @return A lowercase hex digest usable in a Java identifier.
     */
    String hash(String canonical);
}
