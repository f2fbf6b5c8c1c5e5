package com.product.resolution.store;

/**
 * Read side of a resolution store: the latest committed generation.
 */
public interface ResolutionReadStore {

    /**
     * Returns the latest committed snapshot, or an empty snapshot before the first commit.
     * A returned snapshot never changes; later commits publish a new one.
     */
    ResolutionSnapshot current();
}
