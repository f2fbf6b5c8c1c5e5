package com.product.resolution.cache;

/**
 * Configuration for the manufacturer alias cache.
 *
 * @param maxSize maximum number of cached raw manufacturer strings
 * @param enabled whether caching is enabled
 */
public record AliasCacheConfig(int maxSize, boolean enabled) {

    public AliasCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 50,000 entries, enabled.
     */
    public static AliasCacheConfig defaults() {
        return new AliasCacheConfig(50_000, true);
    }

    public static AliasCacheConfig disabled() {
        return new AliasCacheConfig(1, false);
    }
}
