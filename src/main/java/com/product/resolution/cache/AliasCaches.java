package com.product.resolution.cache;

/**
 * Factory for alias caches.
 */
public final class AliasCaches {

    private AliasCaches() {
    }

    /**
     * Creates a Caffeine cache when enabled, a no-op cache otherwise.
     */
    public static AliasCache create(AliasCacheConfig config) {
        return config.enabled() ? new CaffeineAliasCache(config) : new NoOpAliasCache();
    }
}
