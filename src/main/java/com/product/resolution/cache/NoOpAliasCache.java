package com.product.resolution.cache;

import com.product.resolution.core.model.CanonicalManufacturer;

import java.util.Optional;

/**
 * No-op alias cache. Every lookup misses, so every raw string is resolved again.
 */
public class NoOpAliasCache implements AliasCache {

    @Override
    public Optional<CanonicalManufacturer> get(String raw) {
        return Optional.empty();
    }

    @Override
    public void put(String raw, CanonicalManufacturer canonical) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public AliasCacheStats getStats() {
        return AliasCacheStats.empty();
    }
}
