package com.product.resolution.cache;

import com.product.resolution.core.model.CanonicalManufacturer;

import java.util.Optional;

/**
 * Cache of canonical manufacturer identities keyed by the raw manufacturer string.
 * Owned by one alias resolver. Inserts must be safe under concurrent access; two
 * workers storing the same key store the same value.
 */
public interface AliasCache {

    /**
     * Gets a cached canonical identity.
     *
     * @param raw the raw manufacturer string as found on the record
     * @return the cached identity, or empty if not cached
     */
    Optional<CanonicalManufacturer> get(String raw);

    /**
     * Caches a canonical identity.
     *
     * @param raw       the raw manufacturer string
     * @param canonical the identity resolved for it
     */
    void put(String raw, CanonicalManufacturer canonical);

    void invalidateAll();

    AliasCacheStats getStats();
}
