package com.product.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.product.resolution.core.model.CanonicalManufacturer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed alias cache. Entries live until evicted by size or explicitly invalidated.
 */
public class CaffeineAliasCache implements AliasCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAliasCache.class);

    private final Cache<String, CanonicalManufacturer> cache;

    public CaffeineAliasCache() {
        this(AliasCacheConfig.defaults());
    }

    public CaffeineAliasCache(AliasCacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.debug("CaffeineAliasCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<CanonicalManufacturer> get(String raw) {
        return Optional.ofNullable(cache.getIfPresent(raw));
    }

    @Override
    public void put(String raw, CanonicalManufacturer canonical) {
        cache.put(raw, canonical);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all alias cache entries");
    }

    @Override
    public AliasCacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new AliasCacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
