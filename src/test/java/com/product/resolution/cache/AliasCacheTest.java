package com.product.resolution.cache;

import com.product.resolution.core.model.CanonicalManufacturer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AliasCache Tests")
class AliasCacheTest {

    private static final CanonicalManufacturer EATON = CanonicalManufacturer.self("EATON");

    @Nested
    @DisplayName("Caffeine cache")
    class Caffeine {

        @Test
        @DisplayName("stores and returns entries")
        void putAndGet() {
            AliasCache cache = new CaffeineAliasCache();
            cache.put("Eaton Corp", EATON);

            assertEquals(EATON, cache.get("Eaton Corp").orElseThrow());
            assertTrue(cache.get("Siemens").isEmpty());
        }

        @Test
        @DisplayName("tracks hits and misses")
        void stats() {
            AliasCache cache = new CaffeineAliasCache();
            cache.put("Eaton", EATON);
            cache.get("Eaton");
            cache.get("Eaton");
            cache.get("missing");

            AliasCacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("invalidateAll empties the cache")
        void invalidate() {
            AliasCache cache = new CaffeineAliasCache(new AliasCacheConfig(10, true));
            cache.put("Eaton", EATON);
            cache.invalidateAll();

            assertTrue(cache.get("Eaton").isEmpty());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("factory honours the enabled flag")
        void factory() {
            assertInstanceOf(CaffeineAliasCache.class, AliasCaches.create(AliasCacheConfig.defaults()));
            assertInstanceOf(NoOpAliasCache.class, AliasCaches.create(AliasCacheConfig.disabled()));
        }

        @Test
        @DisplayName("rejects a non-positive size")
        void invalidSize() {
            assertThrows(IllegalArgumentException.class, () -> new AliasCacheConfig(0, true));
        }

        @Test
        @DisplayName("no-op cache never returns entries")
        void noOp() {
            AliasCache cache = new NoOpAliasCache();
            cache.put("Eaton", EATON);

            assertTrue(cache.get("Eaton").isEmpty());
            assertEquals(AliasCacheStats.empty(), cache.getStats());
            assertEquals(0.0, AliasCacheStats.empty().hitRate());
        }
    }
}
