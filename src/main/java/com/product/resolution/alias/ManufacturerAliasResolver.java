package com.product.resolution.alias;

import com.product.resolution.cache.AliasCache;
import com.product.resolution.cache.CaffeineAliasCache;
import com.product.resolution.core.model.CanonicalManufacturer;
import com.product.resolution.core.model.CanonicalManufacturer.Resolution;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import com.product.resolution.rules.ManufacturerNormalizer;
import com.product.resolution.similarity.JaroWinklerSimilarity;
import com.product.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps raw manufacturer strings to a canonical manufacturer identity.
 *
 * <p>Resolution order: exact lookup of the normalized name in the alias table, then the best
 * Jaro-Winkler match among every known canonical name and alias if it reaches the fuzzy
 * acceptance threshold, and finally the normalized name itself. Resolution never fails.</p>
 *
 * <p>Results are cached per raw string in the resolver's own {@link AliasCache}.
 * The resolver is thread-safe: concurrent misses on the same string compute and store
 * the same value.</p>
 */
public class ManufacturerAliasResolver {
    private static final Logger log = LoggerFactory.getLogger(ManufacturerAliasResolver.class);

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.92;

    private final AliasTable aliasTable;
    private final ManufacturerNormalizer normalizer;
    private final SimilarityAlgorithm similarity;
    private final double fuzzyThreshold;
    private final AliasCache cache;
    private final MetricsService metrics;

    public ManufacturerAliasResolver(AliasTable aliasTable) {
        this(aliasTable, DEFAULT_FUZZY_THRESHOLD, new CaffeineAliasCache(), new NoOpMetricsService());
    }

    public ManufacturerAliasResolver(AliasTable aliasTable, double fuzzyThreshold,
                                     AliasCache cache, MetricsService metrics) {
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be between 0.0 and 1.0");
        }
        this.aliasTable = Objects.requireNonNull(aliasTable, "aliasTable is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.fuzzyThreshold = fuzzyThreshold;
        this.normalizer = new ManufacturerNormalizer();
        this.similarity = new JaroWinklerSimilarity();
    }

    /**
     * Resolves a raw manufacturer string. {@code null} is treated as empty.
     */
    public CanonicalManufacturer canonicalize(String raw) {
        String key = raw != null ? raw : "";
        Optional<CanonicalManufacturer> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordAliasCacheHit();
            return cached.get();
        }
        metrics.recordAliasCacheMiss();
        CanonicalManufacturer resolved = resolve(key);
        cache.put(key, resolved);
        return resolved;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }

    public AliasCache getCache() {
        return cache;
    }

    private CanonicalManufacturer resolve(String raw) {
        String normalized = normalizer.normalize(raw);
        if (normalized.isEmpty()) {
            return CanonicalManufacturer.empty();
        }

        Optional<String> exact = aliasTable.lookupNormalized(normalized);
        if (exact.isPresent()) {
            return new CanonicalManufacturer(exact.get(), normalized, Resolution.ALIAS_TABLE);
        }

        String bestCanonical = null;
        double bestScore = -1.0;
        for (Map.Entry<String, String> known : aliasTable.knownNames().entrySet()) {
            double score = similarity.compute(normalized, known.getKey());
            String canonical = known.getValue();
            if (score > bestScore || (score == bestScore && canonical.compareTo(bestCanonical) < 0)) {
                bestScore = score;
                bestCanonical = canonical;
            }
        }
        if (bestCanonical != null && bestScore >= fuzzyThreshold) {
            log.debug("alias.fuzzy raw='{}' normalized='{}' canonical='{}' score={}",
                    raw, normalized, bestCanonical, String.format("%.3f", bestScore));
            return new CanonicalManufacturer(bestCanonical, normalized, Resolution.FUZZY);
        }

        return CanonicalManufacturer.self(normalized);
    }
}
