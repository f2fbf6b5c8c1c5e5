package com.product.resolution.api;

import com.product.resolution.alias.AliasTable;
import com.product.resolution.alias.ManufacturerAliasResolver;
import com.product.resolution.blocking.Blocker;
import com.product.resolution.blocking.BlockingKeyStrategy;
import com.product.resolution.blocking.DefaultBlockingKeyStrategy;
import com.product.resolution.blocking.OverflowPolicy;
import com.product.resolution.cache.AliasCacheConfig;
import com.product.resolution.cluster.Clusterer;
import com.product.resolution.rules.VariantGenerator;
import com.product.resolution.scoring.ScoringConfig;
import com.product.resolution.scoring.ScoringWeights;

import java.util.Objects;

/**
 * Options for a resolution run: scoring, blocking, clustering, alias resolution and
 * parallelism. Immutable; built with a validating {@link Builder}.
 */
public class ResolutionOptions {

    private static final int DEFAULT_SINK_CHUNK_SIZE = 10_000;

    private final ScoringConfig scoringConfig;
    private final double clusteringThreshold;
    private final int largeClusterWarningSize;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final int overflowCap;
    private final OverflowPolicy overflowPolicy;
    private final AliasTable aliasTable;
    private final double aliasFuzzyThreshold;
    private final AliasCacheConfig aliasCacheConfig;
    private final int maxVariants;
    private final int scoringParallelism;
    private final int sinkChunkSize;

    private ResolutionOptions(Builder builder) {
        this.scoringConfig = builder.scoringConfig;
        this.clusteringThreshold = builder.clusteringThreshold;
        this.largeClusterWarningSize = builder.largeClusterWarningSize;
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy(builder.unspscPrefixLength);
        this.overflowCap = builder.overflowCap;
        this.overflowPolicy = builder.overflowPolicy;
        this.aliasTable = builder.aliasTable;
        this.aliasFuzzyThreshold = builder.aliasFuzzyThreshold;
        this.aliasCacheConfig = builder.aliasCacheConfig;
        this.maxVariants = builder.maxVariants;
        this.scoringParallelism = builder.scoringParallelism;
        this.sinkChunkSize = builder.sinkChunkSize;
    }

    public ScoringConfig getScoringConfig() {
        return scoringConfig;
    }

    public double getClusteringThreshold() {
        return clusteringThreshold;
    }

    public int getLargeClusterWarningSize() {
        return largeClusterWarningSize;
    }

    public BlockingKeyStrategy getBlockingKeyStrategy() {
        return blockingKeyStrategy;
    }

    public int getOverflowCap() {
        return overflowCap;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }

    public double getAliasFuzzyThreshold() {
        return aliasFuzzyThreshold;
    }

    public AliasCacheConfig getAliasCacheConfig() {
        return aliasCacheConfig;
    }

    public int getMaxVariants() {
        return maxVariants;
    }

    public int getScoringParallelism() {
        return scoringParallelism;
    }

    public int getSinkChunkSize() {
        return sinkChunkSize;
    }

    /**
     * Creates default options.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates conservative options: identifier-focused weights and a higher clustering
     * threshold, trading recall for fewer false merges.
     */
    public static ResolutionOptions conservative() {
        return builder()
                .scoringConfig(ScoringConfig.builder().weights(ScoringWeights.identifierFocused()).build())
                .clusteringThreshold(0.80)
                .overflowPolicy(OverflowPolicy.SKIP)
                .build();
    }

    /**
     * Creates recall-oriented options for catalogs with sparse identifiers: text-focused
     * weights and a lower clustering threshold.
     */
    public static ResolutionOptions recallOriented() {
        return builder()
                .scoringConfig(ScoringConfig.builder().weights(ScoringWeights.textFocused()).build())
                .clusteringThreshold(0.55)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringConfig scoringConfig = ScoringConfig.defaults();
        private double clusteringThreshold = Clusterer.DEFAULT_THRESHOLD;
        private int largeClusterWarningSize = Clusterer.DEFAULT_LARGE_CLUSTER_WARNING_SIZE;
        private BlockingKeyStrategy blockingKeyStrategy;
        private int unspscPrefixLength = DefaultBlockingKeyStrategy.DEFAULT_UNSPSC_PREFIX_LENGTH;
        private int overflowCap = Blocker.DEFAULT_OVERFLOW_CAP;
        private OverflowPolicy overflowPolicy = OverflowPolicy.SAMPLE;
        private AliasTable aliasTable = AliasTable.empty();
        private double aliasFuzzyThreshold = ManufacturerAliasResolver.DEFAULT_FUZZY_THRESHOLD;
        private AliasCacheConfig aliasCacheConfig = AliasCacheConfig.defaults();
        private int maxVariants = VariantGenerator.DEFAULT_MAX_VARIANTS;
        private int scoringParallelism = Runtime.getRuntime().availableProcessors();
        private int sinkChunkSize = DEFAULT_SINK_CHUNK_SIZE;

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = Objects.requireNonNull(scoringConfig, "scoringConfig is required");
            return this;
        }

        /**
         * Replaces only the component weights, keeping the rest of the scoring configuration.
         */
        public Builder weights(ScoringWeights weights) {
            ScoringConfig current = scoringConfig;
            this.scoringConfig = ScoringConfig.builder()
                    .weights(weights)
                    .synergyBonus(current.getSynergyBonus())
                    .synergyMinComponents(current.getSynergyMinComponents())
                    .strongThreshold(current.getStrongThreshold())
                    .partialCeiling(current.getPartialCeiling())
                    .partNumberSubWeights(current.getJaroWinklerWeight(), current.getLevenshteinWeight())
                    .suffixOnlyScore(current.getSuffixOnlyScore())
                    .textSubWeights(current.getTitleWeight(), current.getDescriptionWeight(), current.getTfidfWeight())
                    .filterShortVariants(current.isFilterShortVariants())
                    .build();
            return this;
        }

        public Builder clusteringThreshold(double clusteringThreshold) {
            validateThreshold(clusteringThreshold, "clusteringThreshold");
            this.clusteringThreshold = clusteringThreshold;
            return this;
        }

        public Builder largeClusterWarningSize(int largeClusterWarningSize) {
            if (largeClusterWarningSize < 2) {
                throw new IllegalArgumentException("largeClusterWarningSize must be at least 2");
            }
            this.largeClusterWarningSize = largeClusterWarningSize;
            return this;
        }

        /**
         * Sets a custom blocking strategy. Takes precedence over {@link #unspscPrefixLength(int)}.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder unspscPrefixLength(int unspscPrefixLength) {
            if (unspscPrefixLength < 0 || unspscPrefixLength > 8) {
                throw new IllegalArgumentException("unspscPrefixLength must be between 0 and 8");
            }
            this.unspscPrefixLength = unspscPrefixLength;
            return this;
        }

        public Builder overflowCap(int overflowCap) {
            if (overflowCap < 2) {
                throw new IllegalArgumentException("overflowCap must be at least 2");
            }
            this.overflowCap = overflowCap;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy is required");
            return this;
        }

        public Builder aliasTable(AliasTable aliasTable) {
            this.aliasTable = Objects.requireNonNull(aliasTable, "aliasTable is required");
            return this;
        }

        public Builder aliasFuzzyThreshold(double aliasFuzzyThreshold) {
            validateThreshold(aliasFuzzyThreshold, "aliasFuzzyThreshold");
            this.aliasFuzzyThreshold = aliasFuzzyThreshold;
            return this;
        }

        public Builder aliasCacheConfig(AliasCacheConfig aliasCacheConfig) {
            this.aliasCacheConfig = Objects.requireNonNull(aliasCacheConfig, "aliasCacheConfig is required");
            return this;
        }

        public Builder maxVariants(int maxVariants) {
            if (maxVariants < 1) {
                throw new IllegalArgumentException("maxVariants must be at least 1");
            }
            this.maxVariants = maxVariants;
            return this;
        }

        public Builder scoringParallelism(int scoringParallelism) {
            if (scoringParallelism <= 0) {
                throw new IllegalArgumentException("scoringParallelism must be positive");
            }
            this.scoringParallelism = scoringParallelism;
            return this;
        }

        public Builder sinkChunkSize(int sinkChunkSize) {
            if (sinkChunkSize <= 0) {
                throw new IllegalArgumentException("sinkChunkSize must be positive");
            }
            this.sinkChunkSize = sinkChunkSize;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
