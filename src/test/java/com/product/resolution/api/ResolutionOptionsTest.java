package com.product.resolution.api;

import com.product.resolution.alias.AliasTable;
import com.product.resolution.blocking.DefaultBlockingKeyStrategy;
import com.product.resolution.blocking.OverflowPolicy;
import com.product.resolution.cache.AliasCacheConfig;
import com.product.resolution.scoring.ScoringConfig;
import com.product.resolution.scoring.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionOptionsTest {

    @Test
    @DisplayName("Should create default options")
    void testDefaultOptions() {
        ResolutionOptions options = ResolutionOptions.defaults();

        assertEquals(0.65, options.getClusteringThreshold());
        assertEquals(ScoringWeights.defaultWeights(), options.getScoringConfig().getWeights());
        assertEquals(1_000, options.getOverflowCap());
        assertEquals(OverflowPolicy.SAMPLE, options.getOverflowPolicy());
        assertEquals(0.92, options.getAliasFuzzyThreshold());
        assertEquals(12, options.getMaxVariants());
        assertEquals(50, options.getLargeClusterWarningSize());
        assertTrue(options.getAliasTable().isEmpty());
        assertTrue(options.getScoringParallelism() > 0);
        assertInstanceOf(DefaultBlockingKeyStrategy.class, options.getBlockingKeyStrategy());
    }

    @Test
    @DisplayName("Should create conservative options")
    void testConservative() {
        ResolutionOptions options = ResolutionOptions.conservative();

        assertEquals(0.80, options.getClusteringThreshold());
        assertEquals(ScoringWeights.identifierFocused(), options.getScoringConfig().getWeights());
        assertEquals(OverflowPolicy.SKIP, options.getOverflowPolicy());
    }

    @Test
    @DisplayName("Should create recall-oriented options")
    void testRecallOriented() {
        ResolutionOptions options = ResolutionOptions.recallOriented();

        assertEquals(0.55, options.getClusteringThreshold());
        assertEquals(ScoringWeights.textFocused(), options.getScoringConfig().getWeights());
    }

    @Test
    @DisplayName("Should replace weights and keep the other scoring settings")
    void testWeights() {
        ScoringConfig config = ScoringConfig.builder().synergyBonus(0.10).build();
        ResolutionOptions options = ResolutionOptions.builder()
                .scoringConfig(config)
                .weights(ScoringWeights.textFocused())
                .build();

        assertEquals(ScoringWeights.textFocused(), options.getScoringConfig().getWeights());
        assertEquals(0.10, options.getScoringConfig().getSynergyBonus());
    }

    @Test
    @DisplayName("Should build blocking strategy from UNSPSC prefix length")
    void testUnspscPrefixLength() {
        ResolutionOptions options = ResolutionOptions.builder().unspscPrefixLength(6).build();

        DefaultBlockingKeyStrategy strategy = (DefaultBlockingKeyStrategy) options.getBlockingKeyStrategy();
        assertEquals(6, strategy.getUnspscPrefixLength());
    }

    @Test
    @DisplayName("Should prefer a custom blocking strategy over the prefix length")
    void testCustomBlockingStrategy() {
        DefaultBlockingKeyStrategy custom = new DefaultBlockingKeyStrategy(2);
        ResolutionOptions options = ResolutionOptions.builder()
                .unspscPrefixLength(6)
                .blockingKeyStrategy(custom)
                .build();

        assertSame(custom, options.getBlockingKeyStrategy());
    }

    @Test
    @DisplayName("Should allow custom settings")
    void testCustomSettings() {
        AliasTable aliases = AliasTable.builder().addAlias("3M", "3M Company").build();
        ResolutionOptions options = ResolutionOptions.builder()
                .clusteringThreshold(0.70)
                .overflowCap(500)
                .overflowPolicy(OverflowPolicy.SKIP)
                .aliasTable(aliases)
                .aliasCacheConfig(AliasCacheConfig.disabled())
                .scoringParallelism(2)
                .sinkChunkSize(100)
                .build();

        assertEquals(0.70, options.getClusteringThreshold());
        assertEquals(500, options.getOverflowCap());
        assertSame(aliases, options.getAliasTable());
        assertFalse(options.getAliasCacheConfig().enabled());
        assertEquals(2, options.getScoringParallelism());
        assertEquals(100, options.getSinkChunkSize());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1})
    @DisplayName("Should reject thresholds outside [0, 1]")
    void testInvalidThresholds(double value) {
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().clusteringThreshold(value));
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().aliasFuzzyThreshold(value));
    }

    @Test
    @DisplayName("Should reject invalid sizes")
    void testInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().overflowCap(1));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().maxVariants(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().scoringParallelism(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().sinkChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().unspscPrefixLength(9));
        assertThrows(IllegalArgumentException.class, () -> ResolutionOptions.builder().largeClusterWarningSize(1));
    }
}
