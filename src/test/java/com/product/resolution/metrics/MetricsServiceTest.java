package com.product.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRunDuration(Duration.ofMillis(100));
                noOp.recordPhaseDuration("score", Duration.ofMillis(10));
                noOp.recordBucketSize(4);
                noOp.incrementPairsScored(6);
                noOp.recordPairScore(0.85);
                noOp.recordClusterSize(2);
                noOp.incrementBlockingOverflow("SAMPLE");
                noOp.recordAliasCacheHit();
                noOp.recordAliasCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record run duration as timer")
        void recordRunDuration() {
            metrics.recordRunDuration(Duration.ofMillis(150));
            metrics.recordRunDuration(Duration.ofMillis(250));

            Timer timer = registry.find("product.run.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should tag phase timers by phase")
        void recordPhaseDuration() {
            metrics.recordPhaseDuration("block", Duration.ofMillis(5));
            metrics.recordPhaseDuration("score", Duration.ofMillis(50));
            metrics.recordPhaseDuration("score", Duration.ofMillis(70));

            Timer score = registry.find("product.phase.duration").tag("phase", "score").timer();
            Timer block = registry.find("product.phase.duration").tag("phase", "block").timer();

            assertNotNull(score);
            assertEquals(2, score.count());
            assertNotNull(block);
            assertEquals(1, block.count());
        }

        @Test
        @DisplayName("Should count scored pairs in bulk")
        void incrementPairsScored() {
            metrics.incrementPairsScored(40);
            metrics.incrementPairsScored(2);

            Counter counter = registry.find("product.pairs.scored").counter();

            assertNotNull(counter);
            assertEquals(42.0, counter.count());
        }

        @Test
        @DisplayName("Should record score, bucket and cluster distributions")
        void distributions() {
            metrics.recordPairScore(0.9);
            metrics.recordPairScore(0.5);
            metrics.recordBucketSize(12);
            metrics.recordClusterSize(3);

            DistributionSummary scores = registry.find("product.pair.score").summary();
            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(1.4, scores.totalAmount(), 1e-9);
            assertEquals(12.0, registry.find("product.bucket.size").summary().max());
            assertEquals(1, registry.find("product.cluster.size").summary().count());
        }

        @Test
        @DisplayName("Should tag overflow counter by policy")
        void incrementBlockingOverflow() {
            metrics.incrementBlockingOverflow("SAMPLE");
            metrics.incrementBlockingOverflow("SAMPLE");
            metrics.incrementBlockingOverflow("SKIP");

            assertEquals(2.0, registry.find("product.blocking.overflow").tag("policy", "SAMPLE").counter().count());
            assertEquals(1.0, registry.find("product.blocking.overflow").tag("policy", "SKIP").counter().count());
        }

        @Test
        @DisplayName("Should count alias cache hits and misses")
        void aliasCache() {
            metrics.recordAliasCacheHit();
            metrics.recordAliasCacheMiss();
            metrics.recordAliasCacheMiss();

            assertEquals(1.0, registry.find("product.alias.cache.hit").counter().count());
            assertEquals(2.0, registry.find("product.alias.cache.miss").counter().count());
        }
    }
}
