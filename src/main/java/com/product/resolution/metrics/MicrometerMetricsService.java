package com.product.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code product.run.duration}: Timer</li>
 *   <li>{@code product.phase.duration}: Timer (tag: phase)</li>
 *   <li>{@code product.bucket.size}: DistributionSummary</li>
 *   <li>{@code product.pairs.scored}: Counter</li>
 *   <li>{@code product.pair.score}: DistributionSummary</li>
 *   <li>{@code product.cluster.size}: DistributionSummary</li>
 *   <li>{@code product.blocking.overflow}: Counter (tag: policy)</li>
 *   <li>{@code product.alias.cache.hit}, {@code product.alias.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> phaseTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> overflowCounters = new ConcurrentHashMap<>();
    private final Timer runTimer;
    private final DistributionSummary bucketSizeSummary;
    private final Counter pairsScoredCounter;
    private final DistributionSummary pairScoreSummary;
    private final DistributionSummary clusterSizeSummary;
    private final Counter aliasCacheHitCounter;
    private final Counter aliasCacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.runTimer = Timer.builder("product.run.duration")
                .description("Duration of full resolution runs")
                .register(registry);
        this.bucketSizeSummary = DistributionSummary.builder("product.bucket.size")
                .description("Distribution of blocking bucket sizes")
                .register(registry);
        this.pairsScoredCounter = Counter.builder("product.pairs.scored")
                .description("Number of candidate pairs scored")
                .register(registry);
        this.pairScoreSummary = DistributionSummary.builder("product.pair.score")
                .description("Distribution of overall pair scores")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("product.cluster.size")
                .description("Distribution of golden record sizes")
                .register(registry);
        this.aliasCacheHitCounter = Counter.builder("product.alias.cache.hit")
                .description("Number of manufacturer alias cache hits")
                .register(registry);
        this.aliasCacheMissCounter = Counter.builder("product.alias.cache.miss")
                .description("Number of manufacturer alias cache misses")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
        Timer timer = phaseTimers.computeIfAbsent(phase, p ->
                Timer.builder("product.phase.duration")
                        .description("Duration of resolution pipeline phases")
                        .tag("phase", p)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBucketSize(int size) {
        bucketSizeSummary.record(size);
    }

    @Override
    public void incrementPairsScored(long count) {
        pairsScoredCounter.increment(count);
    }

    @Override
    public void recordPairScore(double score) {
        pairScoreSummary.record(score);
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void incrementBlockingOverflow(String policy) {
        Counter counter = overflowCounters.computeIfAbsent(policy, p ->
                Counter.builder("product.blocking.overflow")
                        .description("Number of overflow buckets degraded because they exceeded the cap")
                        .tag("policy", p)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordAliasCacheHit() {
        aliasCacheHitCounter.increment();
    }

    @Override
    public void recordAliasCacheMiss() {
        aliasCacheMissCounter.increment();
    }
}
