package com.product.resolution.metrics;

import java.time.Duration;

/**
 * Interface for recording product resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    /**
     * Records the duration of one pipeline phase ({@code load}, {@code block},
     * {@code score}, {@code cluster}, {@code publish}).
     */
    void recordPhaseDuration(String phase, Duration duration);

    void recordBucketSize(int size);

    void incrementPairsScored(long count);

    void recordPairScore(double score);

    void recordClusterSize(int size);

    /**
     * Counts one overflow bucket that exceeded its cap and was degraded with the given policy.
     */
    void incrementBlockingOverflow(String policy);

    void recordAliasCacheHit();

    void recordAliasCacheMiss();
}
