package com.product.resolution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used as the default.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
    }

    @Override
    public void recordBucketSize(int size) {
    }

    @Override
    public void incrementPairsScored(long count) {
    }

    @Override
    public void recordPairScore(double score) {
    }

    @Override
    public void recordClusterSize(int size) {
    }

    @Override
    public void incrementBlockingOverflow(String policy) {
    }

    @Override
    public void recordAliasCacheHit() {
    }

    @Override
    public void recordAliasCacheMiss() {
    }
}
