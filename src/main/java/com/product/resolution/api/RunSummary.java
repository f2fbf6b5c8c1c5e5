package com.product.resolution.api;

import com.product.resolution.blocking.CoverageReport;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a committed resolution run.
 *
 * @param runId              id of the run, also the MDC {@code runId}
 * @param recordCount        records loaded from the source
 * @param bucketCount        blocking buckets, including the overflow bucket
 * @param pairsScored        candidate pairs scored
 * @param goldenRecordCount  golden records published
 * @param singletonCount     golden records with a single member
 * @param largestClusterSize size of the largest golden record
 * @param threshold          clustering threshold applied
 * @param coverage           degraded-coverage reports; empty when every candidate pair was compared
 * @param duration           wall-clock duration of the run
 */
public record RunSummary(
        String runId,
        int recordCount,
        int bucketCount,
        long pairsScored,
        int goldenRecordCount,
        int singletonCount,
        int largestClusterSize,
        double threshold,
        List<CoverageReport> coverage,
        Duration duration
) {
    public RunSummary {
        coverage = List.copyOf(coverage);
    }

    public boolean isDegraded() {
        return !coverage.isEmpty();
    }
}
