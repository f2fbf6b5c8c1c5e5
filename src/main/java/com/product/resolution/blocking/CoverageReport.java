package com.product.resolution.blocking;

/**
 * Records a bucket whose comparison was degraded because it exceeded the overflow cap.
 *
 * @param bucketKey       the degraded bucket
 * @param bucketSize      number of records in the bucket
 * @param cap             configured overflow cap
 * @param policy          policy that was applied
 * @param membersCompared members that took part in pair generation
 * @param pairsSkipped    pairs an exhaustive comparison would have produced but did not
 */
public record CoverageReport(
        String bucketKey,
        int bucketSize,
        int cap,
        OverflowPolicy policy,
        int membersCompared,
        long pairsSkipped
) {
}
