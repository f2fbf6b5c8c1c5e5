package com.product.resolution.blocking;

import java.util.List;

/**
 * Output of one blocking pass.
 *
 * @param buckets     buckets in key order, overflow bucket last
 * @param coverage    degraded buckets; empty when every bucket was compared exhaustively
 * @param recordCount number of records blocked
 */
public record BlockingResult(List<Bucket> buckets, List<CoverageReport> coverage, int recordCount) {

    public BlockingResult {
        buckets = List.copyOf(buckets);
        coverage = List.copyOf(coverage);
    }

    public long totalPairs() {
        return buckets.stream().mapToLong(b -> b.pairs().size()).sum();
    }

    public boolean isDegraded() {
        return !coverage.isEmpty();
    }
}
