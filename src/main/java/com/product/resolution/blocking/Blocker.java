package com.product.resolution.blocking;

import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Partitions records into buckets by blocking key and generates candidate pairs within
 * each bucket. Pairs are deduplicated globally: a pair belongs to the first bucket, in key
 * order, that produces it. Records without any key share the overflow bucket, which is
 * compared exhaustively only up to {@code overflowCap} members.
 */
public class Blocker {
    private static final Logger log = LoggerFactory.getLogger(Blocker.class);

    public static final String OVERFLOW_KEY = "overflow";
    public static final int DEFAULT_OVERFLOW_CAP = 1_000;

    private final BlockingKeyStrategy strategy;
    private final int overflowCap;
    private final OverflowPolicy overflowPolicy;
    private final MetricsService metrics;

    public Blocker(BlockingKeyStrategy strategy) {
        this(strategy, DEFAULT_OVERFLOW_CAP, OverflowPolicy.SAMPLE, new NoOpMetricsService());
    }

    public Blocker(BlockingKeyStrategy strategy, int overflowCap, OverflowPolicy overflowPolicy,
                   MetricsService metrics) {
        if (overflowCap < 2) {
            throw new IllegalArgumentException("overflowCap must be at least 2, got " + overflowCap);
        }
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.overflowCap = overflowCap;
    }

    public BlockingResult block(Collection<RecordFeatures> records) {
        Map<String, List<String>> keyed = new TreeMap<>();
        List<String> overflow = new ArrayList<>();
        for (RecordFeatures features : records) {
            Set<String> keys = strategy.generateKeys(features);
            if (keys.isEmpty()) {
                overflow.add(features.id());
            }
            for (String key : keys) {
                keyed.computeIfAbsent(key, k -> new ArrayList<>()).add(features.id());
            }
        }

        Set<CandidatePair> seen = new HashSet<>();
        List<Bucket> buckets = new ArrayList<>(keyed.size() + 1);
        for (Map.Entry<String, List<String>> entry : keyed.entrySet()) {
            List<String> members = sorted(entry.getValue());
            buckets.add(new Bucket(entry.getKey(), members, pairsOf(members, seen), false));
            metrics.recordBucketSize(members.size());
        }

        List<CoverageReport> coverage = new ArrayList<>();
        if (!overflow.isEmpty()) {
            List<String> members = sorted(overflow);
            List<String> compared = members;
            if (members.size() > overflowCap) {
                compared = overflowPolicy == OverflowPolicy.SAMPLE ? strideSample(members, overflowCap) : List.of();
                long skipped = pairCount(members.size()) - pairCount(compared.size());
                CoverageReport report = new CoverageReport(OVERFLOW_KEY, members.size(), overflowCap,
                        overflowPolicy, compared.size(), skipped);
                coverage.add(report);
                metrics.incrementBlockingOverflow(overflowPolicy.name());
                log.warn("blocking.overflow bucket={} size={} cap={} policy={} membersCompared={} pairsSkipped={}",
                        OVERFLOW_KEY, members.size(), overflowCap, overflowPolicy, compared.size(), skipped);
            }
            buckets.add(new Bucket(OVERFLOW_KEY, members, pairsOf(compared, seen), true));
            metrics.recordBucketSize(members.size());
        }

        BlockingResult result = new BlockingResult(buckets, coverage, records.size());
        log.info("blocking.completed records={} buckets={} pairs={} degraded={}",
                records.size(), buckets.size(), result.totalPairs(), result.isDegraded());
        return result;
    }

    private static List<CandidatePair> pairsOf(List<String> members, Set<CandidatePair> seen) {
        List<CandidatePair> pairs = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                CandidatePair pair = new CandidatePair(members.get(i), members.get(j));
                if (seen.add(pair)) {
                    pairs.add(pair);
                }
            }
        }
        return pairs;
    }

    /**
     * Picks {@code size} evenly spaced members of an id-sorted list.
     */
    static List<String> strideSample(List<String> members, int size) {
        List<String> sample = new ArrayList<>(size);
        double stride = (double) members.size() / size;
        for (int i = 0; i < size; i++) {
            sample.add(members.get((int) Math.floor(i * stride)));
        }
        return sample;
    }

    private static long pairCount(int n) {
        return (long) n * (n - 1) / 2;
    }

    private static List<String> sorted(List<String> ids) {
        List<String> copy = new ArrayList<>(new HashSet<>(ids));
        Collections.sort(copy);
        return copy;
    }
}
