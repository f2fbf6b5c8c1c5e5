package com.product.resolution.cluster;

import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Groups records into golden records: connected components of the graph whose edges are
 * the scored pairs at or above the clustering threshold.
 *
 * <p>Components are a transitive closure. If a-b and b-c pass the threshold, a, b and c share
 * a golden record even when a-c does not, so weakly related records can be chained together.
 * Clusters reaching {@code largeClusterWarningSize} are logged at WARN.</p>
 */
public class Clusterer {
    private static final Logger log = LoggerFactory.getLogger(Clusterer.class);

    public static final double DEFAULT_THRESHOLD = 0.65;
    public static final int DEFAULT_LARGE_CLUSTER_WARNING_SIZE = 50;

    private final double threshold;
    private final int largeClusterWarningSize;
    private final RepresentativeSelector representativeSelector;
    private final MetricsService metrics;

    public Clusterer() {
        this(DEFAULT_THRESHOLD, DEFAULT_LARGE_CLUSTER_WARNING_SIZE, new NoOpMetricsService());
    }

    public Clusterer(double threshold, int largeClusterWarningSize, MetricsService metrics) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (largeClusterWarningSize < 2) {
            throw new IllegalArgumentException("largeClusterWarningSize must be at least 2");
        }
        this.threshold = threshold;
        this.largeClusterWarningSize = largeClusterWarningSize;
        this.representativeSelector = new RepresentativeSelector();
        this.metrics = metrics;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Clusters every record; records without an edge become singleton golden records.
     *
     * @param records all records of the run
     * @param scores  scored candidate pairs
     */
    public ClusteringResult cluster(Collection<RecordFeatures> records, Collection<PairScore> scores) {
        Map<String, RecordFeatures> byId = new HashMap<>();
        for (RecordFeatures features : records) {
            byId.put(features.id(), features);
        }
        List<String> ids = new ArrayList<>(new TreeSet<>(byId.keySet()));
        UnionFind unionFind = new UnionFind(ids);

        int edges = 0;
        for (PairScore score : scores) {
            CandidatePair pair = score.pair();
            if (!score.meetsThreshold(threshold)) {
                continue;
            }
            if (!unionFind.contains(pair.idA()) || !unionFind.contains(pair.idB())) {
                log.debug("cluster.edge.skipped pair={} reason=unknown-record", pair);
                continue;
            }
            edges++;
            unionFind.union(pair.idA(), pair.idB());
        }

        List<GoldenRecord> goldenRecords = new ArrayList<>();
        Map<String, String> recordToGolden = new HashMap<>();
        int singletons = 0;
        int largest = 0;
        for (List<String> component : unionFind.components()) {
            GoldenRecord golden = toGoldenRecord(component, byId);
            goldenRecords.add(golden);
            component.forEach(id -> recordToGolden.put(id, golden.id()));
            metrics.recordClusterSize(golden.size());
            if (golden.isSingleton()) {
                singletons++;
            }
            largest = Math.max(largest, golden.size());
            if (golden.size() >= largeClusterWarningSize) {
                log.warn("cluster.large goldenRecordId={} size={} warningSize={} threshold={}",
                        golden.id(), golden.size(), largeClusterWarningSize, threshold);
            }
        }
        goldenRecords.sort(Comparator.comparing(GoldenRecord::id));

        log.info("clustering.completed records={} edges={} goldenRecords={} singletons={} largest={}",
                ids.size(), edges, goldenRecords.size(), singletons, largest);
        return new ClusteringResult(goldenRecords, recordToGolden, threshold, edges, singletons, largest);
    }

    private GoldenRecord toGoldenRecord(List<String> component, Map<String, RecordFeatures> byId) {
        List<String> memberIds = new ArrayList<>(new TreeSet<>(component));
        List<RecordFeatures> members = new ArrayList<>(memberIds.size());
        TreeSet<String> sourceKeys = new TreeSet<>();
        for (String id : memberIds) {
            RecordFeatures features = byId.get(id);
            members.add(features);
            if (!features.record().sourceKey().isEmpty()) {
                sourceKeys.add(features.record().sourceKey());
            }
        }
        return new GoldenRecord(GoldenRecordIds.idFor(memberIds), representativeSelector.select(members),
                memberIds, new ArrayList<>(sourceKeys));
    }
}
