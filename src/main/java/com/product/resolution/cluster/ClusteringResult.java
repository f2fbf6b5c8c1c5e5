package com.product.resolution.cluster;

import com.product.resolution.core.model.GoldenRecord;

import java.util.List;
import java.util.Map;

/**
 * Golden records of one clustering pass plus summary figures.
 *
 * @param goldenRecords      golden records in ascending id order
 * @param recordToGolden     record id to golden-record id
 * @param threshold          clustering threshold that was applied
 * @param edgeCount          scored pairs at or above the threshold
 * @param singletonCount     golden records with one member
 * @param largestClusterSize size of the largest golden record
 */
public record ClusteringResult(
        List<GoldenRecord> goldenRecords,
        Map<String, String> recordToGolden,
        double threshold,
        int edgeCount,
        int singletonCount,
        int largestClusterSize
) {
    public ClusteringResult {
        goldenRecords = List.copyOf(goldenRecords);
        recordToGolden = Map.copyOf(recordToGolden);
    }
}
