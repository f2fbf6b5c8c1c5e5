package com.product.resolution.api;

import com.product.resolution.core.model.GoldenRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregate view of the published golden records.
 *
 * @param goldenRecordCount number of golden records
 * @param recordCount       number of member records across all golden records
 * @param sourceCount       distinct source keys across all members
 * @param singletonCount    golden records with one member
 * @param multiSourceCount  golden records whose members come from more than one source
 * @param sizeDistribution  cluster size to number of golden records of that size
 * @param topManufacturers  most frequent canonical manufacturers, most frequent first
 * @param topUnspscCodes    most frequent representative UNSPSC codes, most frequent first
 */
public record ResolutionStatistics(
        int goldenRecordCount,
        long recordCount,
        int sourceCount,
        int singletonCount,
        int multiSourceCount,
        SortedMap<Integer, Long> sizeDistribution,
        Map<String, Long> topManufacturers,
        Map<String, Long> topUnspscCodes
) {
    public static final int DEFAULT_TOP_LIMIT = 10;

    public ResolutionStatistics {
        sizeDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(sizeDistribution));
        topManufacturers = Collections.unmodifiableMap(new LinkedHashMap<>(topManufacturers));
        topUnspscCodes = Collections.unmodifiableMap(new LinkedHashMap<>(topUnspscCodes));
    }

    public static ResolutionStatistics of(Collection<GoldenRecord> goldenRecords, int topLimit) {
        long records = 0;
        int singletons = 0;
        int multiSource = 0;
        Set<String> sources = new HashSet<>();
        SortedMap<Integer, Long> sizes = new TreeMap<>();
        Map<String, Long> manufacturers = new HashMap<>();
        Map<String, Long> unspscCodes = new HashMap<>();
        for (GoldenRecord golden : goldenRecords) {
            records += golden.size();
            if (golden.isSingleton()) {
                singletons++;
            }
            if (golden.sourceKeys().size() > 1) {
                multiSource++;
            }
            sources.addAll(golden.sourceKeys());
            sizes.merge(golden.size(), 1L, Long::sum);
            String manufacturer = golden.representative().canonicalManufacturer();
            if (!manufacturer.isEmpty()) {
                manufacturers.merge(manufacturer, 1L, Long::sum);
            }
            String unspsc = golden.representative().unspsc();
            if (!unspsc.isEmpty()) {
                unspscCodes.merge(unspsc, 1L, Long::sum);
            }
        }
        return new ResolutionStatistics(goldenRecords.size(), records, sources.size(), singletons, multiSource,
                sizes, top(manufacturers, topLimit), top(unspscCodes, topLimit));
    }

    private static Map<String, Long> top(Map<String, Long> counts, int limit) {
        Map<String, Long> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    public double averageClusterSize() {
        return goldenRecordCount == 0 ? 0.0 : (double) recordCount / goldenRecordCount;
    }
}
