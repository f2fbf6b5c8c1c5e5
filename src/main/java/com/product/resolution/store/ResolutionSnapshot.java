package com.product.resolution.store;

import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One published generation of resolution output. Immutable.
 */
public final class ResolutionSnapshot {

    private static final ResolutionSnapshot EMPTY = new ResolutionSnapshot("", List.of(), List.of());

    private final String runId;
    private final List<GoldenRecord> goldenRecords;
    private final Map<String, GoldenRecord> goldenById;
    private final Map<String, String> recordToGolden;
    private final Map<CandidatePair, PairScore> pairScores;

    public ResolutionSnapshot(String runId, List<GoldenRecord> goldenRecords, List<PairScore> pairScores) {
        this.runId = runId;
        this.goldenRecords = goldenRecords.stream()
                .sorted(Comparator.comparing(GoldenRecord::id))
                .toList();
        Map<String, GoldenRecord> byId = new LinkedHashMap<>();
        Map<String, String> membership = new HashMap<>();
        for (GoldenRecord golden : this.goldenRecords) {
            byId.put(golden.id(), golden);
            golden.memberIds().forEach(id -> membership.put(id, golden.id()));
        }
        this.goldenById = Map.copyOf(byId);
        this.recordToGolden = Map.copyOf(membership);
        Map<CandidatePair, PairScore> scores = new HashMap<>();
        pairScores.forEach(score -> scores.put(score.pair(), score));
        this.pairScores = Map.copyOf(scores);
    }

    public static ResolutionSnapshot empty() {
        return EMPTY;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Golden records in ascending id order.
     */
    public List<GoldenRecord> getGoldenRecords() {
        return goldenRecords;
    }

    public Optional<GoldenRecord> getGoldenRecord(String id) {
        return Optional.ofNullable(goldenById.get(id));
    }

    public Optional<GoldenRecord> getGoldenRecordForRecord(String recordId) {
        return Optional.ofNullable(recordToGolden.get(recordId)).map(goldenById::get);
    }

    public Optional<PairScore> getPairScore(CandidatePair pair) {
        return Optional.ofNullable(pairScores.get(pair));
    }

    public int pairScoreCount() {
        return pairScores.size();
    }

    public boolean isEmpty() {
        return goldenRecords.isEmpty();
    }
}
