package com.product.resolution.store;

import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sink and read store held in memory. Writes are staged per run and published on commit
 * as one immutable {@link ResolutionSnapshot}, so readers see either the previous generation
 * or the new one, never a mix.
 */
public class InMemoryResolutionStore implements ResolutionSink, ResolutionReadStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryResolutionStore.class);

    private final AtomicReference<ResolutionSnapshot> published = new AtomicReference<>(ResolutionSnapshot.empty());
    private final Object stagingLock = new Object();
    private String stagedRunId;
    private List<PairScore> stagedScores;
    private List<GoldenRecord> stagedGoldenRecords;

    @Override
    public void begin(String runId) {
        Objects.requireNonNull(runId, "runId is required");
        synchronized (stagingLock) {
            if (stagedRunId != null) {
                throw new StoreException("Run " + stagedRunId + " is still open; cannot begin " + runId);
            }
            stagedRunId = runId;
            stagedScores = new ArrayList<>();
            stagedGoldenRecords = new ArrayList<>();
        }
    }

    @Override
    public void writePairScores(List<PairScore> scores) {
        synchronized (stagingLock) {
            requireOpenRun();
            stagedScores.addAll(scores);
        }
    }

    @Override
    public void writeGoldenRecords(List<GoldenRecord> goldenRecords) {
        synchronized (stagingLock) {
            requireOpenRun();
            stagedGoldenRecords.addAll(goldenRecords);
        }
    }

    @Override
    public void commit(String runId) {
        synchronized (stagingLock) {
            requireRun(runId);
            ResolutionSnapshot snapshot = new ResolutionSnapshot(runId, stagedGoldenRecords, stagedScores);
            published.set(snapshot);
            log.info("store.committed runId={} goldenRecords={} pairScores={}",
                    runId, snapshot.getGoldenRecords().size(), snapshot.pairScoreCount());
            clearStaging();
        }
    }

    @Override
    public void abort(String runId) {
        synchronized (stagingLock) {
            if (stagedRunId == null || !stagedRunId.equals(runId)) {
                return;
            }
            log.warn("store.aborted runId={} discardedGoldenRecords={} discardedPairScores={}",
                    runId, stagedGoldenRecords.size(), stagedScores.size());
            clearStaging();
        }
    }

    @Override
    public ResolutionSnapshot current() {
        return published.get();
    }

    private void requireOpenRun() {
        if (stagedRunId == null) {
            throw new StoreException("No open run; call begin() first");
        }
    }

    private void requireRun(String runId) {
        requireOpenRun();
        if (!stagedRunId.equals(runId)) {
            throw new StoreException("Open run is " + stagedRunId + ", not " + runId);
        }
    }

    private void clearStaging() {
        stagedRunId = null;
        stagedScores = null;
        stagedGoldenRecords = null;
    }
}
