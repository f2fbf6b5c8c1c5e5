package com.product.resolution.store;

import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;

import java.util.List;

/**
 * Write boundary of the engine: where a run's pair scores and golden records go.
 *
 * <p>A run is framed by {@link #begin}, then {@link #commit} or {@link #abort}. Nothing written
 * between them may become visible to readers before the commit, and an aborted run leaves the
 * previously committed output untouched.</p>
 */
public interface ResolutionSink {

    void begin(String runId);

    void writePairScores(List<PairScore> scores);

    void writeGoldenRecords(List<GoldenRecord> goldenRecords);

    void commit(String runId);

    void abort(String runId);
}
