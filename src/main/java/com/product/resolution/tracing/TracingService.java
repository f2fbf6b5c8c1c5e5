package com.product.resolution.tracing;

/**
 * Opens spans for resolution runs and their pipeline phases.
 * The default {@link NoOpTracingService} does nothing, so the engine runs
 * without any tracing dependency on the classpath.
 */
public interface TracingService {

    /**
     * Starts the root span of a resolution run.
     */
    Span startRun(String runId);

    /**
     * Starts the span of one pipeline phase of a run: load, features, block, score, cluster or publish.
     */
    Span startPhase(String runId, String phase);
}
