package com.product.resolution.api;

/**
 * Thrown when a resolution run fails. Nothing of the failed run is published.
 */
public class ResolutionException extends RuntimeException {

    private final String runId;

    public ResolutionException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
