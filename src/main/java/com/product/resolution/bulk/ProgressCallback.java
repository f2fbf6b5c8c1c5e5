package com.product.resolution.bulk;

/**
 * Callback for tracking progress of bulk reads and writes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of items processed so far
     * @param total     the total number of items (-1 if unknown)
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
