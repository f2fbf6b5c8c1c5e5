package com.product.resolution.blocking;

/**
 * What the blocker does with an overflow bucket larger than its cap.
 */
public enum OverflowPolicy {
    /** Generate no pairs from the bucket; its records become singletons unless paired elsewhere. */
    SKIP,
    /** Pair a deterministic, evenly spaced sample of {@code cap} members. */
    SAMPLE
}
