package com.product.resolution.blocking;

import com.product.resolution.features.RecordFeatures;

import java.util.Set;

/**
 * Computes the cheap signatures used to group records into candidate buckets.
 * Records sharing any key become candidate pairs. An empty set sends the record
 * to the overflow bucket.
 */
public interface BlockingKeyStrategy {

    Set<String> generateKeys(RecordFeatures features);
}
