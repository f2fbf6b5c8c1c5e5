package com.product.resolution.scoring;

import com.product.resolution.core.model.ComponentScore;
import com.product.resolution.features.RecordFeatures;

/**
 * Computes one component of a pair score.
 * Callers pass the two records in id order; implementations must be symmetric anyway.
 *
 * @param <T> the component breakdown type
 */
public interface ComponentScorer<T extends ComponentScore> {

    T score(RecordFeatures a, RecordFeatures b);
}
