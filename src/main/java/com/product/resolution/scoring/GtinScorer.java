package com.product.resolution.scoring;

import com.product.resolution.core.model.GtinComparison;
import com.product.resolution.features.RecordFeatures;

/**
 * GTIN is an exact-match-only signal: 1.0 when both codes are present and equal.
 * Any other case, a mismatch included, is not applicable; the mismatch stays visible
 * on the breakdown.
 */
public class GtinScorer implements ComponentScorer<GtinComparison> {

    private final ScoringConfig config;

    public GtinScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public GtinComparison score(RecordFeatures a, RecordFeatures b) {
        double weight = config.getWeights().gtin();
        boolean equal = a.hasGtin() && b.hasGtin() && a.gtin().equals(b.gtin());
        return new GtinComparison(a.gtin(), b.gtin(), equal, equal, equal ? 1.0 : 0.0, weight);
    }
}
