package com.product.resolution.scoring;

import com.product.resolution.core.model.UnspscComparison;
import com.product.resolution.core.model.UnspscTier;
import com.product.resolution.features.RecordFeatures;

/**
 * Scores UNSPSC codes by the depth of their shared hierarchy prefix.
 */
public class UnspscScorer implements ComponentScorer<UnspscComparison> {

    private final ScoringConfig config;

    public UnspscScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public UnspscComparison score(RecordFeatures a, RecordFeatures b) {
        double weight = config.getWeights().unspsc();
        if (!a.hasUnspsc() || !b.hasUnspsc()) {
            return new UnspscComparison(a.unspsc(), b.unspsc(), UnspscTier.NONE, false, 0.0, weight);
        }
        UnspscTier tier = UnspscTier.between(a.unspsc(), b.unspsc());
        return new UnspscComparison(a.unspsc(), b.unspsc(), tier, true, tier.score(), weight);
    }
}
