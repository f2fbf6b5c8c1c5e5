package com.product.resolution.scoring;

import com.product.resolution.core.model.CanonicalManufacturer;
import com.product.resolution.core.model.ManufacturerComparison;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.similarity.JaroWinklerSimilarity;
import com.product.resolution.similarity.SimilarityAlgorithm;

/**
 * Scores manufacturers on their canonical identities: 1.0 when equal, otherwise
 * the Jaro-Winkler similarity of the canonical names.
 */
public class ManufacturerScorer implements ComponentScorer<ManufacturerComparison> {

    private final ScoringConfig config;
    private final SimilarityAlgorithm similarity = new JaroWinklerSimilarity();

    public ManufacturerScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public ManufacturerComparison score(RecordFeatures a, RecordFeatures b) {
        CanonicalManufacturer canonicalA = a.manufacturer();
        CanonicalManufacturer canonicalB = b.manufacturer();
        double weight = config.getWeights().manufacturer();
        String rawA = a.record().manufacturer();
        String rawB = b.record().manufacturer();

        if (canonicalA.isEmpty() || canonicalB.isEmpty()) {
            return new ManufacturerComparison(rawA, rawB, canonicalA, canonicalB, false, false, 0.0, weight);
        }
        boolean exact = canonicalA.sameAs(canonicalB);
        double score = exact ? 1.0 : similarity.compute(canonicalA.name(), canonicalB.name());
        return new ManufacturerComparison(rawA, rawB, canonicalA, canonicalB, exact, true, score, weight);
    }
}
