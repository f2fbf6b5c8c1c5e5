package com.product.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of scoring one candidate pair. Components are stored for the pair's
 * canonical order ({@link CandidatePair#idA()} first), which makes the score
 * independent of the order in which the two records were requested.
 *
 * @param pair          the scored pair
 * @param partNumber    part-number component
 * @param manufacturer  manufacturer component
 * @param text          title/description component
 * @param unspsc        UNSPSC component
 * @param gtin          GTIN component
 * @param weightedSum   sum of component contributions
 * @param synergyBonus  bonus for corroborating strong signals (0 when not earned)
 * @param overallScore  {@code weightedSum + synergyBonus} clamped to [0, 1]
 */
public record PairScore(
        CandidatePair pair,
        PartNumberComparison partNumber,
        ManufacturerComparison manufacturer,
        TextComparison text,
        UnspscComparison unspsc,
        GtinComparison gtin,
        double weightedSum,
        double synergyBonus,
        double overallScore
) {
    public PairScore {
        Objects.requireNonNull(pair, "pair is required");
        if (overallScore < 0.0 || overallScore > 1.0) {
            throw new IllegalArgumentException("overallScore must be between 0.0 and 1.0, got " + overallScore);
        }
    }

    /**
     * Returns the five components in a fixed order.
     */
    public List<ComponentScore> components() {
        return List.of(partNumber, manufacturer, text, unspsc, gtin);
    }

    public boolean synergyApplied() {
        return synergyBonus > 0.0;
    }

    public boolean meetsThreshold(double threshold) {
        return overallScore >= threshold;
    }
}
