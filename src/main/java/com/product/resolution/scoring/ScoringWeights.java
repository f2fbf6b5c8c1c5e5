package com.product.resolution.scoring;

/**
 * Weights of the five pair-score components in the overall score.
 * Weights are non-negative and sum to at most 1.0; the remainder is headroom for the synergy bonus.
 */
public record ScoringWeights(
        double partNumber,
        double manufacturer,
        double text,
        double unspsc,
        double gtin
) {
    public ScoringWeights {
        if (partNumber < 0 || manufacturer < 0 || text < 0 || unspsc < 0 || gtin < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = partNumber + manufacturer + text + unspsc + gtin;
        if (sum > 1.0 + 1e-9) {
            throw new IllegalArgumentException("Weights must sum to at most 1.0, got " + sum);
        }
    }

    /**
     * Default weights: part number 0.30, manufacturer 0.20, text 0.15, UNSPSC 0.10, GTIN 0.25.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.30, 0.20, 0.15, 0.10, 0.25);
    }

    /**
     * Weights favoring identifiers (part number and GTIN) over descriptive text.
     */
    public static ScoringWeights identifierFocused() {
        return new ScoringWeights(0.40, 0.15, 0.05, 0.05, 0.35);
    }

    /**
     * Weights favoring descriptive text, for catalogs with unreliable part numbers.
     */
    public static ScoringWeights textFocused() {
        return new ScoringWeights(0.20, 0.20, 0.35, 0.10, 0.15);
    }

    public double sum() {
        return partNumber + manufacturer + text + unspsc + gtin;
    }
}
