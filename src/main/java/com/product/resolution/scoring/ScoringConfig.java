package com.product.resolution.scoring;

import java.util.Objects;

/**
 * Constants of the pair-scoring formula.
 */
public class ScoringConfig {

    private static final double DEFAULT_SYNERGY_BONUS = 0.15;
    private static final int DEFAULT_SYNERGY_MIN_COMPONENTS = 3;
    private static final double DEFAULT_STRONG_THRESHOLD = 0.85;
    private static final double DEFAULT_PARTIAL_CEILING = 0.75;
    private static final double DEFAULT_JARO_WINKLER_WEIGHT = 0.5;
    private static final double DEFAULT_LEVENSHTEIN_WEIGHT = 0.5;
    private static final double DEFAULT_SUFFIX_ONLY_SCORE = 0.9;
    // Shortest matched-length ratio for each exact-match grade, and the grade scores.
    private static final double[] DEFAULT_MATCH_LENGTH_TIERS = {0.8, 0.6, 0.4};
    private static final double[] DEFAULT_MATCH_LENGTH_SCORES = {1.0, 0.75, 0.5, 0.25};
    private static final double DEFAULT_TITLE_WEIGHT = 0.3;
    private static final double DEFAULT_DESCRIPTION_WEIGHT = 0.2;
    private static final double DEFAULT_TFIDF_WEIGHT = 0.5;

    private final ScoringWeights weights;
    private final double synergyBonus;
    private final int synergyMinComponents;
    private final double strongThreshold;
    private final double partialCeiling;
    private final double jaroWinklerWeight;
    private final double levenshteinWeight;
    private final double suffixOnlyScore;
    private final double[] matchLengthTiers;
    private final double[] matchLengthScores;
    private final double titleWeight;
    private final double descriptionWeight;
    private final double tfidfWeight;
    private final boolean filterShortVariants;

    private ScoringConfig(Builder builder) {
        this.weights = builder.weights;
        this.synergyBonus = builder.synergyBonus;
        this.synergyMinComponents = builder.synergyMinComponents;
        this.strongThreshold = builder.strongThreshold;
        this.partialCeiling = builder.partialCeiling;
        this.jaroWinklerWeight = builder.jaroWinklerWeight;
        this.levenshteinWeight = builder.levenshteinWeight;
        this.suffixOnlyScore = builder.suffixOnlyScore;
        this.matchLengthTiers = builder.matchLengthTiers.clone();
        this.matchLengthScores = builder.matchLengthScores.clone();
        this.titleWeight = builder.titleWeight;
        this.descriptionWeight = builder.descriptionWeight;
        this.tfidfWeight = builder.tfidfWeight;
        this.filterShortVariants = builder.filterShortVariants;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public double getSynergyBonus() {
        return synergyBonus;
    }

    public int getSynergyMinComponents() {
        return synergyMinComponents;
    }

    public double getStrongThreshold() {
        return strongThreshold;
    }

    /**
     * Ceiling applied to a non-exact part-number match.
     */
    public double getPartialCeiling() {
        return partialCeiling;
    }

    public double getJaroWinklerWeight() {
        return jaroWinklerWeight;
    }

    public double getLevenshteinWeight() {
        return levenshteinWeight;
    }

    public double getSuffixOnlyScore() {
        return suffixOnlyScore;
    }

    /**
     * Score of an exact variant match, graded by the longest matched variant's length over the
     * average length of the two part numbers.
     */
    public double exactMatchScore(double lengthRatio) {
        for (int i = 0; i < matchLengthTiers.length; i++) {
            if (lengthRatio >= matchLengthTiers[i]) {
                return matchLengthScores[i];
            }
        }
        return matchLengthScores[matchLengthScores.length - 1];
    }

    public double getTitleWeight() {
        return titleWeight;
    }

    public double getDescriptionWeight() {
        return descriptionWeight;
    }

    public double getTfidfWeight() {
        return tfidfWeight;
    }

    /**
     * Whether variants too short relative to their part number are excluded from exact matching.
     */
    public boolean isFilterShortVariants() {
        return filterShortVariants;
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringWeights weights = ScoringWeights.defaultWeights();
        private double synergyBonus = DEFAULT_SYNERGY_BONUS;
        private int synergyMinComponents = DEFAULT_SYNERGY_MIN_COMPONENTS;
        private double strongThreshold = DEFAULT_STRONG_THRESHOLD;
        private double partialCeiling = DEFAULT_PARTIAL_CEILING;
        private double jaroWinklerWeight = DEFAULT_JARO_WINKLER_WEIGHT;
        private double levenshteinWeight = DEFAULT_LEVENSHTEIN_WEIGHT;
        private double suffixOnlyScore = DEFAULT_SUFFIX_ONLY_SCORE;
        private double[] matchLengthTiers = DEFAULT_MATCH_LENGTH_TIERS;
        private double[] matchLengthScores = DEFAULT_MATCH_LENGTH_SCORES;
        private double titleWeight = DEFAULT_TITLE_WEIGHT;
        private double descriptionWeight = DEFAULT_DESCRIPTION_WEIGHT;
        private double tfidfWeight = DEFAULT_TFIDF_WEIGHT;
        private boolean filterShortVariants = true;

        public Builder weights(ScoringWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights is required");
            return this;
        }

        public Builder synergyBonus(double synergyBonus) {
            validateUnit(synergyBonus, "synergyBonus");
            this.synergyBonus = synergyBonus;
            return this;
        }

        public Builder synergyMinComponents(int synergyMinComponents) {
            if (synergyMinComponents < 1 || synergyMinComponents > 5) {
                throw new IllegalArgumentException("synergyMinComponents must be between 1 and 5");
            }
            this.synergyMinComponents = synergyMinComponents;
            return this;
        }

        public Builder strongThreshold(double strongThreshold) {
            validateUnit(strongThreshold, "strongThreshold");
            this.strongThreshold = strongThreshold;
            return this;
        }

        public Builder partialCeiling(double partialCeiling) {
            validateUnit(partialCeiling, "partialCeiling");
            this.partialCeiling = partialCeiling;
            return this;
        }

        public Builder partNumberSubWeights(double jaroWinklerWeight, double levenshteinWeight) {
            validateUnit(jaroWinklerWeight, "jaroWinklerWeight");
            validateUnit(levenshteinWeight, "levenshteinWeight");
            validateSum(jaroWinklerWeight + levenshteinWeight, "part-number sub-weights");
            this.jaroWinklerWeight = jaroWinklerWeight;
            this.levenshteinWeight = levenshteinWeight;
            return this;
        }

        public Builder suffixOnlyScore(double suffixOnlyScore) {
            validateUnit(suffixOnlyScore, "suffixOnlyScore");
            this.suffixOnlyScore = suffixOnlyScore;
            return this;
        }

        /**
         * Grades exact variant matches by matched length.
         *
         * @param tiers  descending length ratios, one per grade except the last
         * @param scores descending grade scores, one more than {@code tiers}
         */
        public Builder matchLengthGrades(double[] tiers, double[] scores) {
            Objects.requireNonNull(tiers, "tiers is required");
            Objects.requireNonNull(scores, "scores is required");
            if (scores.length != tiers.length + 1) {
                throw new IllegalArgumentException("Expected " + (tiers.length + 1) + " grade scores, got "
                        + scores.length);
            }
            for (int i = 0; i < scores.length; i++) {
                validateUnit(scores[i], "match length score");
                if (i > 0 && scores[i] > scores[i - 1]) {
                    throw new IllegalArgumentException("match length scores must be descending");
                }
            }
            for (int i = 0; i < tiers.length; i++) {
                validateUnit(tiers[i], "match length tier");
                if (i > 0 && tiers[i] >= tiers[i - 1]) {
                    throw new IllegalArgumentException("match length tiers must be strictly descending");
                }
            }
            this.matchLengthTiers = tiers.clone();
            this.matchLengthScores = scores.clone();
            return this;
        }

        public Builder textSubWeights(double titleWeight, double descriptionWeight, double tfidfWeight) {
            validateUnit(titleWeight, "titleWeight");
            validateUnit(descriptionWeight, "descriptionWeight");
            validateUnit(tfidfWeight, "tfidfWeight");
            validateSum(titleWeight + descriptionWeight + tfidfWeight, "text sub-weights");
            this.titleWeight = titleWeight;
            this.descriptionWeight = descriptionWeight;
            this.tfidfWeight = tfidfWeight;
            return this;
        }

        public Builder filterShortVariants(boolean filterShortVariants) {
            this.filterShortVariants = filterShortVariants;
            return this;
        }

        public ScoringConfig build() {
            return new ScoringConfig(this);
        }

        private void validateUnit(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validateSum(double sum, String name) {
            if (sum > 1.0 + 1e-9) {
                throw new IllegalArgumentException(name + " must sum to at most 1.0, got " + sum);
            }
        }
    }
}
