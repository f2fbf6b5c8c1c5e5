package com.product.resolution.similarity;

/**
 * Jaro similarity boosted by a shared leading run of up to four characters.
 *
 * <p>Part numbers and manufacturer names that agree on their stem and differ in trailing
 * codes score high. The greedy Jaro match is order-sensitive in rare cases, so arguments
 * are put in lexicographic order first and the result is symmetric.</p>
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final double MAX_PREFIX_SCALE = 0.25;
    private static final int BOOSTED_PREFIX = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    /**
     * @param prefixScale weight of each shared leading character, at most 0.25 so the score stays within 1.0
     */
    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > MAX_PREFIX_SCALE) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and " + MAX_PREFIX_SCALE);
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return s1 != null && s1.equals(s2) ? 1.0 : 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        String first = s1.compareTo(s2) <= 0 ? s1 : s2;
        String second = first == s1 ? s2 : s1;

        double jaro = jaro(first, second);
        int prefix = Math.min(BOOSTED_PREFIX, LevenshteinSimilarity.commonPrefixLength(first, second));
        return Math.min(1.0, jaro + prefix * prefixScale * (1.0 - jaro));
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private static double jaro(String first, String second) {
        int window = Math.max(0, Math.max(first.length(), second.length()) / 2 - 1);
        boolean[] taken = new boolean[second.length()];
        StringBuilder matchedFirst = new StringBuilder();

        for (int i = 0; i < first.length(); i++) {
            char c = first.charAt(i);
            int from = Math.max(0, i - window);
            int to = Math.min(second.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!taken[j] && second.charAt(j) == c) {
                    taken[j] = true;
                    matchedFirst.append(c);
                    break;
                }
            }
        }

        int matches = matchedFirst.length();
        if (matches == 0) {
            return 0.0;
        }

        int outOfOrder = 0;
        int k = 0;
        for (int j = 0; j < second.length(); j++) {
            if (taken[j]) {
                if (second.charAt(j) != matchedFirst.charAt(k)) {
                    outOfOrder++;
                }
                k++;
            }
        }

        double m = matches;
        return (m / first.length() + m / second.length() + (m - outOfOrder / 2.0) / m) / 3.0;
    }
}
