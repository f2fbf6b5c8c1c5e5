package com.product.resolution.similarity;

/**
 * Edit-distance metrics for part-number variants.
 *
 * <p>{@link #compute} is {@code 1 - distance / longerLength}. The prefix and suffix helpers
 * report how many leading or trailing characters two variants share, which the part-number
 * breakdown records next to the similarity.</p>
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return s1 != null && s1.equals(s2) ? 1.0 : 0.0;
        }
        int longer = Math.max(s1.length(), s2.length());
        return 1.0 - (double) distance(s1, s2) / longer;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Number of single-character insertions, deletions or substitutions turning one string
     * into the other. Uses one row sized to the shorter string plus the saved diagonal cell.
     */
    public int distance(String s1, String s2) {
        String row = s1.length() <= s2.length() ? s1 : s2;
        String column = row == s1 ? s2 : s1;
        if (row.isEmpty()) {
            return column.length();
        }

        int[] costs = new int[row.length() + 1];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = i;
        }
        for (int j = 1; j <= column.length(); j++) {
            char c = column.charAt(j - 1);
            int diagonal = costs[0];
            costs[0] = j;
            for (int i = 1; i < costs.length; i++) {
                int above = costs[i];
                int substitution = diagonal + (row.charAt(i - 1) == c ? 0 : 1);
                costs[i] = Math.min(substitution, Math.min(above, costs[i - 1]) + 1);
                diagonal = above;
            }
        }
        return costs[row.length()];
    }

    /**
     * Length of the longest shared leading run.
     */
    public static int commonPrefixLength(String s1, String s2) {
        int limit = Math.min(s1.length(), s2.length());
        int length = 0;
        while (length < limit && s1.charAt(length) == s2.charAt(length)) {
            length++;
        }
        return length;
    }

    /**
     * Length of the longest shared trailing run.
     */
    public static int commonSuffixLength(String s1, String s2) {
        int limit = Math.min(s1.length(), s2.length());
        int length = 0;
        while (length < limit
                && s1.charAt(s1.length() - 1 - length) == s2.charAt(s2.length() - 1 - length)) {
            length++;
        }
        return length;
    }
}
