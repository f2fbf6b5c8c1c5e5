package com.product.resolution.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of case-folded word tokens.
 * By default any run of non-alphanumeric characters separates tokens, so
 * "3/4in. hex-bolt" yields {3, 4in, hex, bolt}.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final String DEFAULT_SEPARATOR = "[^\\p{L}\\p{N}]+";

    private final Pattern separator;

    public JaccardSimilarity() {
        this(DEFAULT_SEPARATOR);
    }

    public JaccardSimilarity(String separatorPattern) {
        this.separator = Pattern.compile(separatorPattern);
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Tokenizes a string into a set of lower-case tokens.
     */
    public Set<String> tokenize(String s) {
        Set<String> tokenSet = new HashSet<>();
        for (String token : separator.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
