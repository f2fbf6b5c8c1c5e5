package com.product.resolution.similarity;

/**
 * Interface for string similarity algorithms used by the pair scorer and the alias resolver.
 * Implementations return a score between 0.0 (no similarity) and 1.0 (identical) and
 * must give the same result for {@code compute(a, b)} and {@code compute(b, a)}.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
