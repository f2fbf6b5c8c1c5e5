package com.product.resolution.similarity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF cosine similarity computed over a corpus made of the two compared documents only.
 * Terms are lower-cased word unigrams and bigrams of two or more word characters.
 * IDF is smoothed ({@code ln((1 + n) / (1 + df)) + 1}) and both vectors are L2-normalized,
 * so the value depends on nothing but the two inputs.
 */
public class TfIdfCosineSimilarity implements SimilarityAlgorithm {

    private static final Pattern TOKEN = Pattern.compile("(?U)\\b\\w\\w+\\b");
    private static final int DOCUMENT_COUNT = 2;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Map<String, Integer> tf1 = termCounts(s1);
        Map<String, Integer> tf2 = termCounts(s2);
        if (tf1.isEmpty() || tf2.isEmpty()) {
            return 0.0;
        }

        Map<String, Double> v1 = weigh(tf1, tf2);
        Map<String, Double> v2 = weigh(tf2, tf1);

        double dot = 0.0;
        for (Map.Entry<String, Double> entry : v1.entrySet()) {
            Double other = v2.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        double norms = norm(v1) * norm(v2);
        if (norms == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / norms));
    }

    @Override
    public String getName() {
        return "TF-IDF Cosine";
    }

    /**
     * Extracts unigram and bigram counts for one document.
     */
    Map<String, Integer> termCounts(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            counts.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                counts.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        return counts;
    }

    private Map<String, Double> weigh(Map<String, Integer> own, Map<String, Integer> other) {
        Map<String, Double> vector = new HashMap<>();
        Set<String> terms = new HashSet<>(own.keySet());
        for (String term : terms) {
            int df = other.containsKey(term) ? 2 : 1;
            double idf = Math.log((1.0 + DOCUMENT_COUNT) / (1.0 + df)) + 1.0;
            vector.put(term, own.get(term) * idf);
        }
        return vector;
    }

    private static double norm(Map<String, Double> vector) {
        double sum = 0.0;
        for (double value : vector.values()) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }
}
