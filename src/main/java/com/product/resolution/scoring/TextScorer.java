package com.product.resolution.scoring;

import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.core.model.TextComparison;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.similarity.JaccardSimilarity;
import com.product.resolution.similarity.TfIdfCosineSimilarity;

/**
 * Scores descriptive text: title Jaccard, description Jaccard and a TF-IDF cosine over
 * title plus description, combined with the configured text sub-weights. Not applicable
 * when either record has neither title nor description.
 */
public class TextScorer implements ComponentScorer<TextComparison> {

    private final ScoringConfig config;
    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final TfIdfCosineSimilarity tfidf = new TfIdfCosineSimilarity();

    public TextScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public TextComparison score(RecordFeatures a, RecordFeatures b) {
        double weight = config.getWeights().text();
        if (!a.hasText() || !b.hasText()) {
            return new TextComparison(0.0, 0.0, 0.0, false, 0.0, weight);
        }
        ProductRecord ra = a.record();
        ProductRecord rb = b.record();

        double title = jaccard.compute(ra.title(), rb.title());
        double description = jaccard.compute(ra.description(), rb.description());
        double cosine = tfidf.compute(document(ra), document(rb));

        double score = config.getTitleWeight() * title
                + config.getDescriptionWeight() * description
                + config.getTfidfWeight() * cosine;
        return new TextComparison(title, description, cosine, true, Math.min(1.0, score), weight);
    }

    private static String document(ProductRecord record) {
        return (record.title() + " " + record.description()).trim();
    }
}
