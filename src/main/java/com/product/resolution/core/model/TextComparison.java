package com.product.resolution.core.model;

/**
 * Text component over titles and descriptions.
 *
 * @param titleSimilarity       token Jaccard of the titles
 * @param descriptionSimilarity token Jaccard of the descriptions
 * @param tfidfCosine           TF-IDF cosine over title + description
 * @param applicable            whether both records have any title or description text
 * @param score                 weighted combination of the three sub-metrics
 * @param weight                configured component weight
 */
public record TextComparison(
        double titleSimilarity,
        double descriptionSimilarity,
        double tfidfCosine,
        boolean applicable,
        double score,
        double weight
) implements ComponentScore {

    @Override
    public String name() {
        return "text";
    }
}
