package com.product.resolution.core.model;

/**
 * UNSPSC component: tiered by the depth of the shared hierarchy prefix.
 * Not applicable when either code is missing.
 */
public record UnspscComparison(
        String codeA,
        String codeB,
        UnspscTier tier,
        boolean applicable,
        double score,
        double weight
) implements ComponentScore {

    @Override
    public String name() {
        return "unspsc";
    }
}
