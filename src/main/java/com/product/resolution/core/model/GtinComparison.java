package com.product.resolution.core.model;

/**
 * GTIN component: an exact-match-only signal.
 * Applicable only when both codes are present and equal; a mismatch is recorded
 * but does not count against the pair.
 */
public record GtinComparison(
        String codeA,
        String codeB,
        boolean equal,
        boolean applicable,
        double score,
        double weight
) implements ComponentScore {

    @Override
    public String name() {
        return "gtin";
    }

    public boolean bothPresent() {
        return !codeA.isEmpty() && !codeB.isEmpty();
    }

    public boolean mismatch() {
        return bothPresent() && !equal;
    }
}
