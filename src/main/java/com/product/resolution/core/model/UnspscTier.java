package com.product.resolution.core.model;

/**
 * Depth of the shared UNSPSC hierarchy prefix between two codes.
 * UNSPSC codes are 8 digits: segment (2), family (4), class (6), commodity (8).
 */
public enum UnspscTier {
    EXACT(8, 1.0),
    CLASS(6, 0.8),
    FAMILY(4, 0.6),
    SEGMENT(2, 0.4),
    NONE(0, 0.0);

    private final int prefixLength;
    private final double score;

    UnspscTier(int prefixLength, double score) {
        this.prefixLength = prefixLength;
        this.score = score;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public double score() {
        return score;
    }

    /**
     * Returns the deepest tier at which the two codes agree.
     * Both codes are expected to be normalized (digits only).
     */
    public static UnspscTier between(String codeA, String codeB) {
        if (codeA == null || codeB == null || codeA.isEmpty() || codeB.isEmpty()) {
            return NONE;
        }
        if (codeA.equals(codeB)) {
            return EXACT;
        }
        for (UnspscTier tier : new UnspscTier[]{CLASS, FAMILY, SEGMENT}) {
            int len = tier.prefixLength;
            if (codeA.length() >= len && codeB.length() >= len
                    && codeA.regionMatches(0, codeB, 0, len)) {
                return tier;
            }
        }
        return NONE;
    }
}
