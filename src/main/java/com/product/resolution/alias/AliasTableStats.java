package com.product.resolution.alias;

/**
 * Size statistics of an alias table.
 *
 * @param canonicalCount number of canonical manufacturers
 * @param aliasCount     number of alias names (canonical names included)
 */
public record AliasTableStats(int canonicalCount, int aliasCount) {

    public double averageAliasesPerCanonical() {
        return (double) aliasCount / Math.max(1, canonicalCount);
    }
}
