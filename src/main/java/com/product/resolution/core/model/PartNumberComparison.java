package com.product.resolution.core.model;

import java.util.List;

/**
 * Part-number component: best match across the two variant sets.
 *
 * @param normalizedA     normalized part number of the first record
 * @param normalizedB     normalized part number of the second record
 * @param variantsA       variant set of the first record (normalized original first)
 * @param variantsB       variant set of the second record
 * @param matchedVariants variants present in both sets and long enough to count as exact
 * @param exactMatch      whether {@code matchedVariants} is non-empty
 * @param matchedLength   longest matched variant over the average part-number length, capped at 1.0;
 *                        0.0 without an exact match
 * @param jaroWinkler     best Jaro-Winkler similarity over all variant pairs
 * @param levenshtein     best normalized Levenshtein similarity over all variant pairs
 * @param suffixOnlyMatch whether some variant pair differs only by a unit/revision suffix
 * @param commonPrefix    longest common prefix over all variant pairs
 * @param commonSuffix    longest common suffix over all variant pairs
 * @param applicable      whether both part numbers are present
 * @param score           combined component score
 * @param weight          configured component weight
 */
public record PartNumberComparison(
        String normalizedA,
        String normalizedB,
        List<String> variantsA,
        List<String> variantsB,
        List<String> matchedVariants,
        boolean exactMatch,
        double matchedLength,
        double jaroWinkler,
        double levenshtein,
        boolean suffixOnlyMatch,
        int commonPrefix,
        int commonSuffix,
        boolean applicable,
        double score,
        double weight
) implements ComponentScore {

    public PartNumberComparison {
        variantsA = List.copyOf(variantsA);
        variantsB = List.copyOf(variantsB);
        matchedVariants = List.copyOf(matchedVariants);
    }

    public static PartNumberComparison notApplicable(String normalizedA, String normalizedB,
                                                     List<String> variantsA, List<String> variantsB,
                                                     double weight) {
        return new PartNumberComparison(normalizedA, normalizedB, variantsA, variantsB, List.of(),
                false, 0.0, 0.0, 0.0, false, 0, 0, false, 0.0, weight);
    }

    @Override
    public String name() {
        return "part_number";
    }
}
