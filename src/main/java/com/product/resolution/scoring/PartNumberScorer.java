package com.product.resolution.scoring;

import com.product.resolution.core.model.PartNumberComparison;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.rules.VariantGenerator;
import com.product.resolution.similarity.JaroWinklerSimilarity;
import com.product.resolution.similarity.LevenshteinSimilarity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores part numbers by the best match across both variant sets.
 * An exact variant match is graded by how much of the part numbers the longest matched
 * variant keeps, 1.0 when it keeps at least 80%. Otherwise the best Jaro-Winkler and
 * Levenshtein similarities are blended and capped by the partial-match ceiling; when some
 * variant pair differs only by a unit or revision suffix the pair scores at least the
 * suffix-only score under that ceiling.
 */
public class PartNumberScorer implements ComponentScorer<PartNumberComparison> {

    private static final Set<String> SUFFIX_WORDS = Set.of(
            "EA", "EACH", "PCS", "PIECES", "PIECE", "PK", "PACK", "UNIT", "UNITS", "CT", "COUNT",
            "QTY", "QUANTITY", "BULK", "RETAIL", "CONSUMER", "COMMERCIAL", "STD", "STANDARD",
            "NEW", "OLD", "ORIGINAL", "REPLACEMENT", "REFURB");
    private static final Pattern VERSION_SUFFIX = Pattern.compile("(?:REV|VERSION|V|R)\\d{1,3}");
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[-_/.\\s]+");

    private final ScoringConfig config;
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    public PartNumberScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public PartNumberComparison score(RecordFeatures a, RecordFeatures b) {
        double weight = config.getWeights().partNumber();
        if (!a.hasPartNumber() || !b.hasPartNumber()) {
            return PartNumberComparison.notApplicable(a.normalizedPartNumber(), b.normalizedPartNumber(),
                    a.variants(), b.variants(), weight);
        }

        List<String> eligibleA = eligible(a);
        List<String> eligibleB = eligible(b);
        Set<String> setB = new HashSet<>(eligibleB);

        List<String> matched = new ArrayList<>();
        for (String variant : eligibleA) {
            if (setB.contains(variant)) {
                matched.add(variant);
            }
        }
        matched.sort(null);
        boolean exact = !matched.isEmpty();

        double bestJw = 0.0;
        double bestLev = 0.0;
        boolean suffixOnly = false;
        int commonPrefix = 0;
        int commonSuffix = 0;
        for (String va : eligibleA) {
            for (String vb : eligibleB) {
                bestJw = Math.max(bestJw, jaroWinkler.compute(va, vb));
                bestLev = Math.max(bestLev, levenshtein.compute(va, vb));
                suffixOnly = suffixOnly || isSuffixOnlyDifference(va, vb);
                commonPrefix = Math.max(commonPrefix, LevenshteinSimilarity.commonPrefixLength(va, vb));
                commonSuffix = Math.max(commonSuffix, LevenshteinSimilarity.commonSuffixLength(va, vb));
            }
        }

        double matchedLength = exact ? matchedLengthRatio(matched, a, b) : 0.0;
        double score;
        if (exact) {
            score = config.exactMatchScore(matchedLength);
        } else {
            double blended = config.getJaroWinklerWeight() * bestJw + config.getLevenshteinWeight() * bestLev;
            double floor = suffixOnly ? config.getSuffixOnlyScore() : 0.0;
            score = config.getPartialCeiling() * Math.max(blended, floor);
        }

        return new PartNumberComparison(a.normalizedPartNumber(), b.normalizedPartNumber(),
                a.variants(), b.variants(), matched, exact, matchedLength, bestJw, bestLev, suffixOnly,
                commonPrefix, commonSuffix, true, clamp(score), weight);
    }

    /**
     * Longest matched variant over the average length of the two part numbers, spaces ignored.
     */
    private static double matchedLengthRatio(List<String> matched, RecordFeatures a, RecordFeatures b) {
        int longest = 0;
        for (String variant : matched) {
            longest = Math.max(longest, joined(variant).length());
        }
        double average = (joined(a.normalizedPartNumber()).length()
                + joined(b.normalizedPartNumber()).length()) / 2.0;
        return clamp(longest / average);
    }

    private static String joined(String value) {
        return value.replace(" ", "");
    }

    /**
     * Whether one part number is the other followed only by a unit, packaging or revision suffix.
     */
    static boolean isSuffixOnlyDifference(String pn1, String pn2) {
        boolean firstShorter = pn1.length() <= pn2.length();
        String shorter = firstShorter ? pn1 : pn2;
        String longer = firstShorter ? pn2 : pn1;
        if (shorter.isEmpty() || longer.length() == shorter.length() || !longer.startsWith(shorter)) {
            return false;
        }
        String suffix = LEADING_SEPARATORS.matcher(longer.substring(shorter.length())).replaceAll("")
                .trim().toUpperCase(Locale.ROOT);
        if (suffix.isEmpty()) {
            return false;
        }
        return SUFFIX_WORDS.contains(suffix)
                || VERSION_SUFFIX.matcher(suffix).matches()
                || (suffix.length() == 1 && Character.isLetter(suffix.charAt(0)));
    }

    private List<String> eligible(RecordFeatures features) {
        if (!config.isFilterShortVariants()) {
            return features.variants();
        }
        int originalLength = features.normalizedPartNumber().length();
        List<String> kept = new ArrayList<>();
        for (String variant : features.variants()) {
            if (!VariantGenerator.isShortVariant(originalLength, variant)) {
                kept.add(variant);
            }
        }
        return kept;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
