package com.product.resolution.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.product.resolution.core.model.GtinComparison;
import com.product.resolution.core.model.ManufacturerComparison;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.PartNumberComparison;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.core.model.TextComparison;
import com.product.resolution.core.model.UnspscComparison;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Full similarity breakdown of two records, serialisable as snake_case JSON.
 * Sides are reported in the order the caller asked for them.
 *
 * <pre>
 * {
 *   "product_a": {...}, "product_b": {...},
 *   "comparison": {
 *     "part_number": {...}, "manufacturer": {...}, "text": {...},
 *     "unspsc": {...} | null, "gtin": {...} | null, "synergy_bonus": 0.15
 *   },
 *   "overall_score": 0.91
 * }
 * </pre>
 */
public record ComparisonResult(
        @JsonProperty("product_a") ProductView productA,
        @JsonProperty("product_b") ProductView productB,
        @JsonProperty("comparison") Breakdown comparison,
        @JsonProperty("overall_score") double overallScore
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record ProductView(
            @JsonProperty("id") String id,
            @JsonProperty("source_key") String sourceKey,
            @JsonProperty("manufacturer") String manufacturer,
            @JsonProperty("part_number") String partNumber,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description
    ) {
        static ProductView of(ProductRecord record) {
            return new ProductView(record.id(), record.sourceKey(), record.manufacturer(), record.partNumber(),
                    record.title(), record.description());
        }
    }

    public record Breakdown(
            @JsonProperty("part_number") PartNumberView partNumber,
            @JsonProperty("manufacturer") ManufacturerView manufacturer,
            @JsonProperty("text") TextView text,
            @JsonProperty("unspsc") UnspscView unspsc,
            @JsonProperty("gtin") GtinView gtin,
            @JsonProperty("synergy_bonus") double synergyBonus
    ) {
    }

    public record PartNumberView(
            @JsonProperty("variants_a") List<String> variantsA,
            @JsonProperty("variants_b") List<String> variantsB,
            @JsonProperty("matched_variants") List<String> matchedVariants,
            @JsonProperty("exact") boolean exact,
            @JsonProperty("matched_length") double matchedLength,
            @JsonProperty("jaro_winkler") double jaroWinkler,
            @JsonProperty("levenshtein") double levenshtein,
            @JsonProperty("suffix_only") boolean suffixOnly,
            @JsonProperty("score") double score,
            @JsonProperty("score_contribution") double scoreContribution
    ) {
        static PartNumberView of(PartNumberComparison c, boolean swap) {
            return new PartNumberView(swap ? c.variantsB() : c.variantsA(), swap ? c.variantsA() : c.variantsB(),
                    c.matchedVariants(), c.exactMatch(), c.matchedLength(), c.jaroWinkler(), c.levenshtein(),
                    c.suffixOnlyMatch(), c.score(), c.contribution());
        }
    }

    public record ManufacturerView(
            @JsonProperty("raw_a") String rawA,
            @JsonProperty("raw_b") String rawB,
            @JsonProperty("canonical_a") String canonicalA,
            @JsonProperty("canonical_b") String canonicalB,
            @JsonProperty("similarity") double similarity,
            @JsonProperty("score_contribution") double scoreContribution
    ) {
        static ManufacturerView of(ManufacturerComparison c, boolean swap) {
            String canonicalA = c.canonicalA().name();
            String canonicalB = c.canonicalB().name();
            return swap
                    ? new ManufacturerView(c.rawB(), c.rawA(), canonicalB, canonicalA, c.score(), c.contribution())
                    : new ManufacturerView(c.rawA(), c.rawB(), canonicalA, canonicalB, c.score(), c.contribution());
        }
    }

    public record TextView(
            @JsonProperty("title_similarity") double titleSimilarity,
            @JsonProperty("description_similarity") double descriptionSimilarity,
            @JsonProperty("tfidf_cosine") double tfidfCosine,
            @JsonProperty("score") double score,
            @JsonProperty("score_contribution") double scoreContribution
    ) {
        static TextView of(TextComparison c) {
            return new TextView(c.titleSimilarity(), c.descriptionSimilarity(), c.tfidfCosine(), c.score(),
                    c.contribution());
        }
    }

    public record UnspscView(
            @JsonProperty("code_a") String codeA,
            @JsonProperty("code_b") String codeB,
            @JsonProperty("tier") String tier,
            @JsonProperty("score_contribution") double scoreContribution
    ) {
        static UnspscView of(UnspscComparison c, boolean swap) {
            if (!c.applicable()) {
                return null;
            }
            return new UnspscView(swap ? c.codeB() : c.codeA(), swap ? c.codeA() : c.codeB(),
                    c.tier().name().toLowerCase(Locale.ROOT), c.contribution());
        }
    }

    public record GtinView(
            @JsonProperty("code_a") String codeA,
            @JsonProperty("code_b") String codeB,
            @JsonProperty("equal") boolean equal,
            @JsonProperty("score_contribution") double scoreContribution
    ) {
        static GtinView of(GtinComparison c, boolean swap) {
            if (!c.bothPresent()) {
                return null;
            }
            return new GtinView(swap ? c.codeB() : c.codeA(), swap ? c.codeA() : c.codeB(), c.equal(),
                    c.contribution());
        }
    }

    /**
     * Builds the view of {@code score} with {@code first} reported as product A.
     */
    public static ComparisonResult of(ProductRecord first, ProductRecord second, PairScore score) {
        boolean swap = !first.id().equals(score.pair().idA());
        Breakdown breakdown = new Breakdown(
                PartNumberView.of(score.partNumber(), swap),
                ManufacturerView.of(score.manufacturer(), swap),
                TextView.of(score.text()),
                UnspscView.of(score.unspsc(), swap),
                GtinView.of(score.gtin(), swap),
                score.synergyBonus());
        return new ComparisonResult(ProductView.of(first), ProductView.of(second), breakdown, score.overallScore());
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialise comparison of "
                    + productA.id() + " and " + productB.id(), e);
        }
    }
}
