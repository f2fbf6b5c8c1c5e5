package com.product.resolution.features;

import com.product.resolution.alias.ManufacturerAliasResolver;
import com.product.resolution.core.model.CanonicalManufacturer;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.rules.PartNumberNormalizer;
import com.product.resolution.rules.VariantGenerator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives {@link RecordFeatures} from a raw record. Stateless apart from the
 * alias resolver's cache; safe to share between threads.
 */
public class FeatureExtractor {

    private static final Set<String> GTIN_PLACEHOLDERS = Set.of("NAN", "NONE", "NULL", "N/A", "0");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern TRAILING_DECIMAL = Pattern.compile("\\.0+$");

    private final PartNumberNormalizer partNumberNormalizer;
    private final VariantGenerator variantGenerator;
    private final ManufacturerAliasResolver aliasResolver;

    public FeatureExtractor(PartNumberNormalizer partNumberNormalizer,
                            VariantGenerator variantGenerator,
                            ManufacturerAliasResolver aliasResolver) {
        this.partNumberNormalizer = Objects.requireNonNull(partNumberNormalizer, "partNumberNormalizer is required");
        this.variantGenerator = Objects.requireNonNull(variantGenerator, "variantGenerator is required");
        this.aliasResolver = Objects.requireNonNull(aliasResolver, "aliasResolver is required");
    }

    public RecordFeatures extract(ProductRecord record) {
        CanonicalManufacturer manufacturer = aliasResolver.canonicalize(record.manufacturer());
        String normalizedPartNumber = partNumberNormalizer.normalize(record.partNumber());
        List<String> variants = normalizedPartNumber.isEmpty()
                ? List.of()
                : variantGenerator.generate(normalizedPartNumber,
                        manufacturer.isEmpty() ? null : manufacturer.name());
        return new RecordFeatures(record, normalizedPartNumber, variants, manufacturer,
                normalizeUnspsc(record.unspsc()), normalizeGtin(record.gtin()));
    }

    /**
     * Keeps the digits of a UNSPSC code. Codes exported as decimals ({@code 43211503.0})
     * lose the fraction; an all-zero code counts as absent.
     */
    public static String normalizeUnspsc(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String digits = NON_DIGIT.matcher(TRAILING_DECIMAL.matcher(raw.trim()).replaceAll("")).replaceAll("");
        return digits.chars().allMatch(c -> c == '0') ? "" : digits;
    }

    /**
     * Upper-cases a GTIN and keeps its alphanumerics without leading zero padding, so a
     * GTIN-13 and its zero-padded GTIN-14 compare equal. Placeholders count as absent.
     */
    public static String normalizeGtin(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        if (GTIN_PLACEHOLDERS.contains(upper)) {
            return "";
        }
        String cleaned = NON_ALPHANUMERIC.matcher(TRAILING_DECIMAL.matcher(upper).replaceAll("")).replaceAll("");
        int start = 0;
        while (start < cleaned.length() && cleaned.charAt(start) == '0') {
            start++;
        }
        return cleaned.substring(start);
    }
}
