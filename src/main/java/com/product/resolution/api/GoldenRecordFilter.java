package com.product.resolution.api;

import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.Representative;
import com.product.resolution.rules.ManufacturerNormalizer;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Criteria for listing golden records. Unset criteria match everything; set criteria are
 * combined with AND. Values are validated when the filter is built.
 */
public final class GoldenRecordFilter implements Predicate<GoldenRecord> {

    private static final ManufacturerNormalizer MANUFACTURER_NORMALIZER = new ManufacturerNormalizer();
    private static final GoldenRecordFilter NONE = builder().build();

    private final String manufacturer;
    private final String unspscPrefix;
    private final int minSize;
    private final int maxSize;
    private final String text;
    private final String sourceKey;

    private GoldenRecordFilter(Builder builder) {
        this.manufacturer = builder.manufacturer;
        this.unspscPrefix = builder.unspscPrefix;
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.text = builder.text;
        this.sourceKey = builder.sourceKey;
    }

    /**
     * A filter that matches every golden record.
     */
    public static GoldenRecordFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean test(GoldenRecord golden) {
        Representative rep = golden.representative();
        if (manufacturer != null && !manufacturer.equalsIgnoreCase(rep.canonicalManufacturer())) {
            return false;
        }
        if (unspscPrefix != null && !rep.unspsc().startsWith(unspscPrefix)) {
            return false;
        }
        if (golden.size() < minSize || golden.size() > maxSize) {
            return false;
        }
        if (sourceKey != null && !golden.sourceKeys().contains(sourceKey)) {
            return false;
        }
        return text == null
                || containsText(rep.title())
                || containsText(rep.description())
                || containsText(rep.partNumber())
                || containsText(rep.normalizedPartNumber());
    }

    private boolean containsText(String value) {
        return value.toLowerCase(Locale.ROOT).contains(text);
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public String getUnspscPrefix() {
        return unspscPrefix;
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public String getText() {
        return text;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public static class Builder {
        private String manufacturer;
        private String unspscPrefix;
        private int minSize = 1;
        private int maxSize = Integer.MAX_VALUE;
        private String text;
        private String sourceKey;

        /**
         * Matches the canonical manufacturer of the representative. The value is normalized
         * like a raw manufacturer, so {@code "3M Company"} matches {@code 3M}; aliases are not resolved.
         */
        public Builder manufacturer(String manufacturer) {
            String value = blankToNull(manufacturer);
            this.manufacturer = value == null ? null : blankToNull(MANUFACTURER_NORMALIZER.normalize(value));
            return this;
        }

        /**
         * Matches representatives whose UNSPSC code starts with the given digits.
         */
        public Builder unspscPrefix(String unspscPrefix) {
            String prefix = blankToNull(unspscPrefix);
            if (prefix != null && !prefix.chars().allMatch(c -> c >= '0' && c <= '9')) {
                throw new IllegalArgumentException("unspscPrefix must contain digits only, got '" + unspscPrefix + "'");
            }
            if (prefix != null && prefix.length() > 8) {
                throw new IllegalArgumentException("unspscPrefix must be at most 8 digits, got " + prefix.length());
            }
            this.unspscPrefix = prefix;
            return this;
        }

        public Builder minSize(int minSize) {
            if (minSize < 0) {
                throw new IllegalArgumentException("minSize must be >= 0");
            }
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (maxSize < 0) {
                throw new IllegalArgumentException("maxSize must be >= 0");
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder sizeRange(int minSize, int maxSize) {
            return minSize(minSize).maxSize(maxSize);
        }

        /**
         * Case-insensitive substring match over representative title, description and part number.
         */
        public Builder text(String text) {
            String value = blankToNull(text);
            this.text = value != null ? value.toLowerCase(Locale.ROOT) : null;
            return this;
        }

        public Builder sourceKey(String sourceKey) {
            this.sourceKey = blankToNull(sourceKey);
            return this;
        }

        public GoldenRecordFilter build() {
            if (minSize > maxSize) {
                throw new IllegalArgumentException("minSize must be <= maxSize (" + minSize + " > " + maxSize + ")");
            }
            return new GoldenRecordFilter(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
