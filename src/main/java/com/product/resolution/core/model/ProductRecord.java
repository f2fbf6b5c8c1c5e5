package com.product.resolution.core.model;

import java.util.Objects;

/**
 * An immutable product item as delivered by one vendor catalog.
 * Created once at ingestion and only referenced by id afterwards.
 *
 * <p>Text fields are never null; absent values are stored as the empty string.
 * {@code unspsc} and {@code gtin} are optional signals and frequently empty.</p>
 *
 * @param id           unique record id within the source
 * @param sourceKey    origin catalog or contract identifier
 * @param manufacturer raw manufacturer name as written by the vendor
 * @param partNumber   raw manufacturer part number as written by the vendor
 * @param title        short product title
 * @param description  long product description
 * @param unspsc       optional UNSPSC classification code
 * @param gtin         optional GTIN / UPC / EAN
 */
public record ProductRecord(
        String id,
        String sourceKey,
        String manufacturer,
        String partNumber,
        String title,
        String description,
        String unspsc,
        String gtin
) {
    public ProductRecord {
        Objects.requireNonNull(id, "id is required");
        sourceKey = orEmpty(sourceKey);
        manufacturer = orEmpty(manufacturer);
        partNumber = orEmpty(partNumber);
        title = orEmpty(title);
        description = orEmpty(description);
        unspsc = orEmpty(unspsc);
        gtin = orEmpty(gtin);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceKey;
        private String manufacturer;
        private String partNumber;
        private String title;
        private String description;
        private String unspsc;
        private String gtin;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceKey(String sourceKey) {
            this.sourceKey = sourceKey;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }

        public Builder partNumber(String partNumber) {
            this.partNumber = partNumber;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder unspsc(String unspsc) {
            this.unspsc = unspsc;
            return this;
        }

        public Builder gtin(String gtin) {
            this.gtin = gtin;
            return this;
        }

        public ProductRecord build() {
            return new ProductRecord(id, sourceKey, manufacturer, partNumber, title, description, unspsc, gtin);
        }
    }
}
