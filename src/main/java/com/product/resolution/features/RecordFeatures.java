package com.product.resolution.features;

import com.product.resolution.core.model.CanonicalManufacturer;
import com.product.resolution.core.model.ProductRecord;

import java.util.List;
import java.util.Objects;

/**
 * Comparable signals derived once per record and shared by blocking, scoring and clustering.
 *
 * @param record               the source record
 * @param normalizedPartNumber normalized part number, {@code ""} when absent
 * @param variants             part-number variants, the normalized part number first
 * @param manufacturer         canonical manufacturer identity
 * @param unspsc               normalized UNSPSC code, {@code ""} when absent
 * @param gtin                 normalized GTIN, {@code ""} when absent
 */
public record RecordFeatures(
        ProductRecord record,
        String normalizedPartNumber,
        List<String> variants,
        CanonicalManufacturer manufacturer,
        String unspsc,
        String gtin
) {
    public RecordFeatures {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(manufacturer, "manufacturer is required");
        variants = List.copyOf(variants);
    }

    public String id() {
        return record.id();
    }

    public boolean hasPartNumber() {
        return !normalizedPartNumber.isEmpty();
    }

    public boolean hasManufacturer() {
        return !manufacturer.isEmpty();
    }

    public boolean hasUnspsc() {
        return !unspsc.isEmpty();
    }

    public boolean hasGtin() {
        return !gtin.isEmpty();
    }

    public boolean hasText() {
        return !record.title().isBlank() || !record.description().isBlank();
    }
}
