package com.product.resolution.core.model;

/**
 * Manufacturer component: 1.0 for the same canonical identity, otherwise the
 * string similarity of the two canonical names.
 */
public record ManufacturerComparison(
        String rawA,
        String rawB,
        CanonicalManufacturer canonicalA,
        CanonicalManufacturer canonicalB,
        boolean exactMatch,
        boolean applicable,
        double score,
        double weight
) implements ComponentScore {

    @Override
    public String name() {
        return "manufacturer";
    }
}
