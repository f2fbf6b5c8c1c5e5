package com.product.resolution.core.model;

import java.util.Objects;

/**
 * Stable manufacturer identity produced by alias resolution.
 * Many raw spellings may map to the same {@code name}.
 *
 * @param name       the canonical name (normalized, upper case); empty when the raw value was empty
 * @param normalized the normalized form of the raw input that was resolved
 * @param resolution how the identity was obtained
 */
public record CanonicalManufacturer(String name, String normalized, Resolution resolution) {

    public enum Resolution {
        /** Found in the configured alias table. */
        ALIAS_TABLE,
        /** Fuzzy match against a known canonical name or alias. */
        FUZZY,
        /** No mapping; the normalized raw value is its own identity. */
        SELF,
        /** The raw value was empty after normalization. */
        EMPTY
    }

    private static final CanonicalManufacturer EMPTY_IDENTITY =
            new CanonicalManufacturer("", "", Resolution.EMPTY);

    public CanonicalManufacturer {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(normalized, "normalized is required");
        Objects.requireNonNull(resolution, "resolution is required");
    }

    public static CanonicalManufacturer empty() {
        return EMPTY_IDENTITY;
    }

    public static CanonicalManufacturer self(String normalized) {
        return normalized.isEmpty() ? EMPTY_IDENTITY
                : new CanonicalManufacturer(normalized, normalized, Resolution.SELF);
    }

    public boolean isEmpty() {
        return name.isEmpty();
    }

    /**
     * Two identities are the same manufacturer when their canonical names are equal.
     */
    public boolean sameAs(CanonicalManufacturer other) {
        return other != null && !isEmpty() && name.equals(other.name);
    }
}
