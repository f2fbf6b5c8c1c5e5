package com.product.resolution.rules;

import java.util.Objects;

/**
 * Canonicalizes raw manufacturer names: diacritics are stripped, {@code &} becomes
 * {@code AND}, punctuation becomes a space and trailing corporate suffixes are dropped.
 * {@code "3M Company"} normalizes to {@code "3M"}.
 */
public class ManufacturerNormalizer {

    private final NormalizationEngine engine;

    public ManufacturerNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public ManufacturerNormalizer(NormalizationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
    }

    public String normalize(String raw) {
        return engine.normalize(raw, FieldType.MANUFACTURER);
    }
}
