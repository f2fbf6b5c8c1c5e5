package com.product.resolution.rules;

import java.util.Objects;

/**
 * Canonicalizes raw part numbers: joining separators are removed, other punctuation
 * becomes a space, and the result is upper-cased with collapsed whitespace.
 * {@code "AGM14NV-412341 4111 ea"} normalizes to {@code "AGM14NV412341 4111 EA"}.
 */
public class PartNumberNormalizer {

    private final NormalizationEngine engine;

    public PartNumberNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public PartNumberNormalizer(NormalizationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
    }

    public String normalize(String raw) {
        return engine.normalize(raw, FieldType.PART_NUMBER);
    }
}
