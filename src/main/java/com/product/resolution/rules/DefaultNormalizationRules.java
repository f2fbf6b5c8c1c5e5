package com.product.resolution.rules;

import java.util.List;

/**
 * Built-in normalization rules for part numbers and manufacturer names.
 */
public final class DefaultNormalizationRules {

    private static final String CORPORATE_SUFFIXES = "INC|INCORPORATED|LLC|LTD|LIMITED|CORP|CORPORATION|CO|COMPANY"
            + "|COMPANIES|GMBH|AG|PLC|SA|SAS|SRL|SPA|BV|NV|KG|LP|LLP|PTE|PTY|AB|OY|KK";

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getPartNumberRules());
        engine.addRules(getManufacturerRules());
        return engine;
    }

    /**
     * Rules applied to every field.
     */
    public static List<NormalizationRule> getCommonRules() {
        // Combining marks left over from NFD decomposition
        return List.of(NormalizationRule.anyField("common-diacritics", 1, "\\p{M}+", ""));
    }

    public static List<NormalizationRule> getPartNumberRules() {
        return List.of(
                // Joining separators: 14NV-4123 and 14NV4123 are the same part
                NormalizationRule.forFields("part-number-joining-separators", 10, "[-_/.]", "",
                        FieldType.PART_NUMBER),
                NormalizationRule.forFields("part-number-punctuation", 20, "[^A-Za-z0-9\\s]", " ",
                        FieldType.PART_NUMBER));
    }

    public static List<NormalizationRule> getManufacturerRules() {
        return List.of(
                NormalizationRule.forFields("manufacturer-ampersand", 10, "&", " AND ", FieldType.MANUFACTURER),
                NormalizationRule.forFields("manufacturer-punctuation", 20, "[^A-Za-z0-9\\s]", " ",
                        FieldType.MANUFACTURER),
                NormalizationRule.forFields("manufacturer-collapse-spaces", 30, "\\s+", " ", FieldType.MANUFACTURER),
                // Trailing corporate suffixes, repeated ("Foo Co Ltd"); the first token always survives
                NormalizationRule.forFields("manufacturer-corporate-suffix", 40,
                        "(?:\\s+(?:" + CORPORATE_SUFFIXES + "))+\\s*$", "", FieldType.MANUFACTURER),
                NormalizationRule.forFields("manufacturer-leading-the", 50, "^\\s*THE\\s+(?=\\S)", "",
                        FieldType.MANUFACTURER));
    }
}
