package com.product.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private PartNumberNormalizer partNumbers;
    private ManufacturerNormalizer manufacturers;

    @BeforeEach
    void setUp() {
        partNumbers = new PartNumberNormalizer();
        manufacturers = new ManufacturerNormalizer();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", partNumbers.normalize(null));
        assertEquals("", partNumbers.normalize("   "));
        assertEquals("", manufacturers.normalize(null));
        assertEquals("", manufacturers.normalize(""));
    }

    @ParameterizedTest
    @DisplayName("Should normalize part numbers")
    @CsvSource(delimiter = '|', value = {
            "AGM14NV-412341 4111 ea|AGM14NV412341 4111 EA",
            "14NV-4123414111|14NV4123414111",
            "abc/def.12_3|ABCDEF123",
            "AB#12|AB 12",
            "  ab   12  |AB 12"
    })
    void testPartNumberNormalization(String input, String expected) {
        assertEquals(expected, partNumbers.normalize(input));
    }

    @ParameterizedTest
    @DisplayName("Should normalize manufacturer names")
    @CsvSource(delimiter = '|', value = {
            "3M Company|3M",
            "The Procter & Gamble Co.|PROCTER AND GAMBLE",
            "Société Générale|SOCIETE GENERALE",
            "Acme, Inc.|ACME",
            "Siemens GmbH|SIEMENS",
            "Foo Co Ltd|FOO",
            "Eaton|EATON",
            "The|THE"
    })
    void testManufacturerNormalization(String input, String expected) {
        assertEquals(expected, manufacturers.normalize(input));
    }

    @Test
    @DisplayName("Normalization is idempotent")
    void testIdempotent() {
        String once = manufacturers.normalize("The Procter & Gamble Co.");
        assertEquals(once, manufacturers.normalize(once));
        String part = partNumbers.normalize("AGM14NV-412341 4111 ea");
        assertEquals(part, partNumbers.normalize(part));
    }

    @Test
    @DisplayName("Rules run in priority order")
    void testRulePriority() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRule(NormalizationRule.anyField("second", 20, "B", "C"));
        engine.addRule(NormalizationRule.anyField("first", 10, "A", "B"));

        assertEquals("CC", engine.normalize("ab", FieldType.PART_NUMBER));
        assertEquals(List.of("first", "second"), engine.getRules().stream().map(NormalizationRule::name).toList());
    }

    @Test
    @DisplayName("Field-scoped rules skip other fields")
    void testFieldScoping() {
        NormalizationEngine engine = new NormalizationEngine(List.of(
                NormalizationRule.forFields("strip-dash", 10, "-", "", FieldType.PART_NUMBER)));

        assertEquals("AB12", engine.normalize("ab-12", FieldType.PART_NUMBER));
        assertEquals("AB-12", engine.normalize("ab-12", FieldType.MANUFACTURER));
    }

    @Test
    @DisplayName("Rules expose their definition and are identified by name")
    void testRuleDefinition() {
        NormalizationRule rule = NormalizationRule.forFields("strip-dash", 10, "-", "", FieldType.PART_NUMBER);
        NormalizationRule sameName = NormalizationRule.anyField("strip-dash", 99, "_", "");

        assertEquals("-", rule.pattern().pattern());
        assertEquals("", rule.replacement());
        assertEquals(Set.of(FieldType.PART_NUMBER), rule.fields());
        assertTrue(sameName.fields().isEmpty());
        assertTrue(sameName.appliesTo(FieldType.MANUFACTURER));
        assertTrue(rule.toString().startsWith("strip-dash(10"));
        assertEquals(rule, sameName);
        assertEquals(rule.hashCode(), sameName.hashCode());
    }

    @Test
    @DisplayName("Rules can be removed by name")
    void testRemoveRule() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        assertTrue(engine.removeRule("manufacturer-leading-the"));
        assertFalse(engine.removeRule("manufacturer-leading-the"));
        assertEquals("THE BOEING", engine.normalize("The Boeing Company", FieldType.MANUFACTURER));
    }
}
