package com.product.resolution.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ScoringConfigTest {

    @Test
    @DisplayName("Default weights sum to 1.0")
    void testDefaultWeights() {
        ScoringWeights weights = ScoringWeights.defaultWeights();

        assertEquals(0.30, weights.partNumber());
        assertEquals(0.25, weights.gtin());
        assertEquals(1.0, weights.sum(), 1e-9);
    }

    @Test
    @DisplayName("Preset weights are valid")
    void testPresets() {
        assertTrue(ScoringWeights.identifierFocused().sum() <= 1.0 + 1e-9);
        assertTrue(ScoringWeights.textFocused().text() > ScoringWeights.defaultWeights().text());
    }

    @Test
    @DisplayName("Weights must be non-negative and sum to at most 1.0")
    void testWeightValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(-0.1, 0.2, 0.2, 0.2, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, 0.5, 0.5, 0, 0));
        assertDoesNotThrow(() -> new ScoringWeights(0.2, 0.2, 0.2, 0.1, 0.1));
    }

    @Test
    @DisplayName("Defaults match the documented constants")
    void testDefaults() {
        ScoringConfig config = ScoringConfig.defaults();

        assertEquals(0.15, config.getSynergyBonus());
        assertEquals(3, config.getSynergyMinComponents());
        assertEquals(0.85, config.getStrongThreshold());
        assertEquals(0.75, config.getPartialCeiling());
        assertTrue(config.isFilterShortVariants());
    }

    @ParameterizedTest
    @DisplayName("Exact matches are graded by matched length")
    @CsvSource({
            "1.0,1.0",
            "0.8,1.0",
            "0.7,0.75",
            "0.5,0.5",
            "0.39,0.25",
            "0.0,0.25"
    })
    void testExactMatchGrades(double ratio, double expected) {
        assertEquals(expected, ScoringConfig.defaults().exactMatchScore(ratio));
    }

    @Test
    @DisplayName("Custom match length grades replace the defaults")
    void testCustomGrades() {
        ScoringConfig config = ScoringConfig.builder()
                .matchLengthGrades(new double[]{0.5}, new double[]{1.0, 0.4})
                .build();

        assertEquals(1.0, config.exactMatchScore(0.6));
        assertEquals(0.4, config.exactMatchScore(0.49));
        assertThrows(IllegalArgumentException.class,
                () -> ScoringConfig.builder().matchLengthGrades(new double[]{0.5}, new double[]{1.0}));
        assertThrows(IllegalArgumentException.class,
                () -> ScoringConfig.builder().matchLengthGrades(new double[]{0.4, 0.6}, new double[]{1.0, 0.5, 0.2}));
        assertThrows(IllegalArgumentException.class,
                () -> ScoringConfig.builder().matchLengthGrades(new double[]{0.5}, new double[]{0.4, 1.0}));
    }

    @Test
    @DisplayName("Builder rejects out-of-range values")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.builder().synergyBonus(1.5));
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.builder().synergyMinComponents(0));
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.builder().partNumberSubWeights(0.7, 0.7));
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.builder().textSubWeights(0.5, 0.5, 0.5));
        assertThrows(NullPointerException.class, () -> ScoringConfig.builder().weights(null));
    }
}
