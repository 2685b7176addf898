package com.wildfire.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskLevel Tests")
class RiskLevelTest {

    @ParameterizedTest(name = "FWI {0} -> {1}")
    @CsvSource({
            "0.0, VERY_LOW",
            "4.99, VERY_LOW",
            "5.0, LOW",
            "11.9, LOW",
            "12.0, MODERATE",
            "20.99, MODERATE",
            "21.0, HIGH",
            "37.9, HIGH",
            "38.0, VERY_HIGH",
            "49.9, VERY_HIGH",
            "50.0, EXTREME",
            "120.0, EXTREME"
    })
    @DisplayName("Should map index values to tiers at band edges")
    void mapsBands(double index, RiskLevel expected) {
        assertEquals(expected, RiskLevel.fromIndex(index));
    }

    @Test
    @DisplayName("Should reject negative and non-finite index values")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> RiskLevel.fromIndex(-0.1));
        assertThrows(IllegalArgumentException.class, () -> RiskLevel.fromIndex(Double.NaN));
    }

    @Test
    @DisplayName("Levels should be ordered lowest first")
    void ordering() {
        assertTrue(RiskLevel.VERY_LOW.compareTo(RiskLevel.EXTREME) < 0);
        assertEquals(6, RiskLevel.values().length);
    }
}
