package com.wildfire.resolution.geo;

import com.wildfire.resolution.core.model.GeoCoordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoordinateRedactor Tests")
class CoordinateRedactorTest {

    @Test
    @DisplayName("Should round to two decimal places")
    void roundsToTwoPlaces() {
        assertEquals("55.95,-3.19", CoordinateRedactor.redact(55.9533, -3.1883));
        assertEquals("55.95,-3.19", CoordinateRedactor.redact(GeoCoordinate.of(55.9533, -3.1883)));
    }

    @Test
    @DisplayName("Should round half up")
    void roundsHalfUp() {
        assertEquals("55.96,-3.18", CoordinateRedactor.redact(55.955, -3.175));
    }

    @Test
    @DisplayName("Should keep two decimals for whole degrees")
    void keepsScale() {
        assertEquals("56.00,-4.00", CoordinateRedactor.redact(56.0, -4.0));
    }

    @Test
    @DisplayName("Should never expose invalid or null coordinates")
    void invalidInput() {
        assertEquals(CoordinateRedactor.INVALID, CoordinateRedactor.redact(123.456789, 0.0));
        assertEquals(CoordinateRedactor.INVALID, CoordinateRedactor.redact(Double.NaN, 0.0));
        assertEquals(CoordinateRedactor.INVALID, CoordinateRedactor.redact(null));
    }
}
