package com.wildfire.resolution.core.model;

import com.wildfire.resolution.error.ErrorCategory;
import com.wildfire.resolution.error.ServiceError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeoCoordinate Tests")
class GeoCoordinateTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should accept boundary values")
        void acceptsBoundaries() {
            assertDoesNotThrow(() -> GeoCoordinate.of(90.0, 180.0));
            assertDoesNotThrow(() -> GeoCoordinate.of(-90.0, -180.0));
            assertDoesNotThrow(() -> GeoCoordinate.of(0.0, 0.0));
        }

        @Test
        @DisplayName("Should reject latitude out of range")
        void rejectsLatitude() {
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(90.0001, 0.0));
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(-91.0, 0.0));
        }

        @Test
        @DisplayName("Should reject longitude out of range")
        void rejectsLongitude() {
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(0.0, 180.5));
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(0.0, -181.0));
        }

        @Test
        @DisplayName("Should reject non-finite values")
        void rejectsNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(Double.NaN, 0.0));
            assertThrows(IllegalArgumentException.class, () -> GeoCoordinate.of(0.0, Double.POSITIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("Validation without throwing")
    class ValidateTests {

        @Test
        @DisplayName("Should return empty for a valid coordinate")
        void validCoordinate() {
            assertTrue(GeoCoordinate.validate(55.9533, -3.1883).isEmpty());
            assertTrue(GeoCoordinate.isValid(55.9533, -3.1883));
        }

        @Test
        @DisplayName("Should return a VALIDATION error for an invalid coordinate")
        void invalidCoordinate() {
            Optional<ServiceError> error = GeoCoordinate.validate(95.0, 0.0);

            assertTrue(error.isPresent());
            assertEquals(ErrorCategory.VALIDATION, error.get().category());
            assertTrue(error.get().message().contains("Latitude"));
            assertFalse(GeoCoordinate.isValid(95.0, 0.0));
        }
    }
}
