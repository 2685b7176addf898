package com.wildfire.resolution.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ServiceError and Result Tests")
class ServiceErrorTest {

    @Nested
    @DisplayName("Status mapping")
    class StatusMappingTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "404, NOT_FOUND",
                "503, SERVICE_UNAVAILABLE",
                "400, GENERAL",
                "401, GENERAL",
                "500, GENERAL",
                "502, GENERAL"
        })
        @DisplayName("Should map HTTP status to category")
        void mapsStatus(int status, ErrorCategory expected) {
            assertEquals(expected, ErrorCategory.fromStatus(status));
        }

        @Test
        @DisplayName("fromStatus() should keep the status code")
        void keepsStatusCode() {
            ServiceError error = ServiceError.fromStatus(404, "missing");

            assertEquals(ErrorCategory.NOT_FOUND, error.category());
            assertEquals(404, error.status().getAsInt());
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should reject an empty message")
        void rejectsEmptyMessage() {
            assertThrows(IllegalArgumentException.class, () -> ServiceError.general(" "));
        }

        @Test
        @DisplayName("Should default kind to UNSPECIFIED")
        void defaultsKind() {
            ServiceError error = new ServiceError(ErrorCategory.NETWORK, "down", null, null);

            assertEquals(ErrorKind.UNSPECIFIED, error.kind());
            assertTrue(error.status().isEmpty());
        }

        @Test
        @DisplayName("validation() should carry the given kind")
        void validationKind() {
            ServiceError error = ServiceError.validation("no location", ErrorKind.PERMISSION_DENIED);

            assertEquals(ErrorCategory.VALIDATION, error.category());
            assertEquals(ErrorKind.PERMISSION_DENIED, error.kind());
        }
    }

    @Nested
    @DisplayName("Result")
    class ResultTests {

        @Test
        @DisplayName("Success should expose its value and map it")
        void success() {
            Result<Integer> result = Result.success(21);

            assertTrue(result.isSuccess());
            assertEquals(42, result.map(v -> v * 2).getValue());
            assertThrows(IllegalStateException.class, result::getError);
        }

        @Test
        @DisplayName("Failure should propagate through map and fall back in orElse")
        void failure() {
            Result<Integer> result = Result.failure(ServiceError.network("offline"));

            assertTrue(result.isFailure());
            assertEquals(ErrorCategory.NETWORK, result.map(v -> v * 2).getError().category());
            assertEquals(7, result.orElse(7));
            assertThrows(IllegalStateException.class, result::getValue);
        }
    }
}
