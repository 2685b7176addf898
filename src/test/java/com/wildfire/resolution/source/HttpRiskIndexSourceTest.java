package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.error.ErrorCategory;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.fetch.ResilientFetcher;
import com.wildfire.resolution.fetch.RetryConfig;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("HttpRiskIndexSource Tests")
class HttpRiskIndexSourceTest {

    private static final GeoCoordinate EDINBURGH = GeoCoordinate.of(55.9533, -3.1883);

    private HttpClient httpClient;
    private HttpResponse<Object> response;
    private ResilientFetcher fetcher;
    private HttpRiskIndexSource source;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        fetcher = new ResilientFetcher(RetryConfig.defaults(), new NoOpMetricsService(), d -> { }, () -> 0.5);
        source = HttpRiskIndexSource.builder()
                .name("effis")
                .baseUrl("https://fwi.example.org/api/fwi")
                .maxRetries(2)
                .fetcher(fetcher)
                .httpClient(httpClient)
                .build();
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    @Nested
    @DisplayName("Request building")
    class RequestTests {

        @Test
        @DisplayName("Should append lat and lon with six decimals")
        void requestUri() {
            assertEquals(URI.create("https://fwi.example.org/api/fwi?lat=55.953300&lon=-3.188300"),
                    source.requestUri(EDINBURGH));
        }

        @Test
        @DisplayName("Should extend an existing query string")
        void existingQuery() {
            HttpRiskIndexSource keyed = HttpRiskIndexSource.builder()
                    .name("sepa")
                    .baseUrl("https://regional.example.org/fwi?key=abc")
                    .fetcher(fetcher)
                    .httpClient(httpClient)
                    .build();

            assertEquals("https://regional.example.org/fwi?key=abc&lat=55.953300&lon=-3.188300",
                    keyed.requestUri(EDINBURGH).toString());
        }

        @Test
        @DisplayName("Should require name, base URL and fetcher")
        void requiredFields() {
            assertThrows(NullPointerException.class, () -> HttpRiskIndexSource.builder()
                    .baseUrl("https://x").fetcher(fetcher).build());
            assertThrows(NullPointerException.class, () -> HttpRiskIndexSource.builder()
                    .name("x").fetcher(fetcher).build());
            assertThrows(NullPointerException.class, () -> HttpRiskIndexSource.builder()
                    .name("x").baseUrl("https://x").build());
        }
    }

    @Nested
    @DisplayName("Querying")
    class QueryTests {

        @Test
        @DisplayName("Should parse a 200 response into a reading")
        void success() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"fwi\": 22.5, \"observedAt\": \"2024-07-01T12:00:00Z\"}");
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            Result<RawIndexReading> result = source.query(EDINBURGH, Duration.ofSeconds(1));

            assertTrue(result.isSuccess());
            assertEquals(22.5, result.getValue().indexValue());
            assertEquals(RiskLevel.HIGH, result.getValue().resolvedLevel());

            ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(request.capture(), any());
            assertEquals("GET", request.getValue().method());
            assertEquals(source.requestUri(EDINBURGH), request.getValue().uri());
        }

        @Test
        @DisplayName("Should map 404 to NOT_FOUND without retrying")
        void notFound() throws Exception {
            when(response.statusCode()).thenReturn(404);
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            Result<RawIndexReading> result = source.query(EDINBURGH, Duration.ofSeconds(1));

            assertEquals(ErrorCategory.NOT_FOUND, result.getError().category());
            verify(httpClient, times(1)).send(any(HttpRequest.class), any());
        }

        @Test
        @DisplayName("Should retry 503 up to the configured retry count")
        void serviceUnavailable() throws Exception {
            when(response.statusCode()).thenReturn(503);
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            Result<RawIndexReading> result = source.query(EDINBURGH, Duration.ofSeconds(1));

            assertEquals(ErrorCategory.SERVICE_UNAVAILABLE, result.getError().category());
            assertEquals(503, result.getError().status().getAsInt());
            verify(httpClient, times(3)).send(any(HttpRequest.class), any());
        }

        @Test
        @DisplayName("Should report a connection failure as NETWORK")
        void connectionFailure() throws Exception {
            doThrow(new ConnectException("refused")).when(httpClient).send(any(HttpRequest.class), any());

            Result<RawIndexReading> result = source.query(EDINBURGH, Duration.ofSeconds(1));

            assertEquals(ErrorCategory.NETWORK, result.getError().category());
        }

        @Test
        @DisplayName("Should report an unreadable body as PARSE")
        void unreadableBody() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("<html>maintenance</html>");
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            Result<RawIndexReading> result = source.query(EDINBURGH, Duration.ofSeconds(1));

            assertEquals(ErrorCategory.PARSE, result.getError().category());
            verify(httpClient, times(1)).send(any(HttpRequest.class), any());
        }
    }

    @Nested
    @DisplayName("Availability")
    class AvailabilityTests {

        @Test
        @DisplayName("Should be available when the base URL answers below 500")
        void available() throws Exception {
            when(response.statusCode()).thenReturn(404);
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            assertTrue(source.isAvailable());
        }

        @Test
        @DisplayName("Should be unavailable on 5xx or transport failure")
        void unavailable() throws Exception {
            when(response.statusCode()).thenReturn(502);
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
            assertFalse(source.isAvailable());

            doThrow(new IOException("down")).when(httpClient).send(any(HttpRequest.class), any());
            assertFalse(source.isAvailable());
        }
    }
}
