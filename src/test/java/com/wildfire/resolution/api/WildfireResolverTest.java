package com.wildfire.resolution.api;

import com.wildfire.resolution.cache.CaffeineCacheStore;
import com.wildfire.resolution.cache.Geocache;
import com.wildfire.resolution.cache.GeocacheConfig;
import com.wildfire.resolution.core.model.Freshness;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolutionStage;
import com.wildfire.resolution.core.model.ResolvedLocation;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.error.ErrorCategory;
import com.wildfire.resolution.error.ErrorKind;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.error.ServiceError;
import com.wildfire.resolution.health.HealthCheck;
import com.wildfire.resolution.health.HealthStatus;
import com.wildfire.resolution.location.InMemoryPreferenceStore;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.orchestrator.RecordingTelemetry;
import com.wildfire.resolution.testutil.MutableClock;
import com.wildfire.resolution.testutil.StubRiskSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WildfireResolver Tests")
class WildfireResolverTest {

    private static final GeoCoordinate EDINBURGH = GeoCoordinate.of(55.9533, -3.1883);
    private static final Instant OBSERVED = Instant.parse("2024-07-01T11:00:00Z");

    private MutableClock clock;
    private StubRiskSource primary;
    private StubRiskSource secondary;
    private RecordingTelemetry telemetry;
    private WildfireResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-07-01T12:00:00Z");
        primary = StubRiskSource.succeeding("effis", 14.0, OBSERVED);
        secondary = StubRiskSource.failing("sepa", ServiceError.fromStatus(503, "sepa down"));
        telemetry = new RecordingTelemetry();
        resolver = WildfireResolver.builder()
                .primarySource(primary)
                .secondarySource(secondary)
                .preferenceStore(new InMemoryPreferenceStore())
                .telemetry(telemetry)
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @Nested
    @DisplayName("Building")
    class BuilderTests {

        @Test
        @DisplayName("Should require a primary source")
        void requiresPrimary() {
            assertThrows(IllegalStateException.class, () -> WildfireResolver.builder().build());
        }
    }

    @Nested
    @DisplayName("Risk")
    class RiskTests {

        @Test
        @DisplayName("Should resolve from the primary source and cache the result")
        void primaryAndCache() {
            RiskObservation risk = resolver.resolveRisk(EDINBURGH);

            assertEquals(RiskSource.PRIMARY, risk.getSource());
            assertEquals(RiskLevel.MODERATE, risk.getLevel());
            assertEquals(1, resolver.getCacheMetadata().totalEntries());
            assertEquals(List.of(ResolutionStage.PRIMARY), telemetry.attemptedStages());
        }

        @Test
        @DisplayName("A later primary outage should be answered from a shared cache")
        void cacheAfterOutage() {
            Geocache shared = new Geocache(GeocacheConfig.defaults(), new CaffeineCacheStore(200),
                    new NoOpMetricsService(), clock);
            WildfireResolver healthy = WildfireResolver.builder()
                    .primarySource(primary)
                    .geocache(shared)
                    .clock(clock)
                    .build();
            WildfireResolver degraded = WildfireResolver.builder()
                    .primarySource(StubRiskSource.failing("effis", ServiceError.network("offline")))
                    .geocache(shared)
                    .clock(clock)
                    .build();
            try {
                healthy.resolveRisk(EDINBURGH);
                clock.advance(Duration.ofHours(1));

                RiskObservation risk = degraded.resolveRisk(EDINBURGH);

                assertEquals(RiskSource.PRIMARY, risk.getSource());
                assertEquals(Freshness.CACHED, risk.getFreshness());
                assertEquals(OBSERVED, risk.getObservedAt());
            } finally {
                healthy.close();
                degraded.close();
            }
        }

        @Test
        @DisplayName("Raw coordinates should be validated first")
        void rawValidation() {
            Result<RiskObservation> invalid = resolver.resolveRisk(0.0, 200.0);
            Result<RiskObservation> valid = resolver.resolveRisk(55.9533, -3.1883);

            assertEquals(ErrorCategory.VALIDATION, invalid.getError().category());
            assertTrue(valid.isSuccess());
            assertEquals(1, primary.calls());
        }

        @Test
        @DisplayName("Should honour an explicit deadline")
        void explicitDeadline() {
            RiskObservation risk = resolver.resolveRisk(EDINBURGH, Duration.ofSeconds(5));

            assertEquals(Freshness.LIVE, risk.getFreshness());
        }
    }

    @Nested
    @DisplayName("Location")
    class LocationTests {

        @Test
        @DisplayName("Without a sensor, defaults allowed should return the persisted default")
        void defaultLocation() {
            Result<ResolvedLocation> result = resolver.resolveLocation(true);

            assertEquals(LocationSource.PERSISTED_DEFAULT, result.getValue().source());
        }

        @Test
        @DisplayName("Without a sensor, defaults disallowed should fail")
        void noDefault() {
            Result<ResolvedLocation> result = resolver.resolveLocation(false);

            assertEquals(ErrorKind.PERMISSION_DENIED, result.getError().kind());
        }

        @Test
        @DisplayName("A saved manual location should be returned until cleared")
        void manualLocation() {
            assertTrue(resolver.saveManual(GeoCoordinate.of(56.4620, -2.9707), "Dundee").isSuccess());

            ResolvedLocation location = resolver.resolveLocation(false).getValue();
            assertEquals(LocationSource.CACHED_MANUAL, location.source());
            assertEquals("Dundee", location.placeName());

            resolver.clearManual();
            assertTrue(resolver.resolveLocation(false).isFailure());
        }
    }

    @Nested
    @DisplayName("Cache maintenance")
    class CacheTests {

        @Test
        @DisplayName("cleanupCache() should remove expired entries")
        void cleanup() {
            resolver.resolveRisk(EDINBURGH);
            clock.advance(Duration.ofHours(7));

            assertEquals(1, resolver.cleanupCache());
            assertEquals(0, resolver.getCacheMetadata().totalEntries());
            assertTrue(resolver.getCacheMetadata().lastCleanupTime().isPresent());
        }

        @Test
        @DisplayName("clearCache() should remove every entry")
        void clear() {
            resolver.resolveRisk(EDINBURGH);
            resolver.resolveRisk(GeoCoordinate.of(51.5074, -0.1278));

            resolver.clearCache();

            assertEquals(0, resolver.getCacheMetadata().totalEntries());
        }
    }

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("Should register cache and source checks")
        void registeredChecks() {
            HealthStatus status = resolver.checkHealth();

            assertEquals(3, resolver.getHealthCheckRegistry().size());
            assertTrue(status.details().containsKey("geocache"));
            assertTrue(status.details().containsKey("riskSource.primary"));
            assertTrue(status.details().containsKey("riskSource.secondary"));
            assertTrue(status.isUp());
        }

        @Test
        @DisplayName("An unavailable source should degrade overall health")
        void degradedSource() {
            primary.withAvailability(false);

            HealthStatus status = resolver.checkHealth();

            assertTrue(status.isDegraded());
            assertEquals("riskSource.primary: effis unavailable", status.message());
        }

        @Test
        @DisplayName("Custom checks should be included")
        void customCheck() {
            WildfireResolver withCheck = WildfireResolver.builder()
                    .primarySource(primary)
                    .healthCheck(new HealthCheck() {
                        @Override
                        public String getName() {
                            return "gps";
                        }

                        @Override
                        public HealthStatus check() {
                            return HealthStatus.down("no fix");
                        }
                    })
                    .build();
            try {
                assertTrue(withCheck.checkHealth().isDown());
            } finally {
                withCheck.close();
            }
        }
    }
}
