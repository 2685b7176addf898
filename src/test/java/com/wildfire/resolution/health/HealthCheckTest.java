package com.wildfire.resolution.health;

import com.wildfire.resolution.cache.CacheStore;
import com.wildfire.resolution.cache.CacheStoreException;
import com.wildfire.resolution.cache.CaffeineCacheStore;
import com.wildfire.resolution.cache.Geocache;
import com.wildfire.resolution.cache.GeocacheConfig;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.testutil.StubRiskSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should create the matching status")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
        }

        @Test
        @DisplayName("withDetail() should add details and keep them immutable")
        void withDetail() {
            HealthStatus status = HealthStatus.up()
                    .withDetail("entries", 4)
                    .withDetail("source", "effis");

            assertEquals(4, status.details().get("entries"));
            assertEquals("effis", status.details().get("source"));
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("x", "y"));
        }

        @Test
        @DisplayName("Statuses should order UP < DEGRADED < DOWN")
        void ordering() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.Status.DEGRADED));
            assertTrue(HealthStatus.degraded("x").isWorseThan(HealthStatus.Status.UP));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.Status.UP));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private static HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("An empty registry should be UP")
        void empty() {
            HealthStatus status = new HealthCheckRegistry().checkAll();

            assertTrue(status.isUp());
            assertEquals("No health checks registered", status.message());
        }

        @Test
        @DisplayName("The worst status should win")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("slow")));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDegraded());
            assertEquals("b: slow", status.message());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("Per-check results should appear in details")
        @SuppressWarnings("unchecked")
        void perCheckDetails() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up().withDetail("k", "v")));

            Map<String, Object> result = (Map<String, Object>) registry.checkAll().details().get("a");

            assertEquals("UP", result.get("status"));
            assertEquals("OK", result.get("message"));
            assertEquals(Map.of("k", "v"), result.get("details"));
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("ok", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertTrue(status.message().startsWith("broken"));
        }
    }

    @Nested
    @DisplayName("Component checks")
    class ComponentTests {

        @Test
        @DisplayName("Geocache check should be UP with size details")
        void geocacheUp() {
            Geocache geocache = new Geocache(GeocacheConfig.defaults(), new CaffeineCacheStore(10),
                    new NoOpMetricsService(), Clock.systemUTC());

            HealthStatus status = new GeocacheHealthCheck(geocache).check();

            assertTrue(status.isUp());
            assertEquals(0L, status.details().get("entries"));
            assertEquals(100, status.details().get("capacity"));
            assertEquals("geocache", new GeocacheHealthCheck(geocache).getName());
        }

        @Test
        @DisplayName("Geocache check should be DEGRADED when the store is unreachable")
        void geocacheDegraded() throws Exception {
            CacheStore store = mock(CacheStore.class);
            when(store.keys()).thenThrow(new CacheStoreException("offline"));
            Geocache geocache = new Geocache(GeocacheConfig.defaults(), store, new NoOpMetricsService(),
                    Clock.systemUTC());

            assertTrue(new GeocacheHealthCheck(geocache).check().isDegraded());
        }

        @Test
        @DisplayName("Risk source check should follow source availability")
        void riskSource() {
            StubRiskSource source = StubRiskSource.succeeding("effis", 1.0, Instant.EPOCH);
            RiskSourceHealthCheck check = new RiskSourceHealthCheck(source, "primary");

            assertEquals("riskSource.primary", check.getName());
            assertTrue(check.check().isUp());
            assertEquals("effis", check.check().details().get("source"));

            source.withAvailability(false);
            HealthStatus status = check.check();
            assertTrue(status.isDegraded());
            assertEquals("effis unavailable", status.message());
        }

        @Test
        @DisplayName("Risk source check should require a source")
        void requiresSource() {
            assertThrows(NullPointerException.class, () -> new RiskSourceHealthCheck(null, "primary"));
        }
    }
}
