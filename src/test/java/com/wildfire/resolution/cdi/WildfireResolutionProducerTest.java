package com.wildfire.resolution.cdi;

import com.wildfire.resolution.api.AsyncWildfireResolver;
import com.wildfire.resolution.api.WildfireResolver;
import com.wildfire.resolution.cache.GeocacheConfig;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.fetch.ResilientFetcher;
import com.wildfire.resolution.fetch.RetryConfig;
import com.wildfire.resolution.location.LocationOptions;
import com.wildfire.resolution.metrics.MicrometerMetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.orchestrator.OrchestratorOptions;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("WildfireResolutionProducer Tests")
class WildfireResolutionProducerTest {

    private WildfireResolutionProducer producer;

    @BeforeEach
    void setUp() {
        producer = new WildfireResolutionProducer();
        producer.primaryName = "effis";
        producer.primaryBaseUrl = "http://localhost:1/fwi";
        producer.secondaryName = "sepa";
        producer.secondaryBaseUrl = Optional.empty();
        producer.maxRetries = 2;
        producer.baseDelayMillis = 500;
        producer.minDelayMillis = 50;
        producer.maxDelayMillis = 5000;
        producer.jitterFactor = 0.1;
        producer.deadlineMillis = 6000;
        producer.primaryBudgetMillis = 2500;
        producer.secondaryBudgetMillis = 1500;
        producer.cacheBudgetMillis = 800;
        producer.syntheticStrategy = "fixed";
        producer.cacheCapacity = 50;
        producer.cacheTtlMinutes = 120;
        producer.cachePrecision = 6;
        producer.locationBudgetMillis = 3000;
        producer.liveFixBudgetMillis = 1800;
        producer.defaultLatitude = 57.1497;
        producer.defaultLongitude = -2.0943;
        producer.asyncTimeoutMillis = 4000;
    }

    @Nested
    @DisplayName("Configuration mapping")
    class ConfigurationMapping {

        @Test
        @DisplayName("Should map retry properties")
        void retry() {
            RetryConfig config = producer.retryConfig();

            assertEquals(2, config.maxRetries());
            assertEquals(Duration.ofMillis(500), config.baseDelay());
            assertEquals(Duration.ofMillis(50), config.minDelay());
            assertEquals(Duration.ofMillis(5000), config.maxDelay());
            assertEquals(0.1, config.jitterFactor(), 1e-9);
        }

        @Test
        @DisplayName("Should map cache properties")
        void cache() {
            GeocacheConfig config = producer.geocacheConfig();

            assertEquals(50, config.capacity());
            assertEquals(Duration.ofHours(2), config.ttl());
            assertEquals(6, config.precision());
        }

        @Test
        @DisplayName("Should map orchestrator budgets")
        void orchestrator() {
            OrchestratorOptions options = producer.orchestratorOptions();

            assertEquals(Duration.ofMillis(6000), options.getDeadline());
            assertEquals(Duration.ofMillis(2500), options.getPrimaryBudget());
            assertEquals(Duration.ofMillis(1500), options.getSecondaryBudget());
            assertEquals(Duration.ofMillis(800), options.getCacheBudget());
            assertTrue(options.isWriteThrough());
        }

        @Test
        @DisplayName("Should map location budgets and default")
        void location() {
            LocationOptions options = producer.locationOptions();

            assertEquals(Duration.ofMillis(3000), options.getTotalBudget());
            assertEquals(Duration.ofMillis(1800), options.getLiveFixBudget());
            assertEquals(new GeoCoordinate(57.1497, -2.0943), options.getDefaultLocation());
        }
    }

    @Nested
    @DisplayName("Synthetic strategy")
    class SyntheticStrategy {

        private final GeoCoordinate edinburgh = new GeoCoordinate(55.9533, -3.1883);

        @Test
        @DisplayName("Should use fixed MODERATE for 'fixed'")
        void fixed() {
            assertEquals(RiskLevel.MODERATE, producer.syntheticGenerator().generate(edinburgh).getLevel());
        }

        @Test
        @DisplayName("Should fall back to fixed MODERATE for unknown strategies")
        void unknown() {
            producer.syntheticStrategy = "astrology";

            assertEquals(RiskLevel.MODERATE, producer.syntheticGenerator().generate(edinburgh).getLevel());
        }

        @Test
        @DisplayName("Should use geohash generator for 'geohash'")
        void geohash() {
            producer.syntheticStrategy = "GEOHASH";

            assertEquals("GeohashRiskGenerator", producer.syntheticGenerator().getClass().getSimpleName());
        }
    }

    @Nested
    @DisplayName("Metrics wiring")
    class MetricsWiring {

        @Test
        @DisplayName("Should use no-op metrics without a registry")
        void noRegistry() {
            assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        }

        @Test
        @DisplayName("Should use no-op metrics when the registry is unresolvable")
        @SuppressWarnings("unchecked")
        void unresolvable() {
            Instance<MeterRegistry> instance = mock(Instance.class);
            when(instance.isResolvable()).thenReturn(false);
            producer.meterRegistry = instance;

            assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        }

        @Test
        @DisplayName("Should use Micrometer when a registry is available")
        @SuppressWarnings("unchecked")
        void micrometer() {
            Instance<MeterRegistry> instance = mock(Instance.class);
            when(instance.isResolvable()).thenReturn(true);
            when(instance.get()).thenReturn(new SimpleMeterRegistry());
            producer.meterRegistry = instance;

            assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
        }
    }

    @Test
    @DisplayName("Should produce a working resolver graph")
    void producesResolver() {
        ResilientFetcher fetcher = producer.resilientFetcher();
        WildfireResolver resolver = producer.wildfireResolver(fetcher);
        AsyncWildfireResolver async = producer.asyncWildfireResolver(resolver);
        try {
            assertEquals(2, resolver.getHealthCheckRegistry().size());
            assertEquals(new GeoCoordinate(57.1497, -2.0943),
                    resolver.resolveLocation(true).getValue().coordinates());
        } finally {
            producer.closeAsyncResolver(async);
            producer.closeResolver(resolver);
            producer.closeFetcher(fetcher);
        }
    }
}
