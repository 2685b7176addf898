package com.wildfire.resolution.api;

import com.wildfire.resolution.cache.CacheMetadata;
import com.wildfire.resolution.cache.CacheStats;
import com.wildfire.resolution.cache.CacheStore;
import com.wildfire.resolution.cache.CaffeineCacheStore;
import com.wildfire.resolution.cache.Geocache;
import com.wildfire.resolution.cache.GeocacheConfig;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.ResolvedLocation;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.health.GeocacheHealthCheck;
import com.wildfire.resolution.health.HealthCheck;
import com.wildfire.resolution.health.HealthCheckRegistry;
import com.wildfire.resolution.health.HealthStatus;
import com.wildfire.resolution.health.RiskSourceHealthCheck;
import com.wildfire.resolution.location.LocationOptions;
import com.wildfire.resolution.location.LocationResolver;
import com.wildfire.resolution.location.PositionSensor;
import com.wildfire.resolution.location.PreferenceStore;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.orchestrator.OrchestratorOptions;
import com.wildfire.resolution.orchestrator.OrchestratorTelemetry;
import com.wildfire.resolution.orchestrator.RiskOrchestrator;
import com.wildfire.resolution.source.RiskIndexSource;
import com.wildfire.resolution.source.SyntheticRiskGenerator;
import com.wildfire.resolution.tracing.NoOpTracingService;
import com.wildfire.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the wildfire resolution library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (WildfireResolver resolver = WildfireResolver.builder()
 *         .primarySource(effis)
 *         .secondarySource(sepa)
 *         .positionSensor(gps)
 *         .build()) {
 *
 *     Result&lt;ResolvedLocation&gt; location = resolver.resolveLocation(true);
 *     RiskObservation risk = resolver.resolveRisk(location.getValue().coordinates());
 * }
 * </pre>
 *
 * <p>Risk resolution never fails for a valid coordinate; at worst it returns a synthetic
 * observation. Location resolution fails only when defaults are not allowed.</p>
 */
public class WildfireResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WildfireResolver.class);

    private final RiskOrchestrator orchestrator;
    private final LocationResolver locationResolver;
    private final Geocache geocache;
    private final HealthCheckRegistry healthCheckRegistry;

    private WildfireResolver(Builder builder) {
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.geocache != null) {
            this.geocache = builder.geocache;
        } else {
            GeocacheConfig cacheConfig = builder.geocacheConfig != null
                    ? builder.geocacheConfig : GeocacheConfig.defaults();
            CacheStore store = builder.cacheStore != null
                    ? builder.cacheStore : new CaffeineCacheStore(cacheConfig.capacity() * 2L);
            this.geocache = new Geocache(cacheConfig, store, metricsService, clock);
        }

        this.orchestrator = RiskOrchestrator.builder()
                .primary(builder.primarySource)
                .secondary(builder.secondarySource)
                .geocache(geocache)
                .syntheticGenerator(builder.syntheticGenerator)
                .options(builder.orchestratorOptions)
                .telemetry(builder.telemetry)
                .metrics(metricsService)
                .tracing(tracingService)
                .clock(clock)
                .build();

        this.locationResolver = LocationResolver.builder()
                .sensor(builder.positionSensor)
                .preferences(builder.preferenceStore)
                .options(builder.locationOptions)
                .metrics(metricsService)
                .tracing(tracingService)
                .clock(clock)
                .build();

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new GeocacheHealthCheck(geocache));
        healthCheckRegistry.register(new RiskSourceHealthCheck(builder.primarySource, "primary"));
        if (builder.secondarySource != null) {
            healthCheckRegistry.register(new RiskSourceHealthCheck(builder.secondarySource, "secondary"));
        }
        builder.healthChecks.forEach(healthCheckRegistry::register);

        log.info("WildfireResolver initialized: primary={}, secondary={}, sensor={}",
                builder.primarySource.name(),
                builder.secondarySource != null ? builder.secondarySource.name() : "none",
                builder.positionSensor != null);
    }

    // ========== Risk API ==========

    /**
     * Resolves the current risk with the configured default deadline. Never fails.
     */
    public RiskObservation resolveRisk(GeoCoordinate coordinate) {
        return orchestrator.resolve(coordinate);
    }

    /**
     * Resolves the current risk under an advisory overall deadline. Never fails.
     */
    public RiskObservation resolveRisk(GeoCoordinate coordinate, Duration deadline) {
        return orchestrator.resolve(coordinate, deadline);
    }

    /**
     * Validates raw coordinates first; the only possible failure is {@code VALIDATION}.
     */
    public Result<RiskObservation> resolveRisk(double latitude, double longitude) {
        return orchestrator.resolve(latitude, longitude, null);
    }

    // ========== Location API ==========

    public Result<ResolvedLocation> resolveLocation(boolean allowDefault) {
        return locationResolver.resolve(allowDefault);
    }

    public Result<Void> saveManual(GeoCoordinate coordinate, String placeName) {
        return locationResolver.saveManual(coordinate, placeName);
    }

    public void clearManual() {
        locationResolver.clearManual();
    }

    // ========== Cache API ==========

    public CacheMetadata getCacheMetadata() {
        return geocache.metadata();
    }

    public CacheStats getCacheStats() {
        return geocache.stats();
    }

    /**
     * Purges expired and unreadable cache entries.
     *
     * @return number of entries removed
     */
    public int cleanupCache() {
        return geocache.cleanup();
    }

    public void clearCache() {
        geocache.clear();
    }

    // ========== Health API ==========

    public HealthStatus checkHealth() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    /**
     * Creates an {@link AsyncWildfireResolver} wrapping this resolver.
     * The caller closes it; closing it leaves this resolver open.
     */
    public AsyncWildfireResolver async() {
        return new AsyncWildfireResolverImpl(this);
    }

    @Override
    public void close() {
        orchestrator.close();
        locationResolver.close();
        log.info("WildfireResolver closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RiskIndexSource primarySource;
        private RiskIndexSource secondarySource;
        private Geocache geocache;
        private GeocacheConfig geocacheConfig;
        private CacheStore cacheStore;
        private SyntheticRiskGenerator syntheticGenerator;
        private PositionSensor positionSensor;
        private PreferenceStore preferenceStore;
        private OrchestratorOptions orchestratorOptions;
        private LocationOptions locationOptions;
        private OrchestratorTelemetry telemetry;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        public Builder primarySource(RiskIndexSource primarySource) {
            this.primarySource = primarySource;
            return this;
        }

        public Builder secondarySource(RiskIndexSource secondarySource) {
            this.secondarySource = secondarySource;
            return this;
        }

        /**
         * Uses an existing geocache. Takes precedence over {@link #geocacheConfig} and {@link #cacheStore}.
         */
        public Builder geocache(Geocache geocache) {
            this.geocache = geocache;
            return this;
        }

        public Builder geocacheConfig(GeocacheConfig geocacheConfig) {
            this.geocacheConfig = geocacheConfig;
            return this;
        }

        public Builder cacheStore(CacheStore cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        public Builder syntheticGenerator(SyntheticRiskGenerator syntheticGenerator) {
            this.syntheticGenerator = syntheticGenerator;
            return this;
        }

        public Builder positionSensor(PositionSensor positionSensor) {
            this.positionSensor = positionSensor;
            return this;
        }

        public Builder preferenceStore(PreferenceStore preferenceStore) {
            this.preferenceStore = preferenceStore;
            return this;
        }

        public Builder orchestratorOptions(OrchestratorOptions orchestratorOptions) {
            this.orchestratorOptions = orchestratorOptions;
            return this;
        }

        public Builder locationOptions(LocationOptions locationOptions) {
            this.locationOptions = locationOptions;
            return this;
        }

        public Builder telemetry(OrchestratorTelemetry telemetry) {
            this.telemetry = telemetry;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder healthCheck(HealthCheck healthCheck) {
            this.healthChecks.add(healthCheck);
            return this;
        }

        public WildfireResolver build() {
            if (primarySource == null) {
                throw new IllegalStateException("Primary risk source is required");
            }
            return new WildfireResolver(this);
        }
    }
}
