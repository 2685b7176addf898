package com.wildfire.resolution.cdi;

import com.wildfire.resolution.api.AsyncWildfireResolver;
import com.wildfire.resolution.api.AsyncWildfireResolverImpl;
import com.wildfire.resolution.api.WildfireResolver;
import com.wildfire.resolution.cache.GeocacheConfig;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.fetch.ResilientFetcher;
import com.wildfire.resolution.fetch.RetryConfig;
import com.wildfire.resolution.location.LocationOptions;
import com.wildfire.resolution.location.PositionSensor;
import com.wildfire.resolution.location.PreferenceStore;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.MicrometerMetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.orchestrator.OrchestratorOptions;
import com.wildfire.resolution.source.HttpRiskIndexSource;
import com.wildfire.resolution.source.SyntheticRiskGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the wildfire resolution library from MicroProfile Config properties.
 *
 * <h2>Minimal configuration</h2>
 * <pre>
 * wildfire-resolution:
 *   primary:
 *     base-url: https://fwi.example.org/api/fwi
 *   secondary:
 *     base-url: https://regional.example.org/api/fwi
 * </pre>
 *
 * <p>Optional beans picked up when present: {@link PositionSensor}, {@link PreferenceStore},
 * and a Micrometer {@link MeterRegistry}.</p>
 */
@ApplicationScoped
public class WildfireResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(WildfireResolutionProducer.class);

    // ── Sources ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.primary.name", defaultValue = "primary")
    String primaryName;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.primary.base-url")
    String primaryBaseUrl;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.secondary.name", defaultValue = "secondary")
    String secondaryName;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.secondary.base-url")
    Optional<String> secondaryBaseUrl;

    // ── Retry ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.retry.max-retries", defaultValue = "3")
    int maxRetries;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.retry.base-delay-millis", defaultValue = "1000")
    long baseDelayMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.retry.min-delay-millis", defaultValue = "100")
    long minDelayMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.retry.max-delay-millis", defaultValue = "30000")
    long maxDelayMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.retry.jitter-factor", defaultValue = "0.25")
    double jitterFactor;

    // ── Orchestrator budgets ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.risk.deadline-millis", defaultValue = "8000")
    long deadlineMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.risk.primary-budget-millis", defaultValue = "3000")
    long primaryBudgetMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.risk.secondary-budget-millis", defaultValue = "2000")
    long secondaryBudgetMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.risk.cache-budget-millis", defaultValue = "1000")
    long cacheBudgetMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.risk.synthetic-strategy", defaultValue = "fixed")
    String syntheticStrategy;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.cache.capacity", defaultValue = "100")
    int cacheCapacity;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.cache.ttl-minutes", defaultValue = "360")
    long cacheTtlMinutes;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.cache.precision", defaultValue = "5")
    int cachePrecision;

    // ── Location ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.location.total-budget-millis", defaultValue = "2500")
    long locationBudgetMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.location.live-fix-budget-millis", defaultValue = "2000")
    long liveFixBudgetMillis;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.location.default-latitude", defaultValue = "55.8642")
    double defaultLatitude;

    @Inject
    @ConfigProperty(name = "wildfire-resolution.location.default-longitude", defaultValue = "-4.2518")
    double defaultLongitude;

    // ── Async ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "wildfire-resolution.async.timeout-millis", defaultValue = "10000")
    long asyncTimeoutMillis;

    @Inject
    Instance<PositionSensor> positionSensor;

    @Inject
    Instance<PreferenceStore> preferenceStore;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ResilientFetcher resilientFetcher() {
        return new ResilientFetcher(retryConfig(), metricsService());
    }

    public void closeFetcher(@Disposes ResilientFetcher fetcher) {
        fetcher.close();
    }

    @Produces
    @ApplicationScoped
    public WildfireResolver wildfireResolver(ResilientFetcher fetcher) {
        log.info("Producing WildfireResolver: primary={}, secondary={}",
                primaryName, secondaryBaseUrl.isPresent() ? secondaryName : "none");

        WildfireResolver.Builder builder = WildfireResolver.builder()
                .primarySource(HttpRiskIndexSource.builder()
                        .name(primaryName)
                        .baseUrl(primaryBaseUrl)
                        .fetcher(fetcher)
                        .build())
                .geocacheConfig(geocacheConfig())
                .orchestratorOptions(orchestratorOptions())
                .locationOptions(locationOptions())
                .syntheticGenerator(syntheticGenerator())
                .metricsService(metricsService());

        secondaryBaseUrl.ifPresent(url -> builder.secondarySource(HttpRiskIndexSource.builder()
                .name(secondaryName)
                .baseUrl(url)
                .fetcher(fetcher)
                .build()));
        if (positionSensor != null && positionSensor.isResolvable()) {
            builder.positionSensor(positionSensor.get());
        }
        if (preferenceStore != null && preferenceStore.isResolvable()) {
            builder.preferenceStore(preferenceStore.get());
        }
        return builder.build();
    }

    public void closeResolver(@Disposes WildfireResolver resolver) {
        log.info("Closing WildfireResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public AsyncWildfireResolver asyncWildfireResolver(WildfireResolver resolver) {
        return new AsyncWildfireResolverImpl(resolver, Duration.ofMillis(asyncTimeoutMillis));
    }

    public void closeAsyncResolver(@Disposes AsyncWildfireResolver resolver) {
        resolver.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    RetryConfig retryConfig() {
        return new RetryConfig(maxRetries, Duration.ofMillis(baseDelayMillis), Duration.ofMillis(minDelayMillis),
                Duration.ofMillis(maxDelayMillis), jitterFactor);
    }

    GeocacheConfig geocacheConfig() {
        return new GeocacheConfig(cacheCapacity, Duration.ofMinutes(cacheTtlMinutes), cachePrecision);
    }

    OrchestratorOptions orchestratorOptions() {
        return OrchestratorOptions.builder()
                .deadline(Duration.ofMillis(deadlineMillis))
                .primaryBudget(Duration.ofMillis(primaryBudgetMillis))
                .secondaryBudget(Duration.ofMillis(secondaryBudgetMillis))
                .cacheBudget(Duration.ofMillis(cacheBudgetMillis))
                .build();
    }

    LocationOptions locationOptions() {
        return LocationOptions.builder()
                .totalBudget(Duration.ofMillis(locationBudgetMillis))
                .liveFixBudget(Duration.ofMillis(liveFixBudgetMillis))
                .defaultLocation(new GeoCoordinate(defaultLatitude, defaultLongitude))
                .build();
    }

    SyntheticRiskGenerator syntheticGenerator() {
        if ("geohash".equalsIgnoreCase(syntheticStrategy)) {
            return SyntheticRiskGenerator.geohashDeterministic(Clock.systemUTC());
        }
        if (!"fixed".equalsIgnoreCase(syntheticStrategy)) {
            log.warn("Unknown synthetic strategy '{}', falling back to fixed MODERATE", syntheticStrategy);
        }
        return SyntheticRiskGenerator.moderate(Clock.systemUTC());
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
