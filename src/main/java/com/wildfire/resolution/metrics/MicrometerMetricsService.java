package com.wildfire.resolution.metrics;

import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolutionStage;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.error.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code wildfire.stage.attempt} : Timer (tags: stage, outcome)</li>
 *   <li>{@code wildfire.risk.resolution} : Timer (tag: source)</li>
 *   <li>{@code wildfire.location.resolution} : Timer (tag: source)</li>
 *   <li>{@code wildfire.location.failure} : Counter</li>
 *   <li>{@code wildfire.fetch.retry} : Counter</li>
 *   <li>{@code wildfire.fetch.failure} : Counter (tag: category)</li>
 *   <li>{@code wildfire.cache.hit}, {@code wildfire.cache.miss}, {@code wildfire.cache.eviction} : Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter locationFailureCounter;
    private final Counter fetchRetryCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheEvictionCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.locationFailureCounter = Counter.builder("wildfire.location.failure")
                .description("Location resolutions that exhausted every tier")
                .register(registry);
        this.fetchRetryCounter = Counter.builder("wildfire.fetch.retry")
                .description("Retries performed by the resilient fetcher")
                .register(registry);
        this.cacheHitCounter = Counter.builder("wildfire.cache.hit")
                .description("Number of geocache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("wildfire.cache.miss")
                .description("Number of geocache misses")
                .register(registry);
        this.cacheEvictionCounter = Counter.builder("wildfire.cache.eviction")
                .description("Number of LRU evictions from the geocache")
                .register(registry);
    }

    @Override
    public void recordStageAttempt(ResolutionStage stage, boolean success, Duration elapsed) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("stage:" + stage.name() + ":" + outcome, k ->
                Timer.builder("wildfire.stage.attempt")
                        .description("Duration of individual fallback stage attempts")
                        .tag("stage", stage.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(elapsed);
    }

    @Override
    public void recordRiskResolution(RiskSource source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("risk:" + source.name(), k ->
                Timer.builder("wildfire.risk.resolution")
                        .description("Duration of risk resolutions by final source")
                        .tag("source", source.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordLocationResolution(LocationSource source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("location:" + source.name(), k ->
                Timer.builder("wildfire.location.resolution")
                        .description("Duration of location resolutions by tier")
                        .tag("source", source.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementLocationFailure() {
        locationFailureCounter.increment();
    }

    @Override
    public void incrementFetchRetry() {
        fetchRetryCounter.increment();
    }

    @Override
    public void incrementFetchFailure(ErrorCategory category) {
        Counter counter = counterCache.computeIfAbsent("fetch:" + category.name(), k ->
                Counter.builder("wildfire.fetch.failure")
                        .description("Terminal fetch failures by category")
                        .tag("category", category.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheEviction() {
        cacheEvictionCounter.increment();
    }
}
