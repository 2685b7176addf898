package com.wildfire.resolution.location;

import com.wildfire.resolution.core.DaemonThreads;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolvedLocation;
import com.wildfire.resolution.error.ErrorKind;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.error.ServiceError;
import com.wildfire.resolution.geo.CoordinateRedactor;
import com.wildfire.resolution.logging.LogContext;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.tracing.NoOpTracingService;
import com.wildfire.resolution.tracing.Span;
import com.wildfire.resolution.tracing.SpanNames;
import com.wildfire.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces a device location through ordered tiers under a cumulative budget:
 * <ol>
 *   <li>last known sensor fix</li>
 *   <li>live sensor fix (skipped when the sensor is unsupported)</li>
 *   <li>manually entered location younger than one hour</li>
 *   <li>configured default, only when {@code allowDefault} is true</li>
 * </ol>
 * Sensor failures of any kind fail their tier and never propagate. Coordinates are only logged
 * through {@link CoordinateRedactor}.
 */
public class LocationResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

    private final PositionSensor sensor;
    private final ManualLocationStore manualStore;
    private final LocationOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService executor;

    private LocationResolver(Builder builder) {
        this.sensor = builder.sensor;
        this.options = builder.options != null ? builder.options : LocationOptions.defaults();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        PreferenceStore preferences = builder.preferences != null ? builder.preferences : new InMemoryPreferenceStore();
        this.manualStore = new ManualLocationStore(preferences, clock, options.getManualMaxAge());
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        this.executor = DaemonThreads.newCachedPool("wildfire-location");
    }

    /**
     * Resolves the best available location.
     *
     * @param allowDefault whether the configured default may be returned when every other tier fails
     * @return the location, or a {@code VALIDATION / PERMISSION_DENIED} error when no tier succeeded
     *         and defaults are not allowed
     */
    public Result<ResolvedLocation> resolve(boolean allowDefault) {
        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forLocationResolution(LogContext.generateCorrelationId(), allowDefault);
             Span span = tracing.startSpan(SpanNames.RESOLVE_LOCATION,
                     Map.of(SpanNames.ATTR_ALLOW_DEFAULT, Boolean.toString(allowDefault)))) {

            Result<ResolvedLocation> result = runTiers(allowDefault, startNanos, span);
            Duration elapsed = elapsedSince(startNanos);
            if (result.isSuccess()) {
                ResolvedLocation location = result.getValue();
                span.setAttribute(SpanNames.ATTR_LOCATION_SOURCE, location.source().name());
                span.setStatus(location.source() == LocationSource.PERSISTED_DEFAULT
                        ? Span.SpanStatus.DEGRADED : Span.SpanStatus.OK);
                metrics.recordLocationResolution(location.source(), elapsed);
                log.info("Resolved location {} from {} in {}ms",
                        CoordinateRedactor.redact(location.coordinates()), location.source(), elapsed.toMillis());
            } else {
                span.setStatus(Span.SpanStatus.ERROR);
                metrics.incrementLocationFailure();
                log.warn("No location available after {}ms: {}", elapsed.toMillis(), result.getError());
            }
            return result;
        }
    }

    /**
     * Overwrites the manual location slot.
     */
    public Result<Void> saveManual(GeoCoordinate coordinate, String placeName) {
        if (coordinate == null) {
            return Result.failure(ServiceError.validation("coordinate is required"));
        }
        try {
            manualStore.save(coordinate, placeName);
        } catch (RuntimeException e) {
            log.warn("Manual location could not be saved: {}", e.getMessage());
            return Result.failure(ServiceError.general("Manual location could not be saved: " + e.getMessage()));
        }
        return Result.success(null);
    }

    public void clearManual() {
        manualStore.clear();
    }

    /**
     * Returns the manual location if it is still usable by the manual tier.
     */
    public Optional<ManualLocation> loadManual() {
        return readManual();
    }

    @Override
    public void close() {
        DaemonThreads.shutdown(executor);
    }

    private Result<ResolvedLocation> runTiers(boolean allowDefault, long startNanos, Span span) {
        Optional<GeoCoordinate> lastKnown = lastKnownFix(startNanos);
        if (lastKnown.isPresent()) {
            span.tierResolved(LocationSource.LAST_KNOWN);
            return Result.success(new ResolvedLocation(lastKnown.get(), LocationSource.LAST_KNOWN));
        }

        if (sensorSupported()) {
            Optional<GeoCoordinate> liveFix = liveFix(startNanos);
            if (liveFix.isPresent()) {
                span.tierResolved(LocationSource.LIVE_FIX);
                return Result.success(new ResolvedLocation(liveFix.get(), LocationSource.LIVE_FIX));
            }
        } else {
            log.debug("Live fix tier skipped: no supported sensor");
        }

        Optional<ManualLocation> manual = readManual();
        if (manual.isPresent()) {
            span.tierResolved(LocationSource.CACHED_MANUAL);
            return Result.success(new ResolvedLocation(manual.get().coordinate(),
                    LocationSource.CACHED_MANUAL, manual.get().placeName()));
        }

        if (!allowDefault) {
            return Result.failure(ServiceError.validation(
                    "No location available and default location not allowed", ErrorKind.PERMISSION_DENIED));
        }
        span.tierResolved(LocationSource.PERSISTED_DEFAULT);
        return Result.success(new ResolvedLocation(options.getDefaultLocation(),
                LocationSource.PERSISTED_DEFAULT, options.getDefaultPlaceName()));
    }

    private boolean sensorSupported() {
        if (sensor == null) {
            return false;
        }
        try {
            return sensor.isSupported();
        } catch (RuntimeException e) {
            log.warn("Sensor capability check threw {}: {}", e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    private Optional<ManualLocation> readManual() {
        try {
            return manualStore.load();
        } catch (RuntimeException e) {
            log.warn("Manual location could not be read: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<GeoCoordinate> lastKnownFix(long startNanos) {
        if (sensor == null) {
            return Optional.empty();
        }
        Duration remaining = remaining(startNanos);
        Optional<Optional<Position>> outcome = race("last known", sensor::lastKnown, remaining);
        return outcome.flatMap(position -> position).flatMap(position -> toCoordinate(position, "last known"));
    }

    private Optional<GeoCoordinate> liveFix(long startNanos) {
        Duration remaining = remaining(startNanos);
        if (remaining.isZero()) {
            log.debug("Live fix tier skipped: location budget exhausted");
            return Optional.empty();
        }
        Duration budget = remaining.compareTo(options.getLiveFixBudget()) < 0 ? remaining : options.getLiveFixBudget();
        Optional<Position> outcome = race("live fix", () -> sensor.current(budget), budget);
        return outcome.flatMap(position -> toCoordinate(position, "live fix"));
    }

    private <T> Optional<T> race(String tier, Callable<T> work, Duration budget) {
        if (budget.isZero()) {
            return Optional.empty();
        }
        Future<T> future;
        try {
            future = executor.submit(work);
        } catch (RuntimeException e) {
            log.warn("{} tier could not be scheduled: {}", tier, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.get(budget.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("{} tier exceeded its {}ms budget", tier, budget.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SensorException sensorFailure) {
                log.debug("{} tier failed ({}): {}", tier, sensorFailure.getReason(), sensorFailure.getMessage());
            } else {
                log.warn("{} tier threw {}: {}", tier, cause.getClass().getSimpleName(), cause.getMessage());
            }
            return Optional.empty();
        }
    }

    private static Optional<GeoCoordinate> toCoordinate(Position position, String tier) {
        if (!position.isValid()) {
            log.debug("{} tier returned an invalid fix {}", tier,
                    CoordinateRedactor.redact(position.latitude(), position.longitude()));
            return Optional.empty();
        }
        return Optional.of(position.toCoordinate());
    }

    private Duration remaining(long startNanos) {
        Duration left = options.getTotalBudget().minus(elapsedSince(startNanos));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PositionSensor sensor;
        private PreferenceStore preferences;
        private LocationOptions options;
        private MetricsService metrics;
        private TracingService tracing;
        private Clock clock;

        /**
         * Platform sensor; when absent both sensor tiers are skipped.
         */
        public Builder sensor(PositionSensor sensor) {
            this.sensor = sensor;
            return this;
        }

        public Builder preferences(PreferenceStore preferences) {
            this.preferences = preferences;
            return this;
        }

        public Builder options(LocationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LocationResolver build() {
            return new LocationResolver(this);
        }
    }
}
