package com.wildfire.resolution.orchestrator;

import com.wildfire.resolution.cache.Geocache;
import com.wildfire.resolution.core.DaemonThreads;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.ResolutionStage;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.error.ServiceError;
import com.wildfire.resolution.geo.CoordinateRedactor;
import com.wildfire.resolution.geo.RegionGate;
import com.wildfire.resolution.logging.LogContext;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import com.wildfire.resolution.source.RawIndexReading;
import com.wildfire.resolution.source.RiskIndexSource;
import com.wildfire.resolution.source.SyntheticRiskGenerator;
import com.wildfire.resolution.tracing.NoOpTracingService;
import com.wildfire.resolution.tracing.Span;
import com.wildfire.resolution.tracing.SpanNames;
import com.wildfire.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Resolves the current wildfire risk for a coordinate through a ranked fallback chain:
 * primary source, regional secondary source (inside the region gate only), geocache, and
 * finally a synthetic generator. A risk observation is always produced for a valid coordinate.
 *
 * <p>Each stage is raced against its own budget on a worker pool; losing the race counts as a
 * stage failure. The overall deadline is advisory: stage budgets are not shortened to fit it,
 * but once it has passed the remaining network stages are skipped and the chain continues with
 * the cache and synthetic stages.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (RiskOrchestrator orchestrator = RiskOrchestrator.builder()
 *         .primary(effisSource)
 *         .secondary(regionalSource)
 *         .geocache(geocache)
 *         .build()) {
 *     RiskObservation risk = orchestrator.resolve(GeoCoordinate.of(55.95, -3.19));
 * }
 * </pre>
 */
public class RiskOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RiskOrchestrator.class);

    private final RiskIndexSource primary;
    private final RiskIndexSource secondary;
    private final Geocache geocache;
    private final SyntheticRiskGenerator syntheticGenerator;
    private final RegionGate regionGate;
    private final OrchestratorOptions options;
    private final OrchestratorTelemetry telemetry;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final ExecutorService executor;

    private RiskOrchestrator(Builder builder) {
        this.primary = Objects.requireNonNull(builder.primary, "primary source is required");
        this.secondary = builder.secondary;
        this.geocache = builder.geocache;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.syntheticGenerator = builder.syntheticGenerator != null
                ? builder.syntheticGenerator : SyntheticRiskGenerator.moderate(clock);
        this.regionGate = builder.regionGate != null ? builder.regionGate : RegionGate.SCOTLAND;
        this.options = builder.options != null ? builder.options : OrchestratorOptions.defaults();
        this.telemetry = builder.telemetry != null ? builder.telemetry : NoOpTelemetry.INSTANCE;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        this.executor = DaemonThreads.newCachedPool("wildfire-stage");
        log.info("RiskOrchestrator initialized: primary={}, secondary={}, region={}, cache={}",
                primary.name(), secondary != null ? secondary.name() : "none",
                regionGate.getName(), geocache != null);
    }

    /**
     * Validates raw input, then resolves with the given deadline.
     *
     * @return a {@code VALIDATION} failure for invalid coordinates, otherwise always a success
     */
    public Result<RiskObservation> resolve(double latitude, double longitude, Duration deadline) {
        Optional<ServiceError> invalid = GeoCoordinate.validate(latitude, longitude);
        if (invalid.isPresent()) {
            log.debug("Rejected risk request for {}: {}",
                    CoordinateRedactor.redact(latitude, longitude), invalid.get().message());
            return Result.failure(invalid.get());
        }
        return Result.success(resolve(new GeoCoordinate(latitude, longitude), deadline));
    }

    public RiskObservation resolve(GeoCoordinate coordinate) {
        return resolve(coordinate, options.getDeadline());
    }

    /**
     * Resolves the risk for a valid coordinate. Never fails.
     *
     * @param deadline overall advisory deadline; {@code null} uses the configured default
     */
    public RiskObservation resolve(GeoCoordinate coordinate, Duration deadline) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        Duration effectiveDeadline = deadline != null ? deadline : options.getDeadline();
        String location = CoordinateRedactor.redact(coordinate);
        long startNanos = System.nanoTime();

        try (LogContext ignored = LogContext.forRiskResolution(LogContext.generateCorrelationId(), location);
             Span span = tracing.startSpan(SpanNames.RESOLVE_RISK, Map.of(SpanNames.ATTR_LOCATION, location))) {

            RiskObservation observation = runChain(coordinate, effectiveDeadline, startNanos, span);
            Duration total = elapsedSince(startNanos);

            span.setAttribute(SpanNames.ATTR_RISK_SOURCE, observation.getSource().name());
            span.setAttribute(SpanNames.ATTR_RISK_LEVEL, observation.getLevel().name());
            span.setStatus(observation.getSource() == RiskSource.PRIMARY
                    || observation.getSource() == RiskSource.SECONDARY
                    ? Span.SpanStatus.OK : Span.SpanStatus.DEGRADED);
            metrics.recordRiskResolution(observation.getSource(), total);
            log.info("Resolved {} risk for {} from {} in {}ms",
                    observation.getLevel(), location, observation.getSource(), total.toMillis());
            return observation;
        }
    }

    private RiskObservation runChain(GeoCoordinate coordinate, Duration deadline, long startNanos, Span span) {
        int depth = 0;

        emitDepth(depth);
        Optional<RiskObservation> live = attemptSource(ResolutionStage.PRIMARY, primary, RiskSource.PRIMARY,
                coordinate, options.getPrimaryBudget(), deadline, startNanos, span);
        if (live.isPresent()) {
            return complete(ResolutionStage.PRIMARY, writeThrough(coordinate, live.get()), startNanos);
        }
        depth++;

        if (secondary != null && regionGate.contains(coordinate)) {
            emitDepth(depth);
            live = attemptSource(ResolutionStage.SECONDARY, secondary, RiskSource.SECONDARY,
                    coordinate, options.getSecondaryBudget(), deadline, startNanos, span);
            if (live.isPresent()) {
                return complete(ResolutionStage.SECONDARY, writeThrough(coordinate, live.get()), startNanos);
            }
            depth++;
        }

        if (geocache != null) {
            emitDepth(depth);
            Optional<RiskObservation> cached = attemptCache(coordinate, span);
            if (cached.isPresent()) {
                return complete(ResolutionStage.CACHE, cached.get(), startNanos);
            }
            depth++;
        }

        emitDepth(depth);
        return complete(ResolutionStage.SYNTHETIC, attemptSynthetic(coordinate, span), startNanos);
    }

    private Optional<RiskObservation> attemptSource(ResolutionStage stage, RiskIndexSource source,
                                                    RiskSource attribution, GeoCoordinate coordinate,
                                                    Duration budget, Duration deadline, long startNanos,
                                                    Span span) {
        emit(t -> t.onAttemptStart(stage));
        if (elapsedSince(startNanos).compareTo(deadline) >= 0) {
            log.debug("{} stage skipped: deadline {}ms already passed", stage.getDisplayName(), deadline.toMillis());
            recordAttempt(stage, Duration.ZERO, false, span);
            return Optional.empty();
        }

        long attemptStart = System.nanoTime();
        Optional<Result<RawIndexReading>> outcome = race(stage, () -> source.query(coordinate, budget), budget);
        Duration elapsed = elapsedSince(attemptStart);

        if (outcome.isEmpty()) {
            recordAttempt(stage, elapsed, false, span);
            return Optional.empty();
        }
        Result<RawIndexReading> result = outcome.get();
        if (result.isFailure()) {
            log.debug("{} stage failed after {}ms: {}", stage.getDisplayName(), elapsed.toMillis(), result.getError());
            recordAttempt(stage, elapsed, false, span);
            return Optional.empty();
        }

        RiskObservation observation;
        try {
            observation = toObservation(attribution, result.getValue());
        } catch (RuntimeException e) {
            log.warn("{} stage returned an unusable reading: {}", stage.getDisplayName(), e.getMessage());
            recordAttempt(stage, elapsed, false, span);
            return Optional.empty();
        }
        recordAttempt(stage, elapsed, true, span);
        return Optional.of(observation);
    }

    private static RiskObservation toObservation(RiskSource attribution, RawIndexReading reading) {
        if (reading == null) {
            throw new IllegalStateException("source returned no reading");
        }
        return RiskObservation.live(attribution, reading.resolvedLevel(), reading.indexValue(), reading.observedAt());
    }

    private Optional<RiskObservation> attemptCache(GeoCoordinate coordinate, Span span) {
        emit(t -> t.onAttemptStart(ResolutionStage.CACHE));
        long attemptStart = System.nanoTime();
        Optional<Optional<RiskObservation>> outcome = race(ResolutionStage.CACHE,
                () -> geocache.getForCoordinate(coordinate), options.getCacheBudget());
        Optional<RiskObservation> cached = outcome.flatMap(hit -> hit);
        recordAttempt(ResolutionStage.CACHE, elapsedSince(attemptStart), cached.isPresent(), span);
        return cached;
    }

    private RiskObservation attemptSynthetic(GeoCoordinate coordinate, Span span) {
        emit(t -> t.onAttemptStart(ResolutionStage.SYNTHETIC));
        long attemptStart = System.nanoTime();
        RiskObservation observation;
        try {
            observation = syntheticGenerator.generate(coordinate);
            if (observation == null || observation.getSource() != RiskSource.SYNTHETIC) {
                throw new IllegalStateException("Synthetic generator returned a non-synthetic observation");
            }
        } catch (RuntimeException e) {
            log.warn("Synthetic generator failed, using fixed MODERATE: {}", e.getMessage());
            observation = RiskObservation.synthetic(RiskLevel.MODERATE, clock.instant());
        }
        recordAttempt(ResolutionStage.SYNTHETIC, elapsedSince(attemptStart), true, span);
        return observation;
    }

    /**
     * Runs {@code work} on the stage pool and waits at most {@code budget}.
     * Any exception or timeout yields empty.
     */
    private <T> Optional<T> race(ResolutionStage stage, Callable<T> work, Duration budget) {
        Future<T> future;
        try {
            future = executor.submit(work);
        } catch (RuntimeException e) {
            log.warn("{} stage could not be scheduled: {}", stage.getDisplayName(), e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.get(budget.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("{} stage exceeded its {}ms budget", stage.getDisplayName(), budget.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("{} stage interrupted", stage.getDisplayName());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} stage threw {}: {}", stage.getDisplayName(),
                    cause.getClass().getSimpleName(), cause.getMessage());
            return Optional.empty();
        }
    }

    private RiskObservation writeThrough(GeoCoordinate coordinate, RiskObservation observation) {
        if (geocache == null || !options.isWriteThrough()) {
            return observation;
        }
        try {
            Result<Void> stored = geocache.set(coordinate, observation);
            if (stored.isFailure()) {
                log.warn("Could not cache {} observation: {}", observation.getSource(), stored.getError());
            }
        } catch (RuntimeException e) {
            log.warn("Could not cache {} observation: {}", observation.getSource(), e.getMessage());
        }
        return observation;
    }

    private void recordAttempt(ResolutionStage stage, Duration elapsed, boolean success, Span span) {
        emit(t -> t.onAttemptEnd(stage, elapsed, success));
        metrics.recordStageAttempt(stage, success, elapsed);
        span.stageOutcome(stage, success);
    }

    private RiskObservation complete(ResolutionStage stage, RiskObservation observation, long startNanos) {
        Duration total = elapsedSince(startNanos);
        emit(t -> t.onComplete(stage, total));
        return observation;
    }

    private void emitDepth(int depth) {
        emit(t -> t.onFallbackDepth(depth));
    }

    /**
     * A throwing listener is logged and ignored.
     */
    private void emit(Consumer<OrchestratorTelemetry> event) {
        try {
            event.accept(telemetry);
        } catch (RuntimeException e) {
            log.warn("Telemetry listener {} threw {}: {}", telemetry.getClass().getSimpleName(),
                    e.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public OrchestratorOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        DaemonThreads.shutdown(executor);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RiskIndexSource primary;
        private RiskIndexSource secondary;
        private Geocache geocache;
        private SyntheticRiskGenerator syntheticGenerator;
        private RegionGate regionGate;
        private OrchestratorOptions options;
        private OrchestratorTelemetry telemetry;
        private MetricsService metrics;
        private TracingService tracing;
        private Clock clock;

        public Builder primary(RiskIndexSource primary) {
            this.primary = primary;
            return this;
        }

        /**
         * Regional source consulted only for coordinates inside the region gate.
         */
        public Builder secondary(RiskIndexSource secondary) {
            this.secondary = secondary;
            return this;
        }

        public Builder geocache(Geocache geocache) {
            this.geocache = geocache;
            return this;
        }

        public Builder syntheticGenerator(SyntheticRiskGenerator syntheticGenerator) {
            this.syntheticGenerator = syntheticGenerator;
            return this;
        }

        public Builder regionGate(RegionGate regionGate) {
            this.regionGate = regionGate;
            return this;
        }

        public Builder options(OrchestratorOptions options) {
            this.options = options;
            return this;
        }

        public Builder telemetry(OrchestratorTelemetry telemetry) {
            this.telemetry = telemetry;
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

        public RiskOrchestrator build() {
            return new RiskOrchestrator(this);
        }
    }
}
