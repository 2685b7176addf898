package com.wildfire.resolution.api;

import com.wildfire.resolution.core.DaemonThreads;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.ResolvedLocation;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.error.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link AsyncWildfireResolver} running each call on a cached daemon thread pool.
 * Closing it does not close the wrapped {@link WildfireResolver}.
 */
public class AsyncWildfireResolverImpl implements AsyncWildfireResolver {
    private static final Logger log = LoggerFactory.getLogger(AsyncWildfireResolverImpl.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final WildfireResolver resolver;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncWildfireResolverImpl(WildfireResolver resolver) {
        this(resolver, DEFAULT_TIMEOUT);
    }

    public AsyncWildfireResolverImpl(WildfireResolver resolver, Duration timeout) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMs = timeout.toMillis();
        this.executor = DaemonThreads.newCachedPool("wildfire-async");
    }

    @Override
    public CompletableFuture<RiskObservation> resolveRiskAsync(GeoCoordinate coordinate) {
        return CompletableFuture.supplyAsync(() -> resolver.resolveRisk(coordinate), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<RiskObservation> resolveRiskAsync(GeoCoordinate coordinate, Duration deadline) {
        return CompletableFuture.supplyAsync(() -> resolver.resolveRisk(coordinate, deadline), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<RiskObservation>> resolveRiskBatchAsync(List<GeoCoordinate> coordinates) {
        List<CompletableFuture<RiskObservation>> futures = coordinates.stream()
                .map(this::resolveRiskAsync)
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<Result<ResolvedLocation>> resolveLocationAsync(boolean allowDefault) {
        return CompletableFuture.supplyAsync(() -> resolver.resolveLocation(allowDefault), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        log.debug("Shutting down async resolver executor");
        DaemonThreads.shutdown(executor);
    }
}
