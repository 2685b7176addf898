package com.wildfire.resolution.api;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.ResolvedLocation;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.error.Result;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking view of a {@link WildfireResolver}. Futures complete exceptionally with a
 * {@link java.util.concurrent.TimeoutException} when the configured async timeout elapses.
 */
public interface AsyncWildfireResolver extends AutoCloseable {

    CompletableFuture<RiskObservation> resolveRiskAsync(GeoCoordinate coordinate);

    CompletableFuture<RiskObservation> resolveRiskAsync(GeoCoordinate coordinate, Duration deadline);

    /**
     * Resolves several coordinates in parallel; results keep the input order.
     */
    CompletableFuture<List<RiskObservation>> resolveRiskBatchAsync(List<GeoCoordinate> coordinates);

    CompletableFuture<Result<ResolvedLocation>> resolveLocationAsync(boolean allowDefault);

    @Override
    void close();
}
