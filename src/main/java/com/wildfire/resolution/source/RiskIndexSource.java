package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.error.Result;

import java.time.Duration;

/**
 * An upstream provider of fire weather index readings.
 * Implementations must not throw; every failure is returned as a {@link Result} failure.
 */
public interface RiskIndexSource {

    /**
     * Queries the reading for a coordinate.
     *
     * @param coordinate a validated coordinate
     * @param timeout    per-attempt timeout
     */
    Result<RawIndexReading> query(GeoCoordinate coordinate, Duration timeout);

    /**
     * Name used in logs and health details.
     */
    String name();

    /**
     * Returns true if the source appears reachable. Used by health checks only.
     */
    default boolean isAvailable() {
        return true;
    }
}
