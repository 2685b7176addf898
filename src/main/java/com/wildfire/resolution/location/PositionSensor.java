package com.wildfire.resolution.location;

import java.time.Duration;
import java.util.Optional;

/**
 * Platform location provider.
 */
public interface PositionSensor {

    /**
     * Whether this platform can produce live fixes at all. When false the live-fix tier is skipped.
     */
    boolean isSupported();

    /**
     * Returns the last fix the platform already holds, without waiting for a new one.
     */
    Optional<Position> lastKnown() throws SensorException;

    /**
     * Requests a fresh fix, waiting at most {@code timeout}.
     */
    Position current(Duration timeout) throws SensorException;
}
