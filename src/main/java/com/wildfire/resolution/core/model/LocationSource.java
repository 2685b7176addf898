package com.wildfire.resolution.core.model;

/**
 * Tier that produced a resolved device location.
 */
public enum LocationSource {
    /**
     * Last fix already held by the platform sensor.
     */
    LAST_KNOWN,

    /**
     * Fresh reading requested from the sensor.
     */
    LIVE_FIX,

    /**
     * Coordinate previously entered by the user, still within its reuse window.
     */
    CACHED_MANUAL,

    /**
     * Configured fallback coordinate.
     */
    PERSISTED_DEFAULT
}
