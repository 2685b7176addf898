package com.wildfire.resolution.cache;

import com.wildfire.resolution.geo.Geohash;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the {@link Geocache}.
 *
 * @param capacity  maximum number of cached cells before LRU eviction
 * @param ttl       maximum age of a readable entry (inclusive)
 * @param precision geohash precision used to key coordinates
 */
public record GeocacheConfig(int capacity, Duration ttl, int precision) {

    public GeocacheConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (precision < 1 || precision > Geohash.MAX_PRECISION) {
            throw new IllegalArgumentException("precision must be between 1 and " + Geohash.MAX_PRECISION);
        }
    }

    /**
     * Default configuration: 100 entries, 6 hour TTL, precision 5 (about 4.9km cells).
     */
    public static GeocacheConfig defaults() {
        return new GeocacheConfig(100, Duration.ofHours(6), Geohash.DEFAULT_PRECISION);
    }
}
