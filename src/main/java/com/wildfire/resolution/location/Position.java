package com.wildfire.resolution.location;

import com.wildfire.resolution.core.model.GeoCoordinate;

import java.time.Instant;

/**
 * A raw fix reported by a {@link PositionSensor}. Values are not validated; the resolver
 * rejects fixes that do not form a valid coordinate.
 *
 * @param latitude       decimal degrees
 * @param longitude      decimal degrees
 * @param accuracyMeters horizontal accuracy, or {@code null} if unknown
 * @param timestamp      time of the fix, or {@code null} if unknown
 */
public record Position(double latitude, double longitude, Double accuracyMeters, Instant timestamp) {

    public Position(double latitude, double longitude) {
        this(latitude, longitude, null, null);
    }

    public boolean isValid() {
        return GeoCoordinate.isValid(latitude, longitude);
    }

    /**
     * @throws IllegalArgumentException if the fix is not a valid coordinate
     */
    public GeoCoordinate toCoordinate() {
        return new GeoCoordinate(latitude, longitude);
    }
}
