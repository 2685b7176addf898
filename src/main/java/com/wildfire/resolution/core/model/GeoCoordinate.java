package com.wildfire.resolution.core.model;

import com.wildfire.resolution.error.ServiceError;

import java.util.Optional;

/**
 * Immutable WGS84 coordinate. Both components are finite, latitude is within [-90, 90]
 * and longitude within [-180, 180]; construction fails otherwise.
 *
 * @param latitude  decimal degrees
 * @param longitude decimal degrees
 */
public record GeoCoordinate(double latitude, double longitude) {

    public GeoCoordinate {
        validate(latitude, longitude).ifPresent(error -> {
            throw new IllegalArgumentException(error.message());
        });
    }

    public static GeoCoordinate of(double latitude, double longitude) {
        return new GeoCoordinate(latitude, longitude);
    }

    /**
     * Checks raw coordinate values without throwing.
     *
     * @return a validation error, or empty if the values form a valid coordinate
     */
    public static Optional<ServiceError> validate(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            return Optional.of(ServiceError.validation("Coordinates must be finite numbers"));
        }
        if (latitude < -90.0 || latitude > 90.0) {
            return Optional.of(ServiceError.validation("Latitude must be between -90 and 90 degrees"));
        }
        if (longitude < -180.0 || longitude > 180.0) {
            return Optional.of(ServiceError.validation("Longitude must be between -180 and 180 degrees"));
        }
        return Optional.empty();
    }

    public static boolean isValid(double latitude, double longitude) {
        return validate(latitude, longitude).isEmpty();
    }
}
