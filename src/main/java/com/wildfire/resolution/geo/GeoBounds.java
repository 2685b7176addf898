package com.wildfire.resolution.geo;

import com.wildfire.resolution.core.model.GeoCoordinate;

/**
 * Axis-aligned latitude/longitude box with inclusive edges.
 *
 * @param minLatitude  southern edge
 * @param minLongitude western edge
 * @param maxLatitude  northern edge
 * @param maxLongitude eastern edge
 */
public record GeoBounds(double minLatitude, double minLongitude, double maxLatitude, double maxLongitude) {

    public GeoBounds {
        if (minLatitude > maxLatitude) {
            throw new IllegalArgumentException("minLatitude must be <= maxLatitude");
        }
        if (minLongitude > maxLongitude) {
            throw new IllegalArgumentException("minLongitude must be <= maxLongitude");
        }
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude
                && latitude <= maxLatitude
                && longitude >= minLongitude
                && longitude <= maxLongitude;
    }

    public boolean contains(GeoCoordinate coordinate) {
        return contains(coordinate.latitude(), coordinate.longitude());
    }

    public GeoCoordinate center() {
        return new GeoCoordinate((minLatitude + maxLatitude) / 2, (minLongitude + maxLongitude) / 2);
    }
}
