package com.wildfire.resolution.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Device location produced by one location resolution call.
 *
 * @param coordinates resolved coordinate
 * @param source      tier that produced it
 * @param placeName   user-supplied place name, only present for cached manual entries
 */
public record ResolvedLocation(GeoCoordinate coordinates, LocationSource source, String placeName) {

    public ResolvedLocation {
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(source, "source is required");
    }

    public ResolvedLocation(GeoCoordinate coordinates, LocationSource source) {
        this(coordinates, source, null);
    }

    public Optional<String> place() {
        return Optional.ofNullable(placeName);
    }
}
