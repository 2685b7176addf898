package com.wildfire.resolution.location;

import com.wildfire.resolution.core.model.GeoCoordinate;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A user-entered location as persisted by {@link ManualLocationStore}.
 *
 * @param coordinate the saved coordinate
 * @param placeName  user-visible name, or {@code null}
 * @param savedAt    when it was saved (UTC)
 */
public record ManualLocation(GeoCoordinate coordinate, String placeName, Instant savedAt) {

    public ManualLocation {
        Objects.requireNonNull(coordinate, "coordinate is required");
        Objects.requireNonNull(savedAt, "savedAt is required");
    }

    public Optional<String> place() {
        return Optional.ofNullable(placeName);
    }
}
