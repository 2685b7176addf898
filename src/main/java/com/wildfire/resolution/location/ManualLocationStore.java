package com.wildfire.resolution.location;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.geo.CoordinateRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-slot persistence of the user's manually entered location.
 *
 * <p>An entry is readable only if its format version matches, its timestamp is present and it is
 * younger than the maximum age. Anything else reads as absent.</p>
 */
public class ManualLocationStore {
    private static final Logger log = LoggerFactory.getLogger(ManualLocationStore.class);

    static final String VERSION_KEY = "manual_location_version";
    static final String LAT_KEY = "manual_location_lat";
    static final String LON_KEY = "manual_location_lon";
    static final String PLACE_KEY = "manual_location_place";
    static final String TIMESTAMP_KEY = "manual_location_timestamp";
    static final String CURRENT_VERSION = "1.0";

    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);

    private final PreferenceStore preferences;
    private final Clock clock;
    private final Duration maxAge;

    public ManualLocationStore(PreferenceStore preferences, Clock clock) {
        this(preferences, clock, DEFAULT_MAX_AGE);
    }

    public ManualLocationStore(PreferenceStore preferences, Clock clock, Duration maxAge) {
        this.preferences = Objects.requireNonNull(preferences, "preferences is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge is required");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be > 0");
        }
    }

    /**
     * Overwrites the stored location. A {@code null} place name clears any previous one.
     */
    public void save(GeoCoordinate coordinate, String placeName) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        preferences.putDouble(LAT_KEY, coordinate.latitude());
        preferences.putDouble(LON_KEY, coordinate.longitude());
        if (placeName != null && !placeName.isBlank()) {
            preferences.putString(PLACE_KEY, placeName);
        } else {
            preferences.remove(PLACE_KEY);
        }
        preferences.putString(VERSION_KEY, CURRENT_VERSION);
        preferences.putLong(TIMESTAMP_KEY, clock.millis());
        log.info("Saved manual location {}", CoordinateRedactor.redact(coordinate));
    }

    /**
     * Returns the stored location if it is present, current-version and younger than the max age.
     */
    public Optional<ManualLocation> load() {
        Optional<String> version = preferences.getString(VERSION_KEY);
        if (version.isEmpty() || !CURRENT_VERSION.equals(version.get())) {
            log.debug("Manual location absent or has unsupported version {}", version.orElse("none"));
            return Optional.empty();
        }
        Optional<Long> timestamp = preferences.getLong(TIMESTAMP_KEY);
        if (timestamp.isEmpty()) {
            log.debug("Manual location has no timestamp, ignoring");
            return Optional.empty();
        }
        Instant savedAt = Instant.ofEpochMilli(timestamp.get());
        Duration age = Duration.between(savedAt, clock.instant());
        if (age.compareTo(maxAge) >= 0) {
            log.debug("Manual location is {}min old, ignoring", age.toMinutes());
            return Optional.empty();
        }
        Optional<Double> lat = preferences.getDouble(LAT_KEY);
        Optional<Double> lon = preferences.getDouble(LON_KEY);
        if (lat.isEmpty() || lon.isEmpty() || !GeoCoordinate.isValid(lat.get(), lon.get())) {
            log.debug("Manual location has missing or invalid coordinates");
            return Optional.empty();
        }
        return Optional.of(new ManualLocation(new GeoCoordinate(lat.get(), lon.get()),
                preferences.getString(PLACE_KEY).orElse(null), savedAt));
    }

    public void clear() {
        preferences.remove(VERSION_KEY);
        preferences.remove(LAT_KEY);
        preferences.remove(LON_KEY);
        preferences.remove(PLACE_KEY);
        preferences.remove(TIMESTAMP_KEY);
        log.info("Cleared manual location");
    }
}
