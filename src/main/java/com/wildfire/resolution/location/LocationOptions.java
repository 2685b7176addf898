package com.wildfire.resolution.location;

import com.wildfire.resolution.core.model.GeoCoordinate;

import java.time.Duration;
import java.util.Objects;

/**
 * Budgets and fallback settings for the {@link LocationResolver}.
 */
public class LocationOptions {

    /**
     * Scotland population centroid (Glasgow area).
     */
    public static final GeoCoordinate SCOTLAND_CENTROID = new GeoCoordinate(55.8642, -4.2518);
    public static final Duration DEFAULT_TOTAL_BUDGET = Duration.ofMillis(2500);
    public static final Duration DEFAULT_LIVE_FIX_BUDGET = Duration.ofSeconds(2);

    private final Duration totalBudget;
    private final Duration liveFixBudget;
    private final Duration manualMaxAge;
    private final GeoCoordinate defaultLocation;
    private final String defaultPlaceName;

    private LocationOptions(Builder builder) {
        this.totalBudget = requirePositive(builder.totalBudget, "totalBudget");
        this.liveFixBudget = requirePositive(builder.liveFixBudget, "liveFixBudget");
        this.manualMaxAge = requirePositive(builder.manualMaxAge, "manualMaxAge");
        this.defaultLocation = Objects.requireNonNull(builder.defaultLocation, "defaultLocation is required");
        this.defaultPlaceName = builder.defaultPlaceName;
    }

    public static LocationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getTotalBudget() {
        return totalBudget;
    }

    public Duration getLiveFixBudget() {
        return liveFixBudget;
    }

    public Duration getManualMaxAge() {
        return manualMaxAge;
    }

    public GeoCoordinate getDefaultLocation() {
        return defaultLocation;
    }

    public String getDefaultPlaceName() {
        return defaultPlaceName;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    public static class Builder {
        private Duration totalBudget = DEFAULT_TOTAL_BUDGET;
        private Duration liveFixBudget = DEFAULT_LIVE_FIX_BUDGET;
        private Duration manualMaxAge = ManualLocationStore.DEFAULT_MAX_AGE;
        private GeoCoordinate defaultLocation = SCOTLAND_CENTROID;
        private String defaultPlaceName;

        public Builder totalBudget(Duration totalBudget) {
            this.totalBudget = totalBudget;
            return this;
        }

        public Builder liveFixBudget(Duration liveFixBudget) {
            this.liveFixBudget = liveFixBudget;
            return this;
        }

        public Builder manualMaxAge(Duration manualMaxAge) {
            this.manualMaxAge = manualMaxAge;
            return this;
        }

        public Builder defaultLocation(GeoCoordinate defaultLocation) {
            this.defaultLocation = defaultLocation;
            return this;
        }

        public Builder defaultPlaceName(String defaultPlaceName) {
            this.defaultPlaceName = defaultPlaceName;
            return this;
        }

        public LocationOptions build() {
            return new LocationOptions(this);
        }
    }
}
