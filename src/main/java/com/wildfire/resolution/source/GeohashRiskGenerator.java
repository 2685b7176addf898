package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.geo.Geohash;

import java.time.Clock;
import java.util.Objects;

class GeohashRiskGenerator implements SyntheticRiskGenerator {

    private static final RiskLevel[] LEVELS = RiskLevel.values();

    private final Clock clock;

    GeohashRiskGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public RiskObservation generate(GeoCoordinate coordinate) {
        String cell = Geohash.encode(coordinate.latitude(), coordinate.longitude());
        return RiskObservation.synthetic(levelFor(cell), clock.instant());
    }

    static RiskLevel levelFor(String geohash) {
        return LEVELS[Math.floorMod(geohash.hashCode(), LEVELS.length)];
    }
}
