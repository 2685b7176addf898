package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;

import java.time.Clock;

/**
 * Last-resort producer of a risk observation when no live or cached data is available.
 * Generated observations always carry source and freshness {@code SYNTHETIC} and no index value.
 */
public interface SyntheticRiskGenerator {

    RiskObservation generate(GeoCoordinate coordinate);

    /**
     * Always returns the same level.
     */
    static SyntheticRiskGenerator fixed(RiskLevel level, Clock clock) {
        return new FixedRiskGenerator(level, clock);
    }

    /**
     * Returns a fixed {@link RiskLevel#MODERATE} observation.
     */
    static SyntheticRiskGenerator moderate(Clock clock) {
        return new FixedRiskGenerator(RiskLevel.MODERATE, clock);
    }

    /**
     * Derives a stable level from the coordinate's geohash cell, so nearby requests agree.
     */
    static SyntheticRiskGenerator geohashDeterministic(Clock clock) {
        return new GeohashRiskGenerator(clock);
    }
}
