package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;

import java.time.Clock;
import java.util.Objects;

class FixedRiskGenerator implements SyntheticRiskGenerator {

    private final RiskLevel level;
    private final Clock clock;

    FixedRiskGenerator(RiskLevel level, Clock clock) {
        this.level = Objects.requireNonNull(level, "level is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public RiskObservation generate(GeoCoordinate coordinate) {
        return RiskObservation.synthetic(level, clock.instant());
    }
}
