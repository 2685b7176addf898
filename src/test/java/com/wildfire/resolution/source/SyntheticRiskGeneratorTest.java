package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.Freshness;
import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.geo.Geohash;
import com.wildfire.resolution.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyntheticRiskGenerator Tests")
class SyntheticRiskGeneratorTest {

    private final MutableClock clock = MutableClock.at("2024-07-01T12:00:00Z");

    @Test
    @DisplayName("moderate() should always produce MODERATE synthetic observations")
    void moderate() {
        RiskObservation obs = SyntheticRiskGenerator.moderate(clock).generate(GeoCoordinate.of(55.95, -3.19));

        assertEquals(RiskLevel.MODERATE, obs.getLevel());
        assertEquals(RiskSource.SYNTHETIC, obs.getSource());
        assertEquals(Freshness.SYNTHETIC, obs.getFreshness());
        assertTrue(obs.getIndexValue().isEmpty());
        assertEquals(clock.instant(), obs.getObservedAt());
    }

    @Test
    @DisplayName("fixed() should use the configured level")
    void fixed() {
        RiskObservation obs = SyntheticRiskGenerator.fixed(RiskLevel.HIGH, clock).generate(GeoCoordinate.of(0, 0));

        assertEquals(RiskLevel.HIGH, obs.getLevel());
    }

    @Test
    @DisplayName("geohashDeterministic() should agree for coordinates in the same cell")
    void geohashDeterministic() {
        SyntheticRiskGenerator generator = SyntheticRiskGenerator.geohashDeterministic(clock);

        RiskObservation first = generator.generate(GeoCoordinate.of(55.9533, -3.1883));
        RiskObservation second = generator.generate(GeoCoordinate.of(55.9540, -3.1890));

        assertEquals(first.getLevel(), second.getLevel());
        assertEquals(GeohashRiskGenerator.levelFor(Geohash.encode(55.9533, -3.1883)), first.getLevel());
        assertEquals(RiskSource.SYNTHETIC, first.getSource());
        assertTrue(first.getIndexValue().isEmpty());
    }
}
