package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.RiskLevel;

import java.time.Instant;
import java.util.Objects;

/**
 * A reading as returned by a source adapter, before it is attributed to a stage.
 *
 * @param indexValue fire weather index, non-negative
 * @param observedAt when the upstream produced the reading
 * @param level      level reported by the upstream, or {@code null} to derive it from the index
 */
public record RawIndexReading(double indexValue, Instant observedAt, RiskLevel level) {

    public RawIndexReading {
        if (!Double.isFinite(indexValue) || indexValue < 0.0) {
            throw new IllegalArgumentException("indexValue must be a non-negative number: " + indexValue);
        }
        Objects.requireNonNull(observedAt, "observedAt is required");
    }

    public RawIndexReading(double indexValue, Instant observedAt) {
        this(indexValue, observedAt, null);
    }

    public RiskLevel resolvedLevel() {
        return level != null ? level : RiskLevel.fromIndex(indexValue);
    }
}
