package com.wildfire.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Wildfire risk at a point in time, attributed to the stage that produced it.
 *
 * <p>Instances are immutable. The only supported override is {@link #withFreshness(Freshness)},
 * used by the cache layer to mark stored observations as {@link Freshness#CACHED} on read.</p>
 */
public final class RiskObservation {

    private final RiskLevel level;
    private final Double indexValue;
    private final RiskSource source;
    private final Freshness freshness;
    private final Instant observedAt;

    private RiskObservation(Builder builder) {
        this.level = Objects.requireNonNull(builder.level, "level is required");
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.freshness = Objects.requireNonNull(builder.freshness, "freshness is required");
        this.observedAt = Objects.requireNonNull(builder.observedAt, "observedAt is required");
        if (builder.indexValue != null
                && (!Double.isFinite(builder.indexValue) || builder.indexValue < 0.0)) {
            throw new IllegalArgumentException("indexValue must be a non-negative number: " + builder.indexValue);
        }
        if (builder.source == RiskSource.SYNTHETIC && builder.indexValue != null) {
            throw new IllegalArgumentException("Synthetic observations never carry an index value");
        }
        this.indexValue = builder.indexValue;
    }

    /**
     * Creates a live observation from an upstream provider.
     */
    public static RiskObservation live(RiskSource source, RiskLevel level, Double indexValue, Instant observedAt) {
        return builder()
                .source(source)
                .level(level)
                .indexValue(indexValue)
                .freshness(Freshness.LIVE)
                .observedAt(observedAt)
                .build();
    }

    /**
     * Creates a synthetic observation. Synthetic observations have no index value.
     */
    public static RiskObservation synthetic(RiskLevel level, Instant observedAt) {
        return builder()
                .source(RiskSource.SYNTHETIC)
                .level(level)
                .freshness(Freshness.SYNTHETIC)
                .observedAt(observedAt)
                .build();
    }

    public RiskLevel getLevel() {
        return level;
    }

    public OptionalDouble getIndexValue() {
        return indexValue != null ? OptionalDouble.of(indexValue) : OptionalDouble.empty();
    }

    public RiskSource getSource() {
        return source;
    }

    public Freshness getFreshness() {
        return freshness;
    }

    /**
     * When the data was observed upstream, always UTC.
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    /**
     * Returns a copy with a different freshness and every other field unchanged.
     */
    public RiskObservation withFreshness(Freshness newFreshness) {
        return toBuilder().freshness(newFreshness).build();
    }

    public Builder toBuilder() {
        return builder()
                .level(level)
                .indexValue(indexValue)
                .source(source)
                .freshness(freshness)
                .observedAt(observedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RiskObservation that = (RiskObservation) o;
        return level == that.level
                && Objects.equals(indexValue, that.indexValue)
                && source == that.source
                && freshness == that.freshness
                && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, indexValue, source, freshness, observedAt);
    }

    @Override
    public String toString() {
        return "RiskObservation{" +
                "level=" + level +
                ", indexValue=" + indexValue +
                ", source=" + source +
                ", freshness=" + freshness +
                ", observedAt=" + observedAt +
                '}';
    }

    public static class Builder {
        private RiskLevel level;
        private Double indexValue;
        private RiskSource source;
        private Freshness freshness;
        private Instant observedAt;

        public Builder level(RiskLevel level) {
            this.level = level;
            return this;
        }

        public Builder indexValue(Double indexValue) {
            this.indexValue = indexValue;
            return this;
        }

        public Builder source(RiskSource source) {
            this.source = source;
            return this;
        }

        public Builder freshness(Freshness freshness) {
            this.freshness = freshness;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public RiskObservation build() {
            return new RiskObservation(this);
        }
    }
}
