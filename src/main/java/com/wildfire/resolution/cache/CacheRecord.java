package com.wildfire.resolution.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wildfire.resolution.core.model.Freshness;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.core.model.RiskObservation;
import com.wildfire.resolution.core.model.RiskSource;

import java.time.Instant;

/**
 * Persisted form of a cached observation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CacheRecord(
        @JsonProperty("version") String formatVersion,
        @JsonProperty("timestamp") long storedAtMillis,
        @JsonProperty("geohash") String geohash,
        @JsonProperty("data") Payload payload
) {

    static final String FORMAT_VERSION = "1.0";

    static CacheRecord of(String geohash, RiskObservation observation, Instant storedAt) {
        return new CacheRecord(FORMAT_VERSION, storedAt.toEpochMilli(), geohash, Payload.from(observation));
    }

    Instant storedAt() {
        return Instant.ofEpochMilli(storedAtMillis);
    }

    /**
     * @throws IllegalArgumentException if the payload does not describe a valid observation
     */
    RiskObservation toObservation() {
        if (payload == null) {
            throw new IllegalArgumentException("Record has no payload");
        }
        return payload.toObservation();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Payload(
            @JsonProperty("level") String level,
            @JsonProperty("indexValue") Double indexValue,
            @JsonProperty("source") String source,
            @JsonProperty("freshness") String freshness,
            @JsonProperty("observedAt") long observedAtMillis
    ) {

        static Payload from(RiskObservation observation) {
            return new Payload(
                    observation.getLevel().name(),
                    observation.getIndexValue().isPresent() ? observation.getIndexValue().getAsDouble() : null,
                    observation.getSource().name(),
                    observation.getFreshness().name(),
                    observation.getObservedAt().toEpochMilli());
        }

        RiskObservation toObservation() {
            if (level == null || source == null || freshness == null) {
                throw new IllegalArgumentException("Payload is missing required fields");
            }
            return RiskObservation.builder()
                    .level(RiskLevel.valueOf(level))
                    .indexValue(indexValue)
                    .source(RiskSource.valueOf(source))
                    .freshness(Freshness.valueOf(freshness))
                    .observedAt(Instant.ofEpochMilli(observedAtMillis))
                    .build();
        }
    }
}
