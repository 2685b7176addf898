package com.wildfire.resolution.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildfire.resolution.core.model.RiskLevel;
import com.wildfire.resolution.fetch.ResponseParseException;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses a flat JSON reading:
 * <pre>
 * {"fwi": 14.2, "observedAt": "2024-07-01T12:00:00Z", "level": "moderate"}
 * </pre>
 * {@code fwi} (alias {@code indexValue}) is required. A missing timestamp defaults to now,
 * a missing or unknown level is derived from the index.
 */
public class JsonReadingParser implements ReadingParser {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReadingParser() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public JsonReadingParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public RawIndexReading parse(String body) throws ResponseParseException {
        if (body == null || body.isBlank()) {
            throw new ResponseParseException("Empty response body");
        }
        ReadingPayload payload;
        try {
            payload = objectMapper.readValue(body, ReadingPayload.class);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Malformed reading: " + e.getOriginalMessage(), e);
        }
        if (payload == null || payload.fwi() == null) {
            throw new ResponseParseException("Reading has no index value");
        }
        if (!Double.isFinite(payload.fwi()) || payload.fwi() < 0.0) {
            throw new ResponseParseException("Index value out of range: " + payload.fwi());
        }
        return new RawIndexReading(payload.fwi(), parseTimestamp(payload.observedAt()), parseLevel(payload.level()));
    }

    private Instant parseTimestamp(String raw) throws ResponseParseException {
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ResponseParseException("Invalid observedAt: " + raw, e);
        }
    }

    private static RiskLevel parseLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (RiskLevel level : RiskLevel.values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReadingPayload(
            @JsonAlias("indexValue") Double fwi,
            @JsonAlias("timestamp") String observedAt,
            String level
    ) {}
}
