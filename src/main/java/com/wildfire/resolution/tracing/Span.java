package com.wildfire.resolution.tracing;

import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolutionStage;

import java.util.Locale;

/**
 * One risk or location resolution. Ended by {@link #close()}.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void addEvent(String name);

    void setStatus(SpanStatus status);

    /**
     * Emits {@code stage.<stage>.success} or {@code stage.<stage>.failure}.
     */
    default void stageOutcome(ResolutionStage stage, boolean success) {
        addEvent("stage." + stage.name().toLowerCase(Locale.ROOT) + (success ? ".success" : ".failure"));
    }

    /**
     * Emits {@code tier.<source>.success} for the location tier that answered.
     */
    default void tierResolved(LocationSource source) {
        addEvent("tier." + source.name().toLowerCase(Locale.ROOT) + ".success");
    }

    @Override
    void close();

    /**
     * {@code DEGRADED} marks an answer served from the cache, synthetic data or the default location.
     */
    enum SpanStatus { OK, DEGRADED, ERROR }
}
