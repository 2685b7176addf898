package com.wildfire.resolution.orchestrator;

import com.wildfire.resolution.core.model.ResolutionStage;

import java.time.Duration;

/**
 * One recorded telemetry callback. Fields not relevant to the event type are {@code null}.
 *
 * @param type    which callback fired
 * @param stage   stage for attempt and completion events
 * @param elapsed attempt or total duration for end and completion events
 * @param success attempt outcome for end events
 * @param depth   fallback depth for depth events
 */
public record TelemetryEvent(Type type, ResolutionStage stage, Duration elapsed, Boolean success, Integer depth) {

    public enum Type { ATTEMPT_START, ATTEMPT_END, FALLBACK_DEPTH, COMPLETE }

    public static TelemetryEvent attemptStart(ResolutionStage stage) {
        return new TelemetryEvent(Type.ATTEMPT_START, stage, null, null, null);
    }

    public static TelemetryEvent attemptEnd(ResolutionStage stage, Duration elapsed, boolean success) {
        return new TelemetryEvent(Type.ATTEMPT_END, stage, elapsed, success, null);
    }

    public static TelemetryEvent fallbackDepth(int depth) {
        return new TelemetryEvent(Type.FALLBACK_DEPTH, null, null, null, depth);
    }

    public static TelemetryEvent complete(ResolutionStage stage, Duration totalElapsed) {
        return new TelemetryEvent(Type.COMPLETE, stage, totalElapsed, null, null);
    }
}
