package com.wildfire.resolution.orchestrator;

import com.wildfire.resolution.core.model.ResolutionStage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Telemetry that keeps every event in memory, in arrival order.
 * Intended for diagnostics and tests.
 */
public class RecordingTelemetry implements OrchestratorTelemetry {

    private final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onAttemptStart(ResolutionStage stage) {
        events.add(TelemetryEvent.attemptStart(stage));
    }

    @Override
    public void onAttemptEnd(ResolutionStage stage, Duration elapsed, boolean success) {
        events.add(TelemetryEvent.attemptEnd(stage, elapsed, success));
    }

    @Override
    public void onFallbackDepth(int depth) {
        events.add(TelemetryEvent.fallbackDepth(depth));
    }

    @Override
    public void onComplete(ResolutionStage chosenStage, Duration totalElapsed) {
        events.add(TelemetryEvent.complete(chosenStage, totalElapsed));
    }

    public List<TelemetryEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Stages in the order they were attempted.
     */
    public List<ResolutionStage> attemptedStages() {
        return events.stream()
                .filter(e -> e.type() == TelemetryEvent.Type.ATTEMPT_START)
                .map(TelemetryEvent::stage)
                .toList();
    }

    public Optional<ResolutionStage> completedStage() {
        return events.stream()
                .filter(e -> e.type() == TelemetryEvent.Type.COMPLETE)
                .map(TelemetryEvent::stage)
                .reduce((first, second) -> second);
    }

    public void clear() {
        events.clear();
    }
}
