package com.wildfire.resolution.orchestrator;

import com.wildfire.resolution.core.model.ResolutionStage;

import java.time.Duration;

/**
 * Telemetry that discards every event.
 */
public class NoOpTelemetry implements OrchestratorTelemetry {

    public static final NoOpTelemetry INSTANCE = new NoOpTelemetry();

    @Override
    public void onAttemptStart(ResolutionStage stage) {
    }

    @Override
    public void onAttemptEnd(ResolutionStage stage, Duration elapsed, boolean success) {
    }

    @Override
    public void onFallbackDepth(int depth) {
    }

    @Override
    public void onComplete(ResolutionStage chosenStage, Duration totalElapsed) {
    }
}
