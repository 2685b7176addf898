package com.wildfire.resolution.orchestrator;

import com.wildfire.resolution.core.model.ResolutionStage;

import java.time.Duration;

/**
 * Observer of the fallback chain. Callbacks arrive in attempt order on the calling thread:
 * for each attempted stage {@code onFallbackDepth}, {@code onAttemptStart}, {@code onAttemptEnd};
 * then exactly one {@code onComplete} naming the stage that produced the result.
 *
 * <p>Implementations must not throw and should return quickly.</p>
 */
public interface OrchestratorTelemetry {

    void onAttemptStart(ResolutionStage stage);

    void onAttemptEnd(ResolutionStage stage, Duration elapsed, boolean success);

    /**
     * @param depth number of stages attempted before the one about to start
     */
    void onFallbackDepth(int depth);

    void onComplete(ResolutionStage chosenStage, Duration totalElapsed);
}
