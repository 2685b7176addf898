package com.wildfire.resolution.metrics;

import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolutionStage;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.error.ErrorCategory;

import java.time.Duration;

/**
 * Interface for recording resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordStageAttempt(ResolutionStage stage, boolean success, Duration elapsed);

    void recordRiskResolution(RiskSource source, Duration duration);

    void recordLocationResolution(LocationSource source, Duration duration);

    void incrementLocationFailure();

    void incrementFetchRetry();

    /**
     * Records a terminal fetch failure by category.
     */
    void incrementFetchFailure(ErrorCategory category);

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheEviction();
}
