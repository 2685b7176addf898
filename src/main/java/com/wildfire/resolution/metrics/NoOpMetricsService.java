package com.wildfire.resolution.metrics;

import com.wildfire.resolution.core.model.LocationSource;
import com.wildfire.resolution.core.model.ResolutionStage;
import com.wildfire.resolution.core.model.RiskSource;
import com.wildfire.resolution.error.ErrorCategory;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageAttempt(ResolutionStage stage, boolean success, Duration elapsed) {
    }

    @Override
    public void recordRiskResolution(RiskSource source, Duration duration) {
    }

    @Override
    public void recordLocationResolution(LocationSource source, Duration duration) {
    }

    @Override
    public void incrementLocationFailure() {
    }

    @Override
    public void incrementFetchRetry() {
    }

    @Override
    public void incrementFetchFailure(ErrorCategory category) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheEviction() {
    }
}
