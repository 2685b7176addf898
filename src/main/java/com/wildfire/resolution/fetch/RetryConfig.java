package com.wildfire.resolution.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and backoff settings for the {@link ResilientFetcher}.
 *
 * @param maxRetries   default number of retries after the first attempt (0..10)
 * @param baseDelay    delay before the first retry; doubled for each subsequent retry
 * @param minDelay     lower clamp applied after jitter
 * @param maxDelay     upper clamp applied after jitter
 * @param jitterFactor total jitter width as a fraction of the delay (0 disables jitter)
 */
public record RetryConfig(int maxRetries, Duration baseDelay, Duration minDelay, Duration maxDelay,
                          double jitterFactor) {

    public static final int MAX_RETRIES_LIMIT = 10;

    public RetryConfig {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(minDelay, "minDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0");
        }
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must be >= 0");
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= minDelay");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0 || Double.isNaN(jitterFactor)) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    /**
     * Default configuration: 3 retries, 1s base delay, clamped to 100ms..30s, 25% jitter.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofMillis(100), Duration.ofSeconds(30), 0.25);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelay, minDelay, maxDelay, jitterFactor);
    }

    public RetryConfig withoutJitter() {
        return new RetryConfig(maxRetries, baseDelay, minDelay, maxDelay, 0.0);
    }

    /**
     * Computes the wait before retry {@code retryIndex} (0-based).
     *
     * @param retryIndex 0 for the wait after the first failed attempt
     * @param random     uniform sample in [0, 1); 0.5 yields the un-jittered delay
     */
    public Duration delayFor(int retryIndex, double random) {
        double exponential = baseDelay.toMillis() * Math.pow(2, retryIndex);
        double jittered = exponential * (1.0 + (random - 0.5) * jitterFactor);
        long clamped = (long) Math.max(minDelay.toMillis(), Math.min(maxDelay.toMillis(), jittered));
        return Duration.ofMillis(clamped);
    }
}
