package com.wildfire.resolution.fetch;

import com.wildfire.resolution.core.DaemonThreads;
import com.wildfire.resolution.error.ErrorCategory;
import com.wildfire.resolution.error.ErrorKind;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.error.ServiceError;
import com.wildfire.resolution.metrics.MetricsService;
import com.wildfire.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;

/**
 * Runs a network operation with per-attempt timeouts and exponential backoff.
 *
 * <p>Failure classification:</p>
 * <ul>
 *   <li>4xx and other non-5xx statuses: terminal, category from {@link ErrorCategory#fromStatus(int)}</li>
 *   <li>5xx: retried; exhaustion yields {@code SERVICE_UNAVAILABLE} with the last status</li>
 *   <li>{@link IOException} or attempt timeout: retried; exhaustion yields {@code NETWORK}</li>
 *   <li>{@link ResponseParseException}: terminal {@code PARSE}</li>
 *   <li>anything else: terminal {@code GENERAL}</li>
 * </ul>
 *
 * <p>Thread-safe; a single instance is shared by all sources. Close it to release the attempt pool.</p>
 */
public class ResilientFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientFetcher.class);

    private final RetryConfig config;
    private final MetricsService metrics;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final ExecutorService executor;

    public ResilientFetcher() {
        this(RetryConfig.defaults(), new NoOpMetricsService());
    }

    public ResilientFetcher(RetryConfig config, MetricsService metrics) {
        this(config, metrics, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ResilientFetcher(RetryConfig config, MetricsService metrics, Sleeper sleeper, DoubleSupplier random) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.random = Objects.requireNonNull(random, "random is required");
        this.executor = DaemonThreads.newCachedPool("wildfire-fetch");
    }

    /**
     * Fetches with the configured default retry count.
     */
    public <T> Result<T> fetch(FetchOperation<T> operation, Duration timeout) {
        return fetch(operation, config.maxRetries(), timeout);
    }

    /**
     * Runs {@code operation} up to {@code 1 + maxRetries} times.
     *
     * @param operation  the attempt to run
     * @param maxRetries retries after the first attempt, must be 0..10
     * @param timeout    per-attempt timeout, must be positive
     * @return the first successful value, or the classified failure
     */
    public <T> Result<T> fetch(FetchOperation<T> operation, int maxRetries, Duration timeout) {
        if (operation == null) {
            return Result.failure(ServiceError.validation("operation is required"));
        }
        if (maxRetries < 0 || maxRetries > RetryConfig.MAX_RETRIES_LIMIT) {
            return Result.failure(ServiceError.validation(
                    "maxRetries must be between 0 and " + RetryConfig.MAX_RETRIES_LIMIT + ": " + maxRetries));
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return Result.failure(ServiceError.validation("timeout must be positive"));
        }

        int totalAttempts = maxRetries + 1;
        ServiceError lastError = null;
        for (int attempt = 1; attempt <= totalAttempts; attempt++) {
            Outcome<T> outcome = attempt(operation, timeout);
            if (outcome.error == null) {
                if (attempt > 1) {
                    log.debug("Fetch succeeded on attempt {}/{}", attempt, totalAttempts);
                }
                return Result.success(outcome.value);
            }
            lastError = outcome.error;
            if (!outcome.retryable) {
                log.debug("Fetch failed terminally on attempt {}/{}: {}", attempt, totalAttempts, lastError);
                metrics.incrementFetchFailure(lastError.category());
                return Result.failure(lastError);
            }
            if (attempt < totalAttempts) {
                Duration delay = config.delayFor(attempt - 1, random.getAsDouble());
                log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, totalAttempts, lastError.message(), delay.toMillis());
                metrics.incrementFetchRetry();
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ServiceError interrupted = ServiceError.general("Interrupted while waiting to retry");
                    metrics.incrementFetchFailure(interrupted.category());
                    return Result.failure(interrupted);
                }
            }
        }

        ServiceError exhausted = exhausted(lastError, totalAttempts);
        log.warn("Fetch gave up after {} attempts: {}", totalAttempts, exhausted);
        metrics.incrementFetchFailure(exhausted.category());
        return Result.failure(exhausted);
    }

    public int defaultMaxRetries() {
        return config.maxRetries();
    }

    @Override
    public void close() {
        DaemonThreads.shutdown(executor);
    }

    private <T> Outcome<T> attempt(FetchOperation<T> operation, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(operation::execute);
        } catch (RuntimeException e) {
            return Outcome.terminal(ServiceError.general("Fetch could not be scheduled: " + e.getMessage()));
        }
        try {
            return Outcome.success(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Outcome.retryable(new ServiceError(ErrorCategory.NETWORK,
                    "Attempt timed out after " + timeout.toMillis() + "ms", null, ErrorKind.TIMEOUT));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.terminal(ServiceError.general("Interrupted while fetching"));
        } catch (ExecutionException e) {
            return classify(e.getCause() != null ? e.getCause() : e);
        }
    }

    private static <T> Outcome<T> classify(Throwable failure) {
        if (failure instanceof HttpStatusException statusFailure) {
            int status = statusFailure.getStatusCode();
            ServiceError error = ServiceError.fromStatus(status, describe(failure, "HTTP " + status));
            return statusFailure.isServerError() ? Outcome.retryable(error) : Outcome.terminal(error);
        }
        if (failure instanceof ResponseParseException) {
            return Outcome.terminal(ServiceError.parse(describe(failure, "Response could not be parsed")));
        }
        if (failure instanceof IOException) {
            ErrorKind kind = failure instanceof HttpTimeoutException
                    ? ErrorKind.TIMEOUT : ErrorKind.UNSPECIFIED;
            return Outcome.retryable(new ServiceError(ErrorCategory.NETWORK,
                    describe(failure, "Network failure"), null, kind));
        }
        if (failure instanceof TimeoutException) {
            return Outcome.retryable(new ServiceError(ErrorCategory.NETWORK,
                    describe(failure, "Operation timed out"), null, ErrorKind.TIMEOUT));
        }
        log.debug("Unexpected fetch failure", failure);
        return Outcome.terminal(ServiceError.general(describe(failure, failure.getClass().getSimpleName())));
    }

    private static ServiceError exhausted(ServiceError lastError, int attempts) {
        String message = "Retries exhausted after " + attempts + " attempts: " + lastError.message();
        if (lastError.statusCode() != null) {
            return new ServiceError(ErrorCategory.SERVICE_UNAVAILABLE, message, lastError.statusCode(),
                    ErrorKind.UNSPECIFIED);
        }
        return new ServiceError(ErrorCategory.NETWORK, message, null, lastError.kind());
    }

    private static String describe(Throwable failure, String fallback) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? fallback : message;
    }

    private static final class Outcome<T> {
        final T value;
        final ServiceError error;
        final boolean retryable;

        private Outcome(T value, ServiceError error, boolean retryable) {
            this.value = value;
            this.error = error;
            this.retryable = retryable;
        }

        static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null, false);
        }

        static <T> Outcome<T> retryable(ServiceError error) {
            return new Outcome<>(null, error, true);
        }

        static <T> Outcome<T> terminal(ServiceError error) {
            return new Outcome<>(null, error, false);
        }
    }
}
