package com.wildfire.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Entries are added to the SLF4J MDC on creation and removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRiskResolution(correlationId, CoordinateRedactor.redact(coordinate))) {
 *     log.info("risk.resolved source={}", observation.getSource());
 * }
 * </pre>
 *
 * Coordinates placed in the MDC must already be redacted.
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRiskResolution(String correlationId, String redactedLocation) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("location", redactedLocation);
        ctx.put(OPERATION, "resolveRisk");
        return ctx;
    }

    public static LogContext forLocationResolution(String correlationId, boolean allowDefault) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("allowDefault", Boolean.toString(allowDefault));
        ctx.put(OPERATION, "resolveLocation");
        return ctx;
    }

    public static LogContext forCacheMaintenance(String task) {
        LogContext ctx = new LogContext();
        ctx.put("cacheTask", task);
        ctx.put(OPERATION, "cacheMaintenance");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds a key-value pair to this context; removed again on {@link #close()}.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
