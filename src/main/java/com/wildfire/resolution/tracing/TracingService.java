package com.wildfire.resolution.tracing;

import java.util.Map;

/**
 * Tracing integration point. {@link NoOpTracingService} is the default, so the library
 * runs without any tracing backend on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
