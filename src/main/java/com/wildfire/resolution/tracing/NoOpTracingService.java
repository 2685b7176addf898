package com.wildfire.resolution.tracing;

import java.util.Map;

/**
 * Default {@link TracingService}. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final Span INERT = new Span() {
        @Override
        public void setAttribute(String key, String value) {
            // inert
        }

        @Override
        public void addEvent(String name) {
            // inert
        }

        @Override
        public void setStatus(SpanStatus status) {
            // inert
        }

        @Override
        public void close() {
            // inert
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return INERT;
    }
}
