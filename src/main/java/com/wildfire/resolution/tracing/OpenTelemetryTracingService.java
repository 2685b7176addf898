package com.wildfire.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 *
 * <p>OpenTelemetry has no degraded status: a {@link Span.SpanStatus#DEGRADED} resolution ends OK
 * with {@link SpanNames#ATTR_DEGRADED} set to {@code true}.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new ResolutionSpan(builder.startSpan());
    }

    private static final class ResolutionSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        ResolutionSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            if (status == SpanStatus.ERROR) {
                delegate.setStatus(StatusCode.ERROR);
                return;
            }
            if (status == SpanStatus.DEGRADED) {
                delegate.setAttribute(SpanNames.ATTR_DEGRADED, true);
            }
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
