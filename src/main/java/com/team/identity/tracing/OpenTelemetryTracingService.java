package com.team.identity.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void markFailed(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
