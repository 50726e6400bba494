package com.team.identity.tracing;

import java.util.Map;

/**
 * No-op implementation of {@link TracingService}; every span it hands out is shared and inert.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startSpan(String operationName) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void markFailed(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
