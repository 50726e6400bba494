package com.team.identity.tracing;

import java.util.Map;

/**
 * Tracing seam. {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
