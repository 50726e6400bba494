package com.team.identity.tracing;

/**
 * A unit of work in a trace, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("team.resolve")) {
 *     span.setAttribute("team.strategy", "exact_match");
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, double value);

    void setAttribute(String key, boolean value);

    /**
     * Marks the span as failed and attaches the cause.
     */
    void markFailed(Throwable cause);

    @Override
    void close();
}
