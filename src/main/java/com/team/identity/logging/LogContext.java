package com.team.identity.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "Man Utd", "Premier League")) {
 *     log.info("team.resolved strategy={}", strategy);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, String sourceName, String context) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceName", sourceName);
        ctx.put("context", context != null ? context : "");
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forVerification(String sourceName, String matchedName, boolean accepted) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("sourceName", sourceName);
        ctx.put("matchedName", matchedName);
        ctx.put("decision", accepted ? "accepted" : "rejected");
        ctx.put("operation", "verify");
        return ctx;
    }

    public static LogContext forReport(int windowDays) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("windowDays", Integer.toString(windowDays));
        ctx.put("operation", "report");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds one more entry to this context.
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
