package com.team.identity.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forResolution should set correlationId, source, context and operation")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "Inter", "Serie A")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("Inter", MDC.get("sourceName"));
            assertEquals("Serie A", MDC.get("context"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("A missing context should be logged as empty")
    void nullContext() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "Inter", null)) {
            assertEquals("", MDC.get("context"));
        }
    }

    @Test
    @DisplayName("forVerification should record the decision")
    void forVerificationSetsMDC() {
        try (LogContext ctx = LogContext.forVerification("Spurs", "Tottenham", false)) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("Tottenham", MDC.get("matchedName"));
            assertEquals("rejected", MDC.get("decision"));
            assertEquals("verify", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forReport should record the window")
    void forReportSetsMDC() {
        try (LogContext ctx = LogContext.forReport(30).with("format", "json")) {
            assertEquals("30", MDC.get("windowDays"));
            assertEquals("json", MDC.get("format"));
            assertEquals("report", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Close should remove only its own keys")
    void closeRemovesOwnKeys() {
        MDC.put("requestId", "outer");
        LogContext ctx = LogContext.forResolution("corr-123", "Inter", null);

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("sourceName"));
        assertEquals("outer", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Generated correlation ids should be unique")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
