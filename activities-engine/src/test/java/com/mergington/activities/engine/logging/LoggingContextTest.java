package com.mergington.activities.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    void forActivity_shouldPopulateAndCleanUpMdc() {
        try (var ctx = LoggingContext.forActivity("Chess Club", "test@student.edu")) {
            assertEquals("Chess Club", MDC.get(LoggingContext.ACTIVITY));
            assertEquals("test@student.edu", MDC.get(LoggingContext.PARTICIPANT));
            assertNotNull(LoggingContext.getTraceId());
        }

        assertNull(MDC.get(LoggingContext.ACTIVITY));
        assertNull(MDC.get(LoggingContext.PARTICIPANT));
        assertNotNull(LoggingContext.getTraceId()); // request-scoped
    }

    @Test
    void forActivity_shouldReuseExistingTrace() {
        String traceId = LoggingContext.startTrace();

        try (var ctx = LoggingContext.forActivity("Chess Club")) {
            assertEquals(traceId, LoggingContext.getTraceId());
        }
    }

    @Test
    void clearAll_shouldDropTrace() {
        LoggingContext.startTrace();

        LoggingContext.clearAll();

        assertNull(LoggingContext.getTraceId());
    }
}
