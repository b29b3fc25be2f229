package com.mergington.activities.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forActivity(activityName, email)) {
 *     log.info("Signed up"); // Includes activity, participant and traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String ACTIVITY = "activity";
    public static final String PARTICIPANT = "participant";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for operations on a single activity.
     */
    public static LoggingContext forActivity(String activityName) {
        return forActivity(activityName, null);
    }

    /**
     * Create a logging context for a participant's operation on an activity.
     */
    public static LoggingContext forActivity(String activityName, String email) {
        LoggingContext ctx = new LoggingContext();
        if (activityName != null) {
            MDC.put(ACTIVITY, activityName);
        }
        if (email != null) {
            MDC.put(PARTICIPANT, email);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Start a fresh trace for an incoming request.
     */
    public static String startTrace() {
        String traceId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(TRACE_ID, traceId);
        return traceId;
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            startTrace();
        }
    }

    @Override
    public void close() {
        MDC.remove(ACTIVITY);
        MDC.remove(PARTICIPANT);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
