package com.crewrunner.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs emitted while a crew runs or settles carry its correlation IDs.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forExecution(executionId)) {
 *     log.info("Crew completed"); // Automatically includes executionId, traceId
 * }
 * </pre>
 *
 * Contexts nest: closing one restores whatever values the enclosing context had,
 * so settlement logging inside a worker does not wipe the worker's own context.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKER = "worker";
    public static final String TRACE_ID = "traceId";

    // Values present before this context was opened; null means absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for an execution.
     */
    public static LoggingContext forExecution(String executionId) {
        return forExecution(executionId, null);
    }

    /**
     * Create a logging context for an execution running on a named worker thread.
     */
    public static LoggingContext forExecution(String executionId, String worker) {
        return forExecution(executionId, worker, null);
    }

    /**
     * Create a logging context that continues the given trace. A null trace id
     * keeps the current one, or starts a new one when none is set.
     */
    public static LoggingContext forExecution(String executionId, String worker, String traceId) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            ctx.put(EXECUTION_ID, executionId);
        }
        if (worker != null) {
            ctx.put(WORKER, worker);
        }
        if (traceId != null) {
            ctx.put(TRACE_ID, traceId);
        } else if (MDC.get(TRACE_ID) == null) {
            ctx.put(TRACE_ID, newTraceId());
        }
        return ctx;
    }

    /**
     * The calling thread's trace id, or a fresh one when it has none.
     */
    public static String currentOrNewTraceId() {
        String current = MDC.get(TRACE_ID);
        return current != null ? current : newTraceId();
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Get current execution ID from context.
     */
    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        previous.putIfAbsent(key, MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
