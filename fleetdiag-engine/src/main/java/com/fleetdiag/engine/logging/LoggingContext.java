package com.fleetdiag.engine.logging;

import com.fleetdiag.core.model.ToolKind;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures logs from the control loop and from collection tasks carry the session and
 * instance they act for.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forSession(sessionId, tool)) {
 *     log.info("Starting collection"); // includes sessionId, tool
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String SESSION_ID = "sessionId";
    public static final String INSTANCE_ID = "instanceId";
    public static final String TOOL = "tool";
    public static final String LOCK_RESOURCE = "lockResource";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Context for one control-loop tick on an instance.
     */
    public static LoggingContext forInstance(String instanceId) {
        put(INSTANCE_ID, instanceId);
        ensureTraceId();
        return new LoggingContext(INSTANCE_ID);
    }

    /**
     * Context for handling one session.
     */
    public static LoggingContext forSession(String sessionId, ToolKind tool) {
        put(SESSION_ID, sessionId);
        put(TOOL, tool != null ? tool.name() : null);
        ensureTraceId();
        return new LoggingContext(SESSION_ID, TOOL);
    }

    /**
     * Context for a collection task running off the control loop.
     */
    public static LoggingContext forCollection(String sessionId, String instanceId, ToolKind tool) {
        put(SESSION_ID, sessionId);
        put(INSTANCE_ID, instanceId);
        put(TOOL, tool != null ? tool.name() : null);
        ensureTraceId();
        return new LoggingContext(SESSION_ID, INSTANCE_ID, TOOL);
    }

    /**
     * Context for a lock operation.
     */
    public static LoggingContext forLock(String resource, String operation) {
        put(LOCK_RESOURCE, resource);
        put(OPERATION, operation);
        return new LoggingContext(LOCK_RESOURCE, OPERATION);
    }

    public static String getSessionId() {
        return MDC.get(SESSION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        // Keep TRACE_ID until the thread's unit of work ends
    }

    /**
     * Clear all MDC context. Call at the end of a tick or collection task.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
