package com.scheduler.lifecycle.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMaintenance(runId)) {
 *     log.info("maintenance.completed archived={}", archived);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMaintenance(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "maintenance");
        return ctx;
    }

    /**
     * Scope for one entity kind, nested inside a maintenance scope.
     *
     * @param phase {@code archive} or {@code purge}
     */
    public static LogContext forArchival(String entityKind, String phase) {
        LogContext ctx = new LogContext();
        ctx.put("entityKind", entityKind);
        ctx.put("phase", phase);
        return ctx;
    }

    public static LogContext forOrchestration(String requestId) {
        LogContext ctx = new LogContext();
        ctx.put("requestId", requestId);
        ctx.put("operation", "orchestration");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

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
