package com.trust.network.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSelection(runId, "SENTINEL", "EXACT")) {
 *     log.info("sentinel.selected count={} coverage={}", count, coverage);
 * }
 * </pre>
 *
 * <p>MDC is per thread: selectors running on worker threads open their own context.
 * Closing a nested context restores the values it replaced.</p>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> replaced = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "optimize");
        return ctx;
    }

    /**
     * Creates a log context for one selection method.
     */
    public static LogContext forSelection(String runId, String problem, String method) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put("runId", runId);
        }
        ctx.put("problem", problem);
        ctx.put("method", method);
        ctx.put("operation", "select");
        return ctx;
    }

    /**
     * Creates a log context for artifact export.
     */
    public static LogContext forExport(String runId, String directory) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put("runId", runId);
        }
        ctx.put("exportDirectory", directory);
        ctx.put("operation", "export");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!replaced.containsKey(key)) {
            replaced.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : replaced.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        replaced.clear();
    }
}
