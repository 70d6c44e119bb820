package com.compound.enrichment.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, restores whatever those keys held before.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forItem(itemKey, index)) {
 *     log.info("item.resolved tier={} source={}", tier, sourceId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context spanning a whole batch run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for the processing of one work item.
     */
    public static LogContext forItem(String itemKey, long index) {
        LogContext ctx = new LogContext();
        ctx.put("itemKey", itemKey);
        ctx.put("itemIndex", Long.toString(index));
        ctx.put("operation", "item");
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
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
        previous.clear();
    }
}
