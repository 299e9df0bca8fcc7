package com.market.linking.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("run.started left={} right={}", leftCount, rightCount);
 * } // MDC entries are cleared here
 * </pre>
 *
 * <p>MDC is thread-local: worker threads open their own contexts.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one matching run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for work on a single record.
     */
    public static LogContext forRecord(String runId, String catalog, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("catalog", catalog);
        ctx.put("sourceId", sourceId);
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
