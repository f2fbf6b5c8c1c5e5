package com.product.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("run.completed runId={} goldenRecords={}", runId, count);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: worker threads open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a full resolution run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for scoring one blocking bucket on a worker thread.
     */
    public static LogContext forBucket(String runId, String bucketKey) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("bucketKey", bucketKey);
        ctx.put("operation", "score");
        return ctx;
    }

    /**
     * Creates a log context for an on-demand comparison query.
     */
    public static LogContext forComparison(String idA, String idB) {
        LogContext ctx = new LogContext();
        ctx.put("recordA", idA);
        ctx.put("recordB", idB);
        ctx.put("operation", "compare");
        return ctx;
    }

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
