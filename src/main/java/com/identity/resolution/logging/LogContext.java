package com.identity.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("run.committed runId={} entities={}", runId, count);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: worker tasks open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forBlock(String runId, String blockKey) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("blockKey", blockKey);
        ctx.put("operation", "score-block");
        return ctx;
    }

    public static LogContext forReview(String reviewId, String reviewerId) {
        LogContext ctx = new LogContext();
        ctx.put("reviewId", reviewId);
        ctx.put("reviewerId", reviewerId);
        ctx.put("operation", "review");
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Removes the keys this context added, restoring any value an enclosing context had set.
     */
    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
