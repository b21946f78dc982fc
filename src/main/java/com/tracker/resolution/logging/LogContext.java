package com.tracker.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMining("4", "Bug")) {
 *     log.info("mining.tracker issues={} transitions={}", issues, transitions);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a name lookup.
     */
    public static LogContext forResolution(String entityKind, String query) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("entityKind", entityKind);
        ctx.put("query", query);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for mining one tracker's history.
     */
    public static LogContext forMining(String trackerId, String trackerName) {
        LogContext ctx = new LogContext();
        ctx.put("trackerId", trackerId);
        ctx.put("trackerName", trackerName);
        ctx.put("operation", "mine");
        return ctx;
    }

    /**
     * Creates a log context for validating an issue change.
     */
    public static LogContext forValidation(String projectId, String trackerId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("projectId", projectId);
        ctx.put("trackerId", trackerId);
        ctx.put("operation", "validate");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
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
