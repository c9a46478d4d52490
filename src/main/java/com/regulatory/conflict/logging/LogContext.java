package com.regulatory.conflict.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(conflictId, "HIERARCHICAL")) {
 *     log.info("resolution.applied conflictId={} strategy={}", conflictId, strategy);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forDetection(String runId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("detectionMode", mode);
        ctx.put("operation", "detect");
        return ctx;
    }

    public static LogContext forResolution(String conflictId, String conflictType) {
        LogContext ctx = new LogContext();
        ctx.put("conflictId", conflictId);
        ctx.put("conflictType", conflictType);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forEscalation(String caseId, String conflictId) {
        LogContext ctx = new LogContext();
        ctx.put("caseId", caseId);
        ctx.put("conflictId", conflictId);
        ctx.put("operation", "escalate");
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
