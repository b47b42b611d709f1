package com.fbo.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSync(correlationId, "KSFO")) {
 *     log.info("sync.completed records={}", records.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSync(String correlationId, String locationCode) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("locationCode", locationCode);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static LogContext forImport(String correlationId, int datasetVersion) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("datasetVersion", String.valueOf(datasetVersion));
        ctx.put("operation", "import");
        return ctx;
    }

    public static LogContext forEdit(String correlationId, String locationCode, String facilityName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("locationCode", locationCode);
        ctx.put("facilityName", facilityName);
        ctx.put("operation", "edit");
        return ctx;
    }

    public static LogContext forPush(String locationCode, String facilityName) {
        LogContext ctx = new LogContext();
        ctx.put("locationCode", locationCode);
        ctx.put("facilityName", facilityName);
        ctx.put("operation", "push");
        return ctx;
    }

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
