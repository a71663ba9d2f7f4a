package com.knowledge.graph.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, removed again on close.
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(userId, "Concept")) {
 *     log.info("mention.resolved entityKey={} tier={}", key, tier);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String userId, String nodeType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("userId", userId);
        ctx.put("nodeType", nodeType);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forExplore(String userId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("userId", userId);
        ctx.put("operation", "explore");
        return ctx;
    }

    public static String generateCorrelationId() {
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
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
