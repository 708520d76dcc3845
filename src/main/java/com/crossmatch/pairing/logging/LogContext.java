package com.crossmatch.pairing.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around SLF4J MDC entries.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forChunk(runId, chunk.index())) {
 *     log.info("chunk.completed islands={}", count);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: worker threads open their own context per chunk.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "pairing");
        return ctx;
    }

    public static LogContext forChunk(String runId, int chunkIndex) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("chunk", Integer.toString(chunkIndex));
        ctx.put("operation", "chunk");
        return ctx;
    }

    public static LogContext forExport(String format) {
        LogContext ctx = new LogContext();
        ctx.put("format", format);
        ctx.put("operation", "export");
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
