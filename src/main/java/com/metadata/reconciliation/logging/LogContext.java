package com.metadata.reconciliation.logging;

import com.metadata.reconciliation.core.model.TrackQuery;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, removed again on {@link #close()}.
 * <pre>
 * try (LogContext ctx = LogContext.forReconciliation(correlationId, query)) {
 *     log.info("reconcile.completed mergeConfidence={}", merged.getMergeConfidence());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String QUERY_TITLE = "queryTitle";
    public static final String QUERY_ARTIST = "queryArtist";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for normalize-and-merge of one query. Query keys are only set when present.
     */
    public static LogContext forReconciliation(String correlationId, TrackQuery query) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "reconcile");
        if (query != null) {
            ctx.put(QUERY_TITLE, query.title());
            ctx.put(QUERY_ARTIST, query.artist());
        }
        return ctx;
    }

    public static LogContext forMerge(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    public static LogContext forOverride(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "override");
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
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
