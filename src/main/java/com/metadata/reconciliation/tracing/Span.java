package com.metadata.reconciliation.tracing;

/**
 * A traced unit of work, ended on {@link #close()}.
 * <pre>
 * try (Span span = tracingService.startSpan(TracingService.RECONCILE_SPAN)) {
 *     span.setAttribute("records", records.size());
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
