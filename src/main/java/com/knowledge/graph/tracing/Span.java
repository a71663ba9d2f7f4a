package com.knowledge.graph.tracing;

/**
 * A traced unit of work. Closing the span ends it, so spans fit try-with-resources:
 * <pre>
 * try (Span span = tracing.startSpan(SpanNames.RESOLVE)) {
 *     span.setAttribute("nodeType", "Concept");
 *     span.setAttribute("confidence", 0.95);
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
