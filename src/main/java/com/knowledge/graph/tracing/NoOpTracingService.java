package com.knowledge.graph.tracing;

import java.util.Map;

/**
 * {@link TracingService} whose spans record nothing. A single shared span is handed out.
 */
public class NoOpTracingService implements TracingService {

    private static final Span SILENT = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return SILENT;
    }
}
