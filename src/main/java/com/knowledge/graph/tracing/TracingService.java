package com.knowledge.graph.tracing;

import java.util.Map;

/**
 * Starts spans. {@link NoOpTracingService} is the default, so no tracing backend is
 * required at runtime.
 */
public interface TracingService {

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    Span startSpan(String operationName, Map<String, String> attributes);
}
