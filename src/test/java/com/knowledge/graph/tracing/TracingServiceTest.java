package com.knowledge.graph.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle works without a backend")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(SpanNames.EXPLORE)) {
                    span.setAttribute("userId", "u1");
                    span.setAttribute("seeds", 3L);
                    span.setAttribute("confidence", 0.9);
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("The same silent span is handed out")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(SpanNames.RESOLVE), noOp.startSpan(SpanNames.EXPLORE, Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private final Tracer tracer = mock(Tracer.class);
        private final SpanBuilder builder = mock(SpanBuilder.class);
        private final io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);

        private Span start(String name, Map<String, String> attributes) {
            when(tracer.spanBuilder(name)).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            return new OpenTelemetryTracingService(tracer).startSpan(name, attributes);
        }

        @Test
        @DisplayName("Initial attributes go on the builder")
        void initialAttributes() {
            start(SpanNames.RESOLVE, Map.of("nodeType", "Concept"));

            verify(tracer).spanBuilder(SpanNames.RESOLVE);
            verify(builder).setAttribute("nodeType", "Concept");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Attributes, status and exceptions are delegated")
        void delegates() {
            RuntimeException failure = new RuntimeException("boom");
            Span span = start(SpanNames.EXPLORE, Map.of());

            span.setAttribute("queries", 2L);
            span.setAttribute("score", 0.5);
            span.setStatus(Span.SpanStatus.ERROR);
            span.recordException(failure);

            verify(otelSpan).setAttribute("queries", 2L);
            verify(otelSpan).setAttribute("score", 0.5);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(failure);
        }

        @Test
        @DisplayName("Closing the span ends it")
        void closeEnds() {
            Span span = start(SpanNames.RECORD_ACCESS, Map.of());
            span.close();
            verify(otelSpan).end();
        }
    }
}
