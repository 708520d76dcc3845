package com.crossmatch.pairing.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(TracingService.RUN_SPAN)) {
                    span.setAttribute("runId", "run-1");
                    span.setAttribute("islands", 42L);
                    span.setAttribute("probability", 0.9);
                    span.addEvent("cancelled");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return the same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(TracingService.RUN_SPAN),
                    noOp.startSpan(TracingService.CHUNK_SPAN, Map.of("chunk", "3")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should start a span with the operation name and initial attributes")
        void startSpan() {
            Span span = service.startSpan(TracingService.CHUNK_SPAN, Map.of("runId", "run-7"));

            assertNotNull(span);
            verify(tracer).spanBuilder("pairing.chunk");
            verify(builder).setAttribute("runId", "run-7");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes and events")
        void attributes() {
            Span span = service.startSpan(TracingService.RUN_SPAN);
            span.setAttribute("counterparts", 12L);
            span.setAttribute("runId", "run-1");
            span.setAttribute("fraction", 0.25);
            span.addEvent("cancelled");

            verify(otelSpan).setAttribute("counterparts", 12L);
            verify(otelSpan).setAttribute("runId", "run-1");
            verify(otelSpan).setAttribute("fraction", 0.25);
            verify(otelSpan).addEvent("cancelled");
        }

        @Test
        @DisplayName("Should map statuses and record exceptions")
        void statusAndException() {
            Span span = service.startSpan(TracingService.RUN_SPAN);
            RuntimeException failure = new RuntimeException("chunk failed");

            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);
            span.recordException(failure);

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(failure);
        }

        @Test
        @DisplayName("Should end the span on close")
        void endOnClose() {
            service.startSpan(TracingService.RUN_SPAN).close();
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Should obtain its tracer under the pairing instrumentation scope")
        void fromOpenTelemetry() {
            OpenTelemetry openTelemetry = mock(OpenTelemetry.class);
            when(openTelemetry.getTracer(OpenTelemetryTracingService.INSTRUMENTATION_SCOPE)).thenReturn(tracer);

            OpenTelemetryTracingService fromSdk = OpenTelemetryTracingService.from(openTelemetry);
            fromSdk.startSpan(TracingService.RUN_SPAN).close();

            verify(openTelemetry).getTracer("com.crossmatch.pairing");
            verify(tracer).spanBuilder("pairing.run");
            verify(otelSpan).end();
        }
    }
}
