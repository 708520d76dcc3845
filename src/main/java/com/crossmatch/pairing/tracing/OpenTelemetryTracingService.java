package com.crossmatch.pairing.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * OpenTelemetry-backed {@link TracingService}.
 *
 * <p>The engine opens one {@value TracingService#RUN_SPAN} span per pairing run,
 * tagged with {@code runId}, and one {@value TracingService#CHUNK_SPAN} span per
 * chunk of islands, tagged with {@code runId} and {@code chunk}. A run or chunk
 * that fails records the exception and ends with ERROR status.</p>
 *
 * <p>Requires {@code opentelemetry-api} on the classpath (optional dependency).</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    /** Instrumentation scope the pairing spans are reported under. */
    public static final String INSTRUMENTATION_SCOPE = "com.crossmatch.pairing";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    /**
     * Tracing service over the pairing instrumentation scope of {@code openTelemetry}.
     */
    public static OpenTelemetryTracingService from(OpenTelemetry openTelemetry) {
        Objects.requireNonNull(openTelemetry, "openTelemetry is required");
        return new OpenTelemetryTracingService(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            otelSpan.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
