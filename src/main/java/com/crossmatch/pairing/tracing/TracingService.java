package com.crossmatch.pairing.tracing;

import java.util.Map;

/**
 * Starts spans around pairing runs and chunks.
 * The default {@link NoOpTracingService} keeps the library usable without a tracing backend.
 */
public interface TracingService {

    String RUN_SPAN = "pairing.run";
    String CHUNK_SPAN = "pairing.chunk";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
