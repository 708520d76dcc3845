package com.crossmatch.pairing.tracing;

/**
 * A traced unit of pairing work: a run, or one chunk of islands.
 * Closing the span ends it, so spans fit try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
