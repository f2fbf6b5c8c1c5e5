package com.product.resolution.tracing;

/**
 * A unit of work in a trace: one resolution run or one of its phases.
 * Closing the span ends it, so spans go in try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
