package com.market.linking.tracing;

/**
 * A traced unit of work within a matching run.
 * Closing the span ends it, so it is normally held in try-with-resources:
 * <pre>
 * try (Span span = tracing.startSpan(SpanNames.SCORING_PHASE)) {
 *     span.setAttribute("left.records", leftCount);
 *     ...
 *     span.markSucceeded();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void markSucceeded();

    void markFailed(Throwable cause);

    @Override
    void close();
}
