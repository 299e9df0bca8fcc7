package com.market.linking.tracing;

import java.util.Map;

/**
 * Tracing service whose spans record nothing.
 */
public class NoOpTracingService implements TracingService {

    private static final Span DISCARDING_SPAN = new DiscardingSpan();

    @Override
    public Span startSpan(String name) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startSpan(String name, Map<String, String> attributes) {
        return DISCARDING_SPAN;
    }

    private static final class DiscardingSpan implements Span {
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
        public void markSucceeded() {
        }

        @Override
        public void markFailed(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
