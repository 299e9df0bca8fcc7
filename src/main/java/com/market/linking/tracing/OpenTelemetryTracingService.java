package com.market.linking.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 *
 * <p>Only {@code opentelemetry-api} is required; with no SDK registered the
 * global tracer is a no-op and spans cost next to nothing.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startSpan(String name) {
        return new OtelSpan(tracer.spanBuilder(name).startSpan());
    }

    @Override
    public Span startSpan(String name, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(name);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OtelSpan(builder.startSpan());
    }

    private static final class OtelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        OtelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void markSucceeded() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void markFailed(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getMessage() == null ? "" : cause.getMessage());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
