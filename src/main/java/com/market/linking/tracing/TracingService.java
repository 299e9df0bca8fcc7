package com.market.linking.tracing;

import java.util.Map;

/**
 * Tracing seam for matching runs. {@link NoOpTracingService} is the default,
 * so no tracing backend is needed on the classpath.
 */
public interface TracingService {

    Span startSpan(String name);

    Span startSpan(String name, Map<String, String> attributes);
}
