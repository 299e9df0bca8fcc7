package com.market.linking.tracing;

/**
 * Span names emitted by a matching run.
 */
public final class SpanNames {

    public static final String RUN = "market-linking.run";
    public static final String SCORING_PHASE = "market-linking.phase.scoring";
    public static final String DEDUP_PHASE = "market-linking.phase.dedup";

    private SpanNames() {
        // Utility class
    }
}
