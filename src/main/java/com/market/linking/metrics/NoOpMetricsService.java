package com.market.linking.metrics;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.Domain;
import com.market.linking.gate.GateRule;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void incrementRecordsLoaded(CatalogSide catalog, int count) {
    }

    @Override
    public void incrementRecordsDropped(CatalogSide catalog) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementCandidateFound(Domain domain) {
    }

    @Override
    public void incrementGateRejected(GateRule rule) {
    }

    @Override
    public void incrementRecordFailed() {
    }

    @Override
    public void recordMatchesAccepted(int count) {
    }
}
