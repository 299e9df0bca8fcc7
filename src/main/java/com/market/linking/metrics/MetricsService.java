package com.market.linking.metrics;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.Domain;
import com.market.linking.gate.GateRule;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    void incrementRecordsLoaded(CatalogSide catalog, int count);

    void incrementRecordsDropped(CatalogSide catalog);

    void recordSimilarityScore(double score);

    void incrementCandidateFound(Domain domain);

    void incrementGateRejected(GateRule rule);

    void incrementRecordFailed();

    void recordMatchesAccepted(int count);
}
