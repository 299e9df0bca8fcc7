package com.market.linking.metrics;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.Domain;
import com.market.linking.gate.GateRule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code market.linking.run.duration}: Timer</li>
 *   <li>{@code market.linking.records.loaded}: Counter (tag: catalog)</li>
 *   <li>{@code market.linking.records.dropped}: Counter (tag: catalog)</li>
 *   <li>{@code market.linking.records.failed}: Counter</li>
 *   <li>{@code market.linking.similarity.score}: DistributionSummary</li>
 *   <li>{@code market.linking.candidates.found}: Counter (tag: domain)</li>
 *   <li>{@code market.linking.gate.rejected}: Counter (tag: rule)</li>
 *   <li>{@code market.linking.matches.accepted}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer runTimer;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary matchesAcceptedSummary;
    private final Counter recordsFailedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.runTimer = Timer.builder("market.linking.run.duration")
                .description("Duration of complete matching runs")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("market.linking.similarity.score")
                .description("Text scores of the best candidate per left record")
                .register(registry);
        this.matchesAcceptedSummary = DistributionSummary.builder("market.linking.matches.accepted")
                .description("Matches in the final set per run")
                .register(registry);
        this.recordsFailedCounter = Counter.builder("market.linking.records.failed")
                .description("Records whose processing failed and was skipped")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void incrementRecordsLoaded(CatalogSide catalog, int count) {
        counter("market.linking.records.loaded", "Records normalized into the corpus", "catalog", catalog.name())
                .increment(count);
    }

    @Override
    public void incrementRecordsDropped(CatalogSide catalog) {
        counter("market.linking.records.dropped", "Records dropped for a blank title", "catalog", catalog.name())
                .increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementCandidateFound(Domain domain) {
        counter("market.linking.candidates.found", "Left records with a candidate above the cutoff",
                "domain", domain.label()).increment();
    }

    @Override
    public void incrementGateRejected(GateRule rule) {
        counter("market.linking.gate.rejected", "Candidates rejected by the quality gate", "rule", rule.name())
                .increment();
    }

    @Override
    public void incrementRecordFailed() {
        recordsFailedCounter.increment();
    }

    @Override
    public void recordMatchesAccepted(int count) {
        matchesAcceptedSummary.record(count);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
