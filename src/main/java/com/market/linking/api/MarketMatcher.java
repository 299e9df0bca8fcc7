package com.market.linking.api;

import com.market.linking.bulk.ProgressCallback;
import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.MatchCandidate;
import com.market.linking.core.model.MatchSet;
import com.market.linking.core.model.MatchSummary;
import com.market.linking.core.model.MatchingCriteria;
import com.market.linking.core.model.RawMarket;
import com.market.linking.dedup.GreedyDeduplicator;
import com.market.linking.extraction.MarketNormalizer;
import com.market.linking.gate.GateResult;
import com.market.linking.gate.QualityGate;
import com.market.linking.logging.LogContext;
import com.market.linking.metrics.MetricsService;
import com.market.linking.metrics.NoOpMetricsService;
import com.market.linking.similarity.CandidateIndex;
import com.market.linking.similarity.CandidateScorer;
import com.market.linking.similarity.ScoredCandidate;
import com.market.linking.similarity.SimilarityAlgorithm;
import com.market.linking.similarity.TokenSetSimilarity;
import com.market.linking.tracing.NoOpTracingService;
import com.market.linking.tracing.Span;
import com.market.linking.tracing.SpanNames;
import com.market.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for linking two market catalogs.
 *
 * <p>A run has two phases joined by a completed, immutable candidate list:</p>
 * <ol>
 *   <li>Scoring: every left record is searched against its domain bucket of the
 *       right corpus, the best candidate is scored and passed through the
 *       {@link QualityGate}. May run on a fixed thread pool.</li>
 *   <li>Dedup: the pooled candidates are resolved into a one-to-one
 *       {@link MatchSet} by the {@link GreedyDeduplicator}.</li>
 * </ol>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MarketMatcher matcher = MarketMatcher.builder()
 *     .options(MatchingOptions.builder().parallelism(4).build())
 *     .build();
 *
 * MatchingRun run = matcher.run(kalshiMarkets, polymarketMarkets);
 * run.matches().forEach(m -&gt; ...);
 * </pre>
 */
public class MarketMatcher {
    private static final Logger log = LoggerFactory.getLogger(MarketMatcher.class);

    private final MarketNormalizer normalizer;
    private final CandidateScorer scorer;
    private final QualityGate gate;
    private final GreedyDeduplicator deduplicator;
    private final MatchingOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ProgressCallback progressCallback;
    private final Clock clock;

    private MarketMatcher(Builder builder) {
        this.normalizer = builder.normalizer;
        this.options = builder.options;
        this.scorer = new CandidateScorer(builder.algorithm, options.getScoreCutoff());
        this.gate = builder.gate;
        this.deduplicator = builder.deduplicator;
        this.metrics = builder.metricsService;
        this.tracing = builder.tracingService;
        this.progressCallback = builder.progressCallback;
        this.clock = builder.clock;
    }

    /**
     * Links the two catalogs and returns the accepted one-to-one matches.
     * Identical inputs and options always produce identical match lists.
     *
     * @param leftMarkets  the left catalog
     * @param rightMarkets the right catalog
     * @return the run outcome, never null; an empty corpus yields an empty match set
     */
    public MatchingRun run(List<RawMarket> leftMarkets, List<RawMarket> rightMarkets) {
        Objects.requireNonNull(leftMarkets, "leftMarkets is required");
        Objects.requireNonNull(rightMarkets, "rightMarkets is required");

        String runId = LogContext.generateRunId();
        long startNanos = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracing.startSpan(SpanNames.RUN, Map.of("runId", runId))) {
            log.info("match.started left={} right={} options={}",
                    leftMarkets.size(), rightMarkets.size(), options);
            try {
                List<RecordError> errors = new ArrayList<>();

                List<MarketRecord> lefts = normalizeAll(leftMarkets, CatalogSide.LEFT, errors);
                List<MarketRecord> rights = normalizeAll(rightMarkets, CatalogSide.RIGHT, errors);
                span.setAttribute("left.records", lefts.size());
                span.setAttribute("right.records", rights.size());

                List<MatchCandidate> pooled = scoringPhase(runId, lefts, new CandidateIndex(rights), errors);
                List<MatchCandidate> accepted = dedupPhase(pooled);

                MatchingCriteria criteria = MatchingCriteria.of(
                        options.getScoreCutoff(), gate.getMinEntityOverlap(), options.getMaxTimeDiffHours());
                MatchSet matchSet = new MatchSet(clock.instant(), criteria, accepted);
                MatchSummary summary = MatchSummary.of(accepted);
                Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

                metrics.recordMatchesAccepted(accepted.size());
                metrics.recordRunDuration(duration);
                span.setAttribute("matches", accepted.size());
                span.markSucceeded();

                log.info("match.completed pooled={} accepted={} errors={} durationMs={}",
                        pooled.size(), accepted.size(), errors.size(), duration.toMillis());
                log.info("match.summary {}", summary);

                return new MatchingRun(runId, matchSet, summary, lefts.size(), rights.size(),
                        pooled.size(), errors, duration);
            } catch (RuntimeException e) {
                span.markFailed(e);
                log.error("match.failed error={}", e.getMessage(), e);
                throw e;
            }
        }
    }

    private List<MarketRecord> normalizeAll(List<RawMarket> markets, CatalogSide catalog, List<RecordError> errors) {
        List<MarketRecord> records = new ArrayList<>(markets.size());
        for (RawMarket market : markets) {
            try {
                Optional<MarketRecord> record = normalizer.normalize(market, catalog);
                if (record.isPresent()) {
                    records.add(record.get());
                } else {
                    metrics.incrementRecordsDropped(catalog);
                }
            } catch (RuntimeException e) {
                log.warn("normalize.failed catalog={} sourceId={} error={}",
                        catalog, market.sourceId(), e.getMessage());
                errors.add(new RecordError(catalog, market.sourceId(), RecordError.STAGE_NORMALIZE, e.getMessage()));
                metrics.incrementRecordFailed();
            }
        }
        metrics.incrementRecordsLoaded(catalog, records.size());
        log.debug("normalize.completed catalog={} input={} kept={}", catalog, markets.size(), records.size());
        return records;
    }

    private List<MatchCandidate> scoringPhase(String runId, List<MarketRecord> lefts,
                                              CandidateIndex index, List<RecordError> errors) {
        try (Span span = tracing.startSpan(SpanNames.SCORING_PHASE)) {
            log.info("scoring.started left={} buckets={}", lefts.size(), index.bucketSizes());
            AtomicInteger processed = new AtomicInteger();

            List<ScoringOutcome> outcomes = options.getParallelism() == 1
                    ? scoreSequentially(runId, lefts, index, processed)
                    : scoreInParallel(runId, lefts, index, processed);

            List<MatchCandidate> pooled = new ArrayList<>();
            for (ScoringOutcome outcome : outcomes) {
                if (outcome.match() != null) {
                    pooled.add(outcome.match());
                }
                if (outcome.error() != null) {
                    errors.add(outcome.error());
                }
            }
            span.setAttribute("candidates", pooled.size());
            span.markSucceeded();
            log.info("scoring.completed left={} candidates={}", lefts.size(), pooled.size());
            return List.copyOf(pooled);
        }
    }

    private List<ScoringOutcome> scoreSequentially(String runId, List<MarketRecord> lefts,
                                                   CandidateIndex index, AtomicInteger processed) {
        List<ScoringOutcome> outcomes = new ArrayList<>(lefts.size());
        for (MarketRecord left : lefts) {
            outcomes.add(scoreOne(runId, left, index));
            reportProgress(processed.incrementAndGet(), lefts.size());
        }
        return outcomes;
    }

    private List<ScoringOutcome> scoreInParallel(String runId, List<MarketRecord> lefts,
                                                 CandidateIndex index, AtomicInteger processed) {
        ExecutorService executor = Executors.newFixedThreadPool(options.getParallelism());
        try {
            List<Future<ScoringOutcome>> futures = new ArrayList<>(lefts.size());
            for (MarketRecord left : lefts) {
                futures.add(executor.submit(() -> {
                    ScoringOutcome outcome = scoreOne(runId, left, index);
                    reportProgress(processed.incrementAndGet(), lefts.size());
                    return outcome;
                }));
            }
            // Collected in submission order so the pooled list follows left-record order
            List<ScoringOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<ScoringOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scoring phase interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scoring task failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private ScoringOutcome scoreOne(String runId, MarketRecord left, CandidateIndex index) {
        try (LogContext ctx = LogContext.forRecord(runId, CatalogSide.LEFT.name(), left.getSourceId())) {
            List<MarketRecord> candidates = index.candidatesFor(left, options.getMaxTimeDiffHours());
            Optional<ScoredCandidate> best = scorer.findBest(left, candidates);
            if (best.isEmpty()) {
                return ScoringOutcome.NONE;
            }

            MatchCandidate candidate = best.get().candidate();
            metrics.recordSimilarityScore(candidate.score());
            metrics.incrementCandidateFound(candidate.domain());

            GateResult result = gate.evaluate(candidate, left, best.get().right());
            if (!result.accepted()) {
                metrics.incrementGateRejected(result.failedRule());
                return ScoringOutcome.NONE;
            }
            return new ScoringOutcome(candidate, null);
        } catch (RuntimeException e) {
            log.warn("score.failed sourceId={} error={}", left.getSourceId(), e.getMessage());
            metrics.incrementRecordFailed();
            return new ScoringOutcome(null,
                    new RecordError(CatalogSide.LEFT, left.getSourceId(), RecordError.STAGE_SCORE, e.getMessage()));
        }
    }

    private List<MatchCandidate> dedupPhase(List<MatchCandidate> pooled) {
        try (Span span = tracing.startSpan(SpanNames.DEDUP_PHASE)) {
            span.setAttribute("candidates", pooled.size());
            List<MatchCandidate> accepted = deduplicator.deduplicate(pooled);
            span.setAttribute("accepted", accepted.size());
            span.markSucceeded();
            return accepted;
        }
    }

    private void reportProgress(int processed, int total) {
        if (processed % options.getProgressInterval() == 0 || processed == total) {
            log.info("scoring.progress processed={} total={}", processed, total);
            progressCallback.onProgress(processed, total, "Scored " + processed + " of " + total + " left records");
        }
    }

    /**
     * Result of scoring one left record: an accepted candidate, an error, or neither.
     */
    private record ScoringOutcome(MatchCandidate match, RecordError error) {
        static final ScoringOutcome NONE = new ScoringOutcome(null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MarketNormalizer normalizer;
        private SimilarityAlgorithm algorithm;
        private QualityGate gate;
        private GreedyDeduplicator deduplicator;
        private MatchingOptions options = MatchingOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ProgressCallback progressCallback;
        private Clock clock = Clock.systemUTC();

        /**
         * Sets a custom normalizer. Defaults to the built-in pattern tables.
         */
        public Builder normalizer(MarketNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Sets the text similarity algorithm. Defaults to {@link TokenSetSimilarity}.
         */
        public Builder similarityAlgorithm(SimilarityAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder qualityGate(QualityGate gate) {
            this.gate = gate;
            return this;
        }

        public Builder deduplicator(GreedyDeduplicator deduplicator) {
            this.deduplicator = deduplicator;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a tracing service. Defaults to {@link NoOpTracingService}.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Receives a report every {@link MatchingOptions#getProgressInterval()} left records.
         * May be called from worker threads.
         */
        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        /**
         * Clock used for the match set's generation timestamp, read when the run completes.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MarketMatcher build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            if (normalizer == null) {
                normalizer = new MarketNormalizer();
            }
            if (algorithm == null) {
                algorithm = new TokenSetSimilarity();
            }
            if (gate == null) {
                gate = new QualityGate();
            }
            if (deduplicator == null) {
                deduplicator = new GreedyDeduplicator();
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (tracingService == null) {
                tracingService = new NoOpTracingService();
            }
            if (progressCallback == null) {
                progressCallback = ProgressCallback.NOOP;
            }
            return new MarketMatcher(this);
        }
    }
}
