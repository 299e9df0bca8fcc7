package com.market.linking.similarity;

import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the single best-scoring right record for a left record.
 *
 * <p>Every candidate's normalized text is scored against the left record's with
 * the configured {@link SimilarityAlgorithm}. Only the highest score at or above
 * the cutoff survives; on ties the candidate seen first wins.</p>
 */
public class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    private final SimilarityAlgorithm algorithm;
    private final double scoreCutoff;

    public CandidateScorer(double scoreCutoff) {
        this(new TokenSetSimilarity(), scoreCutoff);
    }

    public CandidateScorer(SimilarityAlgorithm algorithm, double scoreCutoff) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
        if (scoreCutoff < 0.0 || scoreCutoff > 100.0) {
            throw new IllegalArgumentException("scoreCutoff must be between 0 and 100");
        }
        this.scoreCutoff = scoreCutoff;
    }

    /**
     * Scores the candidates and builds a {@link MatchCandidate} for the best one.
     *
     * @param left       the left record
     * @param candidates right records from the candidate index, in bucket order
     * @return the best candidate at or above the cutoff with its right record, or empty
     */
    public Optional<ScoredCandidate> findBest(MarketRecord left, List<MarketRecord> candidates) {
        MarketRecord best = null;
        double bestScore = -1.0;

        for (MarketRecord right : candidates) {
            double score = algorithm.compute(left.getNormalizedText(), right.getNormalizedText());
            if (score >= scoreCutoff && score > bestScore) {
                best = right;
                bestScore = score;
            }
        }

        if (best == null) {
            return Optional.empty();
        }

        log.debug("candidate.best left={} right={} score={} algorithm={}",
                left.getSourceId(), best.getSourceId(), bestScore, algorithm.getName());
        return Optional.of(new ScoredCandidate(best, toCandidate(left, best, bestScore)));
    }

    /**
     * Builds the candidate for a scored pair, computing overlaps and the exact time difference.
     */
    public static MatchCandidate toCandidate(MarketRecord left, MarketRecord right, double score) {
        Double timeDiffHours = null;
        Optional<Instant> leftEnd = left.getEndTime();
        Optional<Instant> rightEnd = right.getEndTime();
        if (leftEnd.isPresent() && rightEnd.isPresent()) {
            timeDiffHours = CandidateIndex.hoursBetween(leftEnd.get(), rightEnd.get());
        }

        return new MatchCandidate(
                left.getSourceId(),
                right.getSourceId(),
                left.getTitle(),
                right.getTitle(),
                score,
                left.getDomain(),
                timeDiffHours,
                JaccardSimilarity.ratio(left.getEntities(), right.getEntities()),
                JaccardSimilarity.ratio(left.getNumbers(), right.getNumbers()),
                JaccardSimilarity.intersection(left.getEntities(), right.getEntities()),
                JaccardSimilarity.intersection(left.getNumbers(), right.getNumbers()));
    }
}
