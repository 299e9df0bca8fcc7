package com.market.linking.api;

import com.market.linking.core.model.MatchCandidate;
import com.market.linking.core.model.MatchSet;
import com.market.linking.core.model.MatchSummary;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link MarketMatcher#run} call.
 *
 * @param runId            identifier of the run, also present in the log MDC
 * @param matchSet         the injective set of accepted matches
 * @param summary          statistics over the accepted matches
 * @param leftRecords      left records that survived normalization
 * @param rightRecords     right records that survived normalization
 * @param pooledCandidates candidates that passed the quality gate, before dedup
 * @param errors           records skipped because their processing failed
 * @param duration         wall-clock duration of the run
 */
public record MatchingRun(
        String runId,
        MatchSet matchSet,
        MatchSummary summary,
        int leftRecords,
        int rightRecords,
        int pooledCandidates,
        List<RecordError> errors,
        Duration duration
) {
    public MatchingRun {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(matchSet, "matchSet is required");
        Objects.requireNonNull(summary, "summary is required");
        errors = errors != null ? List.copyOf(errors) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public List<MatchCandidate> matches() {
        return matchSet.matches();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
