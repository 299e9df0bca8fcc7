package com.market.linking.similarity;

import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.MatchCandidate;

import java.util.Objects;

/**
 * The best candidate for a left record together with the right record it was scored against.
 *
 * @param right     the winning right record
 * @param candidate the candidate built from the pair
 */
public record ScoredCandidate(MarketRecord right, MatchCandidate candidate) {
    public ScoredCandidate {
        Objects.requireNonNull(right, "right is required");
        Objects.requireNonNull(candidate, "candidate is required");
    }
}
