package com.market.linking.core.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Final, injective set of accepted matches: no left id and no right id
 * appears more than once. Order is the deduplicator's acceptance order.
 */
public record MatchSet(
        Instant generatedAt,
        MatchingCriteria criteria,
        List<MatchCandidate> matches
) {
    public MatchSet {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(criteria, "criteria is required");
        matches = matches != null ? List.copyOf(matches) : List.of();
        Set<String> leftIds = new HashSet<>();
        Set<String> rightIds = new HashSet<>();
        for (MatchCandidate match : matches) {
            if (!leftIds.add(match.leftId())) {
                throw new IllegalArgumentException("Left id used twice: " + match.leftId());
            }
            if (!rightIds.add(match.rightId())) {
                throw new IllegalArgumentException("Right id used twice: " + match.rightId());
            }
        }
    }

    public int size() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }
}
