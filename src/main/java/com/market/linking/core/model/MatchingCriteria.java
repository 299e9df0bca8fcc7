package com.market.linking.core.model;

/**
 * Snapshot of the acceptance criteria a match set was produced under.
 * Written alongside the matches so downstream consumers can audit them.
 */
public record MatchingCriteria(
        double minTextSimilarity,
        double minEntityOverlapRatio,
        boolean strictEntityMatching,
        boolean semanticOppositeFiltering,
        boolean domainExactMatch,
        double maxTimeDiffHours
) {
    public static MatchingCriteria of(double scoreCutoff, double minEntityOverlapRatio, double maxTimeDiffHours) {
        return new MatchingCriteria(scoreCutoff, minEntityOverlapRatio, true, true, true, maxTimeDiffHours);
    }
}
