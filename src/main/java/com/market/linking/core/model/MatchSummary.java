package com.market.linking.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate quality figures for a match set, logged at the end of a run.
 *
 * @param totalMatches     number of matches
 * @param matchesByDomain  match count per domain, largest first
 * @param minScore         lowest text score (0 when empty)
 * @param maxScore         highest text score (0 when empty)
 * @param averageScore     mean text score (0 when empty)
 * @param minEntityOverlap lowest non-zero entity overlap (0 when none)
 * @param maxEntityOverlap highest non-zero entity overlap (0 when none)
 * @param averageEntityOverlap mean of the non-zero entity overlaps (0 when none)
 */
public record MatchSummary(
        int totalMatches,
        Map<Domain, Integer> matchesByDomain,
        double minScore,
        double maxScore,
        double averageScore,
        double minEntityOverlap,
        double maxEntityOverlap,
        double averageEntityOverlap
) {
    public MatchSummary {
        matchesByDomain = matchesByDomain != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(matchesByDomain))
                : Map.of();
    }

    public static MatchSummary of(List<MatchCandidate> matches) {
        if (matches == null || matches.isEmpty()) {
            return new MatchSummary(0, Map.of(), 0, 0, 0, 0, 0, 0);
        }

        Map<Domain, Integer> counts = new LinkedHashMap<>();
        double minScore = Double.MAX_VALUE;
        double maxScore = -Double.MAX_VALUE;
        double scoreSum = 0;
        double minOverlap = Double.MAX_VALUE;
        double maxOverlap = -Double.MAX_VALUE;
        double overlapSum = 0;
        int overlapCount = 0;

        for (MatchCandidate match : matches) {
            counts.merge(match.domain(), 1, Integer::sum);
            minScore = Math.min(minScore, match.score());
            maxScore = Math.max(maxScore, match.score());
            scoreSum += match.score();
            if (match.entityOverlapRatio() > 0) {
                minOverlap = Math.min(minOverlap, match.entityOverlapRatio());
                maxOverlap = Math.max(maxOverlap, match.entityOverlapRatio());
                overlapSum += match.entityOverlapRatio();
                overlapCount++;
            }
        }

        List<Map.Entry<Domain, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<Domain, Integer>comparingByValue().reversed());
        Map<Domain, Integer> byDomain = new LinkedHashMap<>();
        for (Map.Entry<Domain, Integer> entry : entries) {
            byDomain.put(entry.getKey(), entry.getValue());
        }

        return new MatchSummary(
                matches.size(),
                byDomain,
                minScore,
                maxScore,
                scoreSum / matches.size(),
                overlapCount > 0 ? minOverlap : 0,
                overlapCount > 0 ? maxOverlap : 0,
                overlapCount > 0 ? overlapSum / overlapCount : 0);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "MatchSummary{total=%d, byDomain=%s, score[min=%.1f, max=%.1f, avg=%.1f], entityOverlap[min=%.3f, max=%.3f, avg=%.3f]}",
                totalMatches, matchesByDomain, minScore, maxScore, averageScore,
                minEntityOverlap, maxEntityOverlap, averageEntityOverlap);
    }
}
