package com.market.linking.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provisional pairing of one left record with its best-scoring right record.
 * Carries the overlap signals the quality gate and the deduplicator rank on,
 * and the shared sets kept for audit.
 *
 * @param leftId             source id of the left record
 * @param rightId            source id of the right record
 * @param leftTitle          title of the left record
 * @param rightTitle         title of the right record
 * @param score              token-set similarity in [0, 100]
 * @param domain             the shared domain bucket
 * @param timeDiffHours      absolute end-time difference, null when either side is unknown
 * @param entityOverlapRatio Jaccard ratio of the entity sets
 * @param numberOverlapRatio Jaccard ratio of the numeric-token sets
 * @param sharedEntities     entity intersection, sorted
 * @param sharedNumbers      numeric-token intersection, sorted
 */
public record MatchCandidate(
        String leftId,
        String rightId,
        String leftTitle,
        String rightTitle,
        double score,
        Domain domain,
        Double timeDiffHours,
        double entityOverlapRatio,
        double numberOverlapRatio,
        Set<String> sharedEntities,
        Set<String> sharedNumbers
) {
    static final double ENTITY_OVERLAP_WEIGHT = 30.0;
    static final double NUMBER_OVERLAP_WEIGHT = 20.0;

    public MatchCandidate {
        Objects.requireNonNull(leftId, "leftId is required");
        Objects.requireNonNull(rightId, "rightId is required");
        Objects.requireNonNull(domain, "domain is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        if (timeDiffHours != null && timeDiffHours < 0.0) {
            throw new IllegalArgumentException("timeDiffHours must be non-negative");
        }
        validateRatio(entityOverlapRatio, "entityOverlapRatio");
        validateRatio(numberOverlapRatio, "numberOverlapRatio");
        leftTitle = leftTitle != null ? leftTitle : "";
        rightTitle = rightTitle != null ? rightTitle : "";
        sharedEntities = sharedEntities != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(sharedEntities))
                : Collections.emptySortedSet();
        sharedNumbers = sharedNumbers != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(sharedNumbers))
                : Collections.emptySortedSet();
    }

    /**
     * Ranking score used by the deduplicator: text score plus weighted overlap ratios.
     */
    public double compositeScore() {
        return score + ENTITY_OVERLAP_WEIGHT * entityOverlapRatio + NUMBER_OVERLAP_WEIGHT * numberOverlapRatio;
    }

    public Optional<Double> timeDiff() {
        return Optional.ofNullable(timeDiffHours);
    }

    private static void validateRatio(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
