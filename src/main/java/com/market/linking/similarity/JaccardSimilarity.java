package com.market.linking.similarity;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Jaccard overlap of two tag sets: |intersection| / |union|.
 * Used for the entity and numeric-token overlap ratios of a candidate pair.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
        // Utility class
    }

    /**
     * Computes the overlap ratio. Two empty sets have a ratio of 0.
     */
    public static double ratio(Set<String> a, Set<String> b) {
        if (a == null || b == null || (a.isEmpty() && b.isEmpty())) {
            return 0.0;
        }

        // Count intersection without creating a copy
        int intersectionSize = 0;
        for (String element : a) {
            if (b.contains(element)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = a.size() + b.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    /**
     * Returns the sorted intersection of two sets.
     */
    public static SortedSet<String> intersection(Set<String> a, Set<String> b) {
        SortedSet<String> shared = new TreeSet<>();
        if (a == null || b == null) {
            return shared;
        }
        for (String element : a) {
            if (b.contains(element)) {
                shared.add(element);
            }
        }
        return shared;
    }
}
