package com.market.linking.similarity;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Similarity based on the Indel distance (edit distance with insertions and
 * deletions only). Computes {@code 100 * (1 - distance / (|s1| + |s2|))}.
 *
 * <p>The distance is derived from the longest common subsequence:
 * {@code indel = |s1| + |s2| - 2 * lcs}.</p>
 */
public class IndelSimilarity implements SimilarityAlgorithm {

    private static final long[] NO_OCCURRENCES = new long[0];

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return normalize(distance(s1, s2), s1.length() + s2.length());
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * Converts a distance into a 0..100 similarity relative to the combined length.
     * Two empty strings are identical.
     */
    static double normalize(int distance, int lengthSum) {
        if (lengthSum == 0) {
            return 100.0;
        }
        return 100.0 - 100.0 * distance / lengthSum;
    }

    /**
     * Computes the Indel distance between two strings.
     */
    public int distance(String s1, String s2) {
        return s1.length() + s2.length() - 2 * longestCommonSubsequence(s1, s2);
    }

    /**
     * Length of the longest common subsequence, using the bit-parallel algorithm
     * of Hyyrö (2004): one bit per character of the shorter string, one pass over
     * the longer one.
     */
    int longestCommonSubsequence(String s1, String s2) {
        // Ensure s1 is the shorter string so the bit vector stays small
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        if (m == 0) {
            return 0;
        }
        int words = (m + 63) >>> 6;

        // Position masks: bit i of PM[c] is set when s1.charAt(i) == c
        Map<Character, long[]> positionMasks = new HashMap<>();
        for (int i = 0; i < m; i++) {
            long[] mask = positionMasks.computeIfAbsent(s1.charAt(i), c -> new long[words]);
            mask[i >>> 6] |= 1L << (i & 63);
        }

        long[] v = new long[words];
        Arrays.fill(v, -1L);

        for (int j = 0; j < s2.length(); j++) {
            long[] mask = positionMasks.getOrDefault(s2.charAt(j), NO_OCCURRENCES);
            if (mask.length == 0) {
                continue;
            }
            long carry = 0;
            for (int w = 0; w < words; w++) {
                long vw = v[w];
                long u = vw & mask[w];
                long sum = vw + u + carry;
                carry = (Long.compareUnsigned(sum, vw) < 0 || (carry == 1 && sum == vw)) ? 1 : 0;
                // u is a subset of vw, so vw - u never borrows
                v[w] = sum | (vw ^ u);
            }
        }

        int lcs = 0;
        for (int w = 0; w < words; w++) {
            long valid = (w == words - 1 && (m & 63) != 0) ? (1L << (m & 63)) - 1 : -1L;
            lcs += Long.bitCount(~v[w] & valid);
        }
        return lcs;
    }
}
