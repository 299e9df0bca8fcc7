package com.market.linking.similarity;

import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set similarity: insensitive to word order, duplicate words, and one
 * text's vocabulary being a subset of the other's.
 *
 * <p>Both texts are split into token sets. If they share at least one token and
 * either set is contained in the other, the score is 100. Otherwise the score is
 * the best {@link IndelSimilarity} among three sorted, space-joined comparisons:
 * {@code common} vs {@code common + onlyLeft}, {@code common} vs
 * {@code common + onlyRight}, and {@code common + onlyLeft} vs
 * {@code common + onlyRight}.</p>
 *
 * <p>Inputs are expected to be folded already (see the folding rules); this class
 * only splits on whitespace.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IndelSimilarity indel;

    public TokenSetSimilarity() {
        this(new IndelSimilarity());
    }

    public TokenSetSimilarity(IndelSimilarity indel) {
        this.indel = indel;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        SortedSet<String> tokens1 = tokenize(s1);
        SortedSet<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> common = new TreeSet<>(tokens1);
        common.retainAll(tokens2);
        SortedSet<String> onlyIn1 = new TreeSet<>(tokens1);
        onlyIn1.removeAll(tokens2);
        SortedSet<String> onlyIn2 = new TreeSet<>(tokens2);
        onlyIn2.removeAll(tokens1);

        if (!common.isEmpty() && (onlyIn1.isEmpty() || onlyIn2.isEmpty())) {
            return 100.0;
        }

        String diff1 = String.join(" ", onlyIn1);
        String diff2 = String.join(" ", onlyIn2);
        int commonLength = String.join(" ", common).length();
        int separator = commonLength != 0 ? 1 : 0;
        int common1Length = commonLength + separator + diff1.length();
        int common2Length = commonLength + separator + diff2.length();

        // common+diff1 vs common+diff2 share the prefix, so only the diffs contribute edits
        int dist = indel.distance(diff1, diff2);
        double result = IndelSimilarity.normalize(dist, common1Length + common2Length);

        if (commonLength == 0) {
            return result;
        }

        // common vs common+diff is pure insertion of the separator and the diff
        double common1Ratio = IndelSimilarity.normalize(separator + diff1.length(), commonLength + common1Length);
        double common2Ratio = IndelSimilarity.normalize(separator + diff2.length(), commonLength + common2Length);

        return Math.max(result, Math.max(common1Ratio, common2Ratio));
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    static SortedSet<String> tokenize(String s) {
        SortedSet<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(s.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
