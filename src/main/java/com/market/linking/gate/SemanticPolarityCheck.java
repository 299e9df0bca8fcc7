package com.market.linking.gate;

import com.market.linking.extraction.NumberExtractor;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Detects pairs of texts that fuzzy matching scores as similar but that ask
 * opposite questions: "rate cut" vs "rate hike", "above $100k" vs "below $100k".
 *
 * <p>Each antonym word is looked up at the start of a word, so inflected forms
 * count too ("cuts", "hiking", "loses"); multi-word phrases must match whole.
 * The pair conflicts when one text carries one side and the other text carries
 * the opposite side. Two texts
 * stating disjoint basis-point amounts ("25 bps" vs "50 bps") conflict as well.</p>
 */
public class SemanticPolarityCheck {

    private final List<Antonym> antonyms;
    private final NumberExtractor numberExtractor;

    public SemanticPolarityCheck() {
        this(defaultAntonyms(), new NumberExtractor());
    }

    public SemanticPolarityCheck(List<Antonym> antonyms, NumberExtractor numberExtractor) {
        this.antonyms = List.copyOf(antonyms);
        this.numberExtractor = numberExtractor;
    }

    public static List<Antonym> defaultAntonyms() {
        return List.of(
                Antonym.of("above", "below"),
                Antonym.of("over", "under"),
                Antonym.of("more than", "less than"),
                Antonym.of("increase", "decrease"),
                Antonym.of("rise", "fall"),
                Antonym.of("up", "down"),
                Antonym.of("win", "lose"),
                Antonym.of("outperform", "underperform"),
                Antonym.of("cut", "hike"),
                Antonym.of("emergency", "scheduled")
        );
    }

    /**
     * Returns a description of the first conflict between the two texts, or empty when none.
     */
    public Optional<String> findConflict(String leftText, String rightText) {
        String left = leftText != null ? leftText.toLowerCase(Locale.ROOT) : "";
        String right = rightText != null ? rightText.toLowerCase(Locale.ROOT) : "";

        for (Antonym antonym : antonyms) {
            if ((antonym.firstIn(left) && antonym.secondIn(right))
                    || (antonym.secondIn(left) && antonym.firstIn(right))) {
                return Optional.of("opposite wording: " + antonym.first() + "/" + antonym.second());
            }
        }

        Set<String> leftBps = numberExtractor.basisPoints(left);
        Set<String> rightBps = numberExtractor.basisPoints(right);
        if (!leftBps.isEmpty() && !rightBps.isEmpty() && leftBps.stream().noneMatch(rightBps::contains)) {
            return Optional.of("conflicting basis-point amounts: " + leftBps + " vs " + rightBps);
        }
        return Optional.empty();
    }

    /**
     * A pair of words or phrases with opposite meaning. Single words match any
     * word starting with them; a trailing "e" may also be replaced by "ing".
     */
    public record Antonym(String first, String second, Pattern firstPattern, Pattern secondPattern) {

        public static Antonym of(String first, String second) {
            return new Antonym(first, second, wordPattern(first), wordPattern(second));
        }

        boolean firstIn(String text) {
            return firstPattern.matcher(text).find();
        }

        boolean secondIn(String text) {
            return secondPattern.matcher(text).find();
        }

        private static Pattern wordPattern(String phrase) {
            String[] words = phrase.toLowerCase(Locale.ROOT).trim().split("\\s+");
            if (words.length == 1) {
                return Pattern.compile("\\b" + inflected(words[0]) + "\\w*");
            }
            StringJoiner joiner = new StringJoiner("\\s+", "\\b", "\\b");
            for (String word : words) {
                joiner.add(Pattern.quote(word));
            }
            return Pattern.compile(joiner.toString());
        }

        // "hike" also matches "hiking", "lose" also matches "losing"
        private static String inflected(String word) {
            if (word.length() > 2 && word.endsWith("e")) {
                return Pattern.quote(word.substring(0, word.length() - 1)) + "(?:e|ing)";
            }
            return Pattern.quote(word);
        }
    }
}
