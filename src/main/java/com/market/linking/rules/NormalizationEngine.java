package com.market.linking.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Folds market text into the form compared by the similarity scorer.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * followed by lower-casing, trimming and whitespace collapsing.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Folds the given text. Null or blank input yields the empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two texts fold to the same comparison form.
     */
    public boolean areEquivalent(String text1, String text2) {
        return normalize(text1).equals(normalize(text2));
    }
}
