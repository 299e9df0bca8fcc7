package com.market.linking.rules;

import java.util.List;

/**
 * Built-in folding rules for market text: punctuation and symbols become
 * whitespace so equivalent wording with different formatting compares equal.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates the engine used to derive a record's normalized text.
     */
    public static NormalizationEngine createFoldingEngine() {
        return new NormalizationEngine(getFoldingRules());
    }

    public static List<NormalizationRule> getFoldingRules() {
        return List.of(
                // Anything that is not a letter or a digit separates tokens
                NormalizationRule.builder()
                        .name("fold-non-alphanumeric")
                        .pattern("[^\\p{L}\\p{N}]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("fold-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
