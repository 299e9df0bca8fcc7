package com.market.linking.extraction;

import com.market.linking.core.model.Domain;
import com.market.linking.rules.DomainRules;
import com.market.linking.rules.TaggedPattern;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Assigns exactly one coarse domain to a text.
 * Rules are evaluated top to bottom and the first match wins; no match yields {@link Domain#OTHER}.
 */
public class DomainClassifier {

    private final List<TaggedPattern<Domain>> rules;

    public DomainClassifier() {
        this(DomainRules.defaults());
    }

    public DomainClassifier(List<TaggedPattern<Domain>> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules is required"));
    }

    public Domain classify(String text) {
        if (text == null || text.isBlank()) {
            return Domain.OTHER;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (TaggedPattern<Domain> rule : rules) {
            if (rule.matches(lower)) {
                return rule.tag();
            }
        }
        return Domain.OTHER;
    }
}
