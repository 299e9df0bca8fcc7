package com.market.linking.gate;

import com.market.linking.core.model.Domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-domain vocabularies of which at least one entity must be shared by both
 * records. Sharing "usa" is not enough for two political markets to be the same
 * question; sharing "trump" or "election" is. Domains without an entry skip the check.
 */
public final class DomainEntityRequirements {

    private final Map<Domain, Set<String>> required;

    public DomainEntityRequirements(Map<Domain, Set<String>> required) {
        Map<Domain, Set<String>> copy = new EnumMap<>(Domain.class);
        required.forEach((domain, entities) -> copy.put(domain, Set.copyOf(entities)));
        this.required = Collections.unmodifiableMap(copy);
    }

    public static DomainEntityRequirements defaults() {
        Map<Domain, Set<String>> required = new EnumMap<>(Domain.class);
        required.put(Domain.POLITICS, Set.of("trump", "biden", "harris", "election", "president"));
        required.put(Domain.CRYPTO, Set.of("bitcoin", "btc", "ethereum", "eth", "solana", "sol", "dogecoin", "doge"));
        required.put(Domain.MACRO, Set.of("federal reserve", "fed", "interest rate", "unemployment", "inflation"));
        return new DomainEntityRequirements(required);
    }

    /**
     * Returns true when the domain has no requirement or the shared entities satisfy it.
     */
    public boolean isSatisfied(Domain domain, Set<String> sharedEntities) {
        Set<String> vocabulary = required.get(domain);
        if (vocabulary == null) {
            return true;
        }
        for (String entity : sharedEntities) {
            if (vocabulary.contains(entity)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> requiredFor(Domain domain) {
        return required.getOrDefault(domain, Set.of());
    }
}
