package com.market.linking.core.model;

import java.util.Locale;

/**
 * Coarse category assigned to every market record.
 * Candidates are only ever searched inside the bucket of the same domain.
 */
public enum Domain {
    POLITICS,
    MACRO,
    CRYPTO,
    FINANCE,
    TECH,
    SPORTS,
    ENTERTAINMENT,
    OTHER;

    /**
     * Lower-case label used in the persisted match set.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
