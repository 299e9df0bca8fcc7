package com.market.linking.gate;

/**
 * The acceptance rules of the quality gate, in evaluation order.
 * A rejected candidate is tagged with the first rule it failed.
 */
public enum GateRule {
    /** Text score below the hard floor. */
    MIN_SCORE,

    /** The two records share no entity. */
    SHARED_ENTITY,

    /** Entity overlap ratio below the minimum. */
    ENTITY_OVERLAP,

    /** Opposite wording ("above" vs "below") or conflicting basis-point amounts. */
    SEMANTIC_POLARITY,

    /** The domain requires a shared entity from its own vocabulary and none is shared. */
    DOMAIN_REQUIRED_ENTITY,

    /** Numeric tokens disagree and are not close enough. */
    NUMERIC_CLOSENESS
}
