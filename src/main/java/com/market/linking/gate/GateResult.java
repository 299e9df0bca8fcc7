package com.market.linking.gate;

/**
 * Outcome of running a candidate through the quality gate.
 *
 * @param accepted   true when every rule passed
 * @param failedRule the first rule that failed, null when accepted
 * @param reasoning  human-readable explanation, null when accepted
 */
public record GateResult(boolean accepted, GateRule failedRule, String reasoning) {

    private static final GateResult ACCEPTED = new GateResult(true, null, null);

    public GateResult {
        if (accepted && failedRule != null) {
            throw new IllegalArgumentException("An accepted result cannot carry a failed rule");
        }
        if (!accepted && failedRule == null) {
            throw new IllegalArgumentException("A rejected result must name the failed rule");
        }
    }

    public static GateResult accept() {
        return ACCEPTED;
    }

    public static GateResult reject(GateRule rule, String reasoning) {
        return new GateResult(false, rule, reasoning);
    }
}
