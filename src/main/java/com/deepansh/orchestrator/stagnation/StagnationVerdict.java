package com.deepansh.orchestrator.stagnation;

/**
 * Outcome of a stagnation evaluation. {@code check} and {@code reason} are null when not stagnant.
 */
public record StagnationVerdict(
        boolean stagnant,
        StagnationCheck check,
        String reason,
        double confidence
) {
    private static final StagnationVerdict NOT_STAGNANT = new StagnationVerdict(false, null, null, 0.0);

    public static StagnationVerdict notStagnant() {
        return NOT_STAGNANT;
    }

    public static StagnationVerdict stagnant(StagnationCheck check, String reason, double confidence) {
        return new StagnationVerdict(true, check, reason, Math.min(confidence, 1.0));
    }
}
