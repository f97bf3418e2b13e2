package io.tiller.core.router;

import java.util.Objects;

/// Verdict of one sufficiency check.
///
/// @param verdict what the router should do next, not null
/// @param nextTier tier to fetch next; meaningful for `ESCALATE` and `CONSENT_REQUIRED`
/// @param consentType consent to ask for, non-null only for `CONSENT_REQUIRED`
/// @param message user-facing note, may be null
public record ValidationDecision(
        Verdict verdict, int nextTier, ConsentType consentType, String message) {

    public static final String MAX_TIER_MESSAGE = "Showing results from available sources";

    public enum Verdict {
        SUFFICIENT,
        ESCALATE,
        CONSENT_REQUIRED,
        MAX_TIER_REACHED
    }

    public ValidationDecision {
        Objects.requireNonNull(verdict, "verdict must not be null");
    }

    static ValidationDecision sufficient() {
        return new ValidationDecision(Verdict.SUFFICIENT, 0, null, null);
    }

    static ValidationDecision escalate(int nextTier) {
        return new ValidationDecision(Verdict.ESCALATE, nextTier, null, null);
    }

    static ValidationDecision consentRequired(int nextTier, ConsentType type) {
        return new ValidationDecision(Verdict.CONSENT_REQUIRED, nextTier, type, type.message());
    }

    static ValidationDecision maxTierReached() {
        return new ValidationDecision(Verdict.MAX_TIER_REACHED, 0, null, MAX_TIER_MESSAGE);
    }
}
