package io.tiller.core.turn;

/// Status of a processed turn.
public enum TurnStatus {
    /// Required fields are missing; the turn returns follow-up questions.
    CLARIFYING,
    /// The plan ran to completion.
    COMPLETED,
    /// The plan stopped before a consent-gated tier.
    CONSENT_REQUIRED
}
