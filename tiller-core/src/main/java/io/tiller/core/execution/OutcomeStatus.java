package io.tiller.core.execution;

/// Status of one capability run.
public enum OutcomeStatus {
    /// The capability produced its output.
    SUCCESS,
    /// The capability produced output from fewer sources than it wanted.
    PARTIAL,
    /// The capability needs user consent before it can go further.
    CONSENT_REQUIRED,
    /// The capability failed; its output is empty.
    FAILURE
}
