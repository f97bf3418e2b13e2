package io.tiller.core.router;

/// Outcome classification of one source call.
public enum FetchStatus {
    SUCCESS,
    TIMEOUT,
    ERROR,
    CIRCUIT_OPEN,
    /// The call waited in the fetch pool for its whole timeout and was never made.
    NOT_STARTED
}
