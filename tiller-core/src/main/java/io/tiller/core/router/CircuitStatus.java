package io.tiller.core.router;

/// Status of a per-source circuit breaker.
public enum CircuitStatus {
    /// Calls flow normally.
    CLOSED,
    /// Calls are suppressed until the reset timeout elapses.
    OPEN,
    /// One trial call has been permitted; its result decides the next status.
    HALF_OPEN
}
