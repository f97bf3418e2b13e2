package io.tiller.core.router;

import java.time.Instant;
import java.util.Objects;

/// Snapshot of one source's circuit.
///
/// @param status current status, not null
/// @param consecutiveFailures failures since the last success, >= 0
/// @param openedAt when the circuit last opened, null while it has never opened
public record CircuitState(CircuitStatus status, int consecutiveFailures, Instant openedAt) {

    public static final CircuitState INITIAL = new CircuitState(CircuitStatus.CLOSED, 0, null);

    public CircuitState {
        Objects.requireNonNull(status, "status must not be null");
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0");
        }
    }
}
