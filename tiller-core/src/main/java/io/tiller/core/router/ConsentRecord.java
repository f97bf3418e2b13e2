package io.tiller.core.router;

import java.time.Instant;
import java.util.Objects;

/// Audit entry written each time a consent-gated tier is entered.
///
/// @param actorId consenting user, may be null for anonymous sessions
/// @param sessionId conversation id, not null
/// @param tierRequested gated tier that was entered
/// @param timestamp when the tier was entered, not null
public record ConsentRecord(String actorId, String sessionId, int tierRequested, Instant timestamp) {

    public ConsentRecord {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
