package io.tiller.core.router;

import java.time.Instant;
import java.util.Objects;

/// Cost and latency record for one source call.
///
/// @param actorId user on whose behalf the call was made, may be null
/// @param sessionId conversation id, not null
/// @param source source name, not null
/// @param tier tier of the call
/// @param costCents charged cost, 0 for failed calls
/// @param latencyMs call latency in milliseconds
/// @param success whether the call succeeded
/// @param error failure description, null on success
/// @param timestamp when the call completed, not null
public record SourceUsage(
        String actorId,
        String sessionId,
        String source,
        int tier,
        int costCents,
        long latencyMs,
        boolean success,
        String error,
        Instant timestamp) {

    public SourceUsage {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
