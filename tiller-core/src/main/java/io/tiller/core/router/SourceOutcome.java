package io.tiller.core.router;

import java.time.Duration;
import java.util.Objects;

/// Result of one source call within a tier.
///
/// @param source source name, not null
/// @param status call outcome, not null
/// @param payload returned data, empty unless `status` is `SUCCESS`
/// @param error failure description, null on success
/// @param latency wall time spent on the call, not null
public record SourceOutcome(
        String source, FetchStatus status, SourcePayload payload, String error, Duration latency) {

    public SourceOutcome {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(status, "status must not be null");
        payload = payload != null ? payload : SourcePayload.empty();
        latency = latency != null ? latency : Duration.ZERO;
    }

    public static SourceOutcome success(String source, SourcePayload payload, Duration latency) {
        return new SourceOutcome(source, FetchStatus.SUCCESS, payload, null, latency);
    }

    public static SourceOutcome failure(
            String source, FetchStatus status, String error, Duration latency) {
        return new SourceOutcome(source, status, SourcePayload.empty(), error, latency);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }
}
