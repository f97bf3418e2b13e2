package io.tiller.core.execution;

import io.tiller.core.router.ConsentPrompt;
import io.tiller.core.router.RouterCheckpoint;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Result of running one capability.
///
/// @param capability capability name, not null
/// @param status run status, not null
/// @param output named output values, never null
/// @param error failure description, null unless `status` is `FAILURE`
/// @param consentPrompt prompt to show, non-null only for `CONSENT_REQUIRED`
/// @param checkpoint routing progress to continue from once consent is given, may be
///        null even for `CONSENT_REQUIRED`
public record CapabilityOutcome(
        String capability,
        OutcomeStatus status,
        Map<String, Object> output,
        String error,
        ConsentPrompt consentPrompt,
        RouterCheckpoint checkpoint) {

    public CapabilityOutcome {
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(status, "status must not be null");
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }

    public static CapabilityOutcome success(String capability, Map<String, Object> output) {
        return new CapabilityOutcome(capability, OutcomeStatus.SUCCESS, output, null, null, null);
    }

    public static CapabilityOutcome failure(String capability, String error) {
        return new CapabilityOutcome(capability, OutcomeStatus.FAILURE, Map.of(), error, null, null);
    }

    public boolean isFailure() {
        return status == OutcomeStatus.FAILURE;
    }

    public Optional<ConsentPrompt> prompt() {
        return Optional.ofNullable(consentPrompt);
    }
}
