package io.tiller.core.execution;

import io.tiller.core.router.RouterCheckpoint;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Where a plan stopped for consent, kept so that a confirming turn can continue
/// the plan instead of running it again.
///
/// ### Contracts
/// - **Invariant**: `completed` holds no `CONSENT_REQUIRED` outcome
/// - **Invariant**: every checkpoint belongs to a capability of step `stepId`
///
/// @param stepId id of the step that raised the consent prompt, not null
/// @param utterance user message of the halted turn, never null
/// @param completed outcomes of every capability that finished, in run order, never null
/// @param checkpoints routing progress keyed by halted capability, never null
public record ConsentHalt(
        String stepId,
        String utterance,
        List<CapabilityOutcome> completed,
        Map<String, RouterCheckpoint> checkpoints) {

    public ConsentHalt {
        Objects.requireNonNull(stepId, "stepId must not be null");
        utterance = utterance != null ? utterance : "";
        completed = completed != null ? List.copyOf(completed) : List.of();
        if (completed.stream().anyMatch(o -> o.status() == OutcomeStatus.CONSENT_REQUIRED)) {
            throw new IllegalArgumentException("completed outcomes must not ask for consent");
        }
        checkpoints =
                checkpoints != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(checkpoints))
                        : Map.of();
    }

    /// Captures a plan halted after `stepId`.
    ///
    /// @param stepId halted step, not null
    /// @param utterance user message of the turn, may be null
    /// @param outcomes every outcome so far, including the consent stops, not null
    /// @return halt record, never null
    static ConsentHalt at(String stepId, String utterance, List<CapabilityOutcome> outcomes) {
        Map<String, RouterCheckpoint> checkpoints = new LinkedHashMap<>();
        for (CapabilityOutcome outcome : outcomes) {
            if (outcome.status() == OutcomeStatus.CONSENT_REQUIRED && outcome.checkpoint() != null) {
                checkpoints.put(outcome.capability(), outcome.checkpoint());
            }
        }
        List<CapabilityOutcome> completed =
                outcomes.stream()
                        .filter(o -> o.status() != OutcomeStatus.CONSENT_REQUIRED)
                        .toList();
        return new ConsentHalt(stepId, utterance, completed, checkpoints);
    }

    public boolean isCompleted(String capability) {
        return completed.stream().anyMatch(o -> o.capability().equals(capability));
    }
}
